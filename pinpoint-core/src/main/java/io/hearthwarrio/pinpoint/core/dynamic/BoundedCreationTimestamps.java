package io.hearthwarrio.pinpoint.core.dynamic;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Insertion-ordered store holding at most {@code capacity} entries; the oldest insertion is evicted first.
 * <p>
 * Used for hosts whose node keys are detached identifiers (remote element references) that the JVM cannot
 * observe becoming unreachable. Re-recording a key moves it to the young end.
 */
public final class BoundedCreationTimestamps implements CreationTimestamps {

    private final int capacity;
    private final LinkedHashMap<Object, Instant> timestamps;

    public BoundedCreationTimestamps(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.timestamps = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Object, Instant> eldest) {
                return size() > BoundedCreationTimestamps.this.capacity;
            }
        };
    }

    @Override
    public void record(Object nodeKey, Instant insertedAt) {
        Objects.requireNonNull(nodeKey, "nodeKey must not be null");
        Objects.requireNonNull(insertedAt, "insertedAt must not be null");
        timestamps.remove(nodeKey);
        timestamps.put(nodeKey, insertedAt);
    }

    @Override
    public Optional<Instant> insertedAt(Object nodeKey) {
        if (nodeKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(timestamps.get(nodeKey));
    }

    @Override
    public void forget(Object nodeKey) {
        if (nodeKey != null) {
            timestamps.remove(nodeKey);
        }
    }

    @Override
    public void clear() {
        timestamps.clear();
    }

    @Override
    public int size() {
        return timestamps.size();
    }

    public int capacity() {
        return capacity;
    }
}

package io.hearthwarrio.pinpoint.core.dynamic;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.WeakHashMap;

/**
 * Weak-keyed store: an entry disappears once the host element it is keyed by becomes unreachable.
 * <p>
 * Only meaningful when node keys are the live host objects themselves and compare by identity
 * (jsoup elements, for example).
 */
public final class WeakCreationTimestamps implements CreationTimestamps {

    private final Map<Object, Instant> timestamps = new WeakHashMap<>();

    @Override
    public void record(Object nodeKey, Instant insertedAt) {
        Objects.requireNonNull(nodeKey, "nodeKey must not be null");
        Objects.requireNonNull(insertedAt, "insertedAt must not be null");
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
}

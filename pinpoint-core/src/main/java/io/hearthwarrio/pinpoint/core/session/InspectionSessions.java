package io.hearthwarrio.pinpoint.core.session;

import io.hearthwarrio.pinpoint.core.EngineSettings;
import io.hearthwarrio.pinpoint.core.PinpointEngine;
import io.hearthwarrio.pinpoint.core.dynamic.DynamicInsertionDetector;
import io.hearthwarrio.pinpoint.core.dynamic.MutationTracker;
import io.hearthwarrio.pinpoint.core.tree.DocumentTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Creates inspection sessions, at most one per document.
 * <p>
 * Asking again for a document that already has a session returns that session. The owner passes this
 * factory (or the sessions it returns) to whatever captures selection events.
 */
public final class InspectionSessions {

    private static final Logger logger = LoggerFactory.getLogger(InspectionSessions.class);

    private final EngineSettings settings;
    private final Clock clock;
    private final Map<Object, OpenSession> sessions = new HashMap<>();

    public InspectionSessions() {
        this(EngineSettings.defaults(), Clock.systemUTC());
    }

    public InspectionSessions(EngineSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public InspectionSession open(DocumentTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        Object key = Objects.requireNonNull(tree.documentKey(), "documentKey must not be null");

        OpenSession existing = sessions.get(key);
        if (existing != null) {
            logger.debug("Reusing inspection session for document {}", key);
            return existing.session;
        }

        MutationTracker tracker = new MutationTracker(tree.newTimestampStore(settings.getTimestampCapacity()));
        DynamicInsertionDetector detector = new DynamicInsertionDetector(tracker, clock, settings.getDynamicWindow());
        InspectionSession session = new InspectionSession(new PinpointEngine(tree, detector, settings), tracker);
        tree.addInsertionListener(tracker);

        sessions.put(key, new OpenSession(tree, session));
        logger.debug("Opened inspection session for document {}", key);
        return session;
    }

    public Optional<InspectionSession> find(DocumentTree tree) {
        OpenSession open = tree == null ? null : sessions.get(tree.documentKey());
        return open == null ? Optional.empty() : Optional.of(open.session);
    }

    /**
     * Tears the session down (stop plus reset) and forgets it; a later {@link #open} starts fresh.
     */
    public void close(DocumentTree tree) {
        if (tree == null) {
            return;
        }
        OpenSession open = sessions.remove(tree.documentKey());
        if (open != null) {
            open.session.clearAll();
            open.tree.removeInsertionListener(open.session.getTracker());
            open.session.getTracker().clear();
        }
    }

    public int size() {
        return sessions.size();
    }

    public EngineSettings getSettings() {
        return settings;
    }

    private static final class OpenSession {
        private final DocumentTree tree;
        private final InspectionSession session;

        private OpenSession(DocumentTree tree, InspectionSession session) {
            this.tree = tree;
            this.session = session;
        }
    }
}

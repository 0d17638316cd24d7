package io.hearthwarrio.pinpoint.core.session;

import io.hearthwarrio.pinpoint.core.FakeTree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InspectionSessionsTest {
    private final InspectionSessions sessions = new InspectionSessions();

    @Test
    void sameDocumentGetsSameSession() {
        FakeTree tree = new FakeTree();

        InspectionSession first = sessions.open(tree);
        InspectionSession second = sessions.open(tree);

        assertSame(first, second);
        assertEquals(1, sessions.size());
        assertEquals(1, tree.listenerCount());
    }

    @Test
    void differentDocumentsGetDifferentSessions() {
        assertNotSame(sessions.open(new FakeTree()), sessions.open(new FakeTree()));
        assertEquals(2, sessions.size());
    }

    @Test
    void closeTearsDownAndForgets() {
        FakeTree tree = new FakeTree();
        InspectionSession session = sessions.open(tree).start();

        sessions.close(tree);

        assertFalse(session.isInspecting());
        assertEquals(0, tree.listenerCount());
        assertFalse(sessions.find(tree).isPresent());
        assertNotSame(session, sessions.open(tree));
    }
}

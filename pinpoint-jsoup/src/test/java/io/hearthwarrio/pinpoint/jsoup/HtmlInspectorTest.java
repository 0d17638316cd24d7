package io.hearthwarrio.pinpoint.jsoup;

import io.hearthwarrio.pinpoint.core.SelectionRecord;
import io.hearthwarrio.pinpoint.core.session.InspectionSessions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlInspectorTest {

    @Test
    void unknownOrInvalidQueryGivesNothing() {
        HtmlInspector inspector = HtmlInspector.of("<p>hi</p>");

        assertTrue(inspector.inspect("table").isEmpty());
        assertTrue(inspector.inspect("p[[[").isEmpty());
        assertTrue(inspector.inspectAll("p[[[").isEmpty());
    }

    @Test
    void selectionGoesThroughSessionStateMachine() {
        HtmlInspector inspector = HtmlInspector.of("<button id=\"go\">Go</button><button id=\"stop\">Stop</button>");
        List<Integer> sizes = new ArrayList<>();
        inspector.session().withListener(selection -> sizes.add(selection.size()));

        assertTrue(inspector.select("#go").isEmpty());

        inspector.session().start();
        SelectionRecord go = inspector.select("#go").orElseThrow();
        inspector.select("#stop");
        assertTrue(inspector.select("#go").isEmpty());

        assertEquals("#go", go.getStructuralSelector());
        assertEquals(1, inspector.session().getSelection().size());
        assertEquals(List.of(1, 2, 1), sizes);
    }

    @Test
    void oneSessionPerDocument() {
        JsoupDocumentTree tree = JsoupDocumentTree.parse("<p>hi</p>");
        InspectionSessions sessions = new InspectionSessions();

        HtmlInspector first = new HtmlInspector(tree, sessions);
        HtmlInspector second = new HtmlInspector(tree, sessions);

        assertSame(first.session(), second.session());
    }
}

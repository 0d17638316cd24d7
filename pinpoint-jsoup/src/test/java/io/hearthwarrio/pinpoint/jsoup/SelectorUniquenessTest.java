package io.hearthwarrio.pinpoint.jsoup;

import io.hearthwarrio.pinpoint.core.PinpointEngine;
import io.hearthwarrio.pinpoint.core.StrategyKind;
import io.hearthwarrio.pinpoint.core.SynthesizedSelector;
import io.hearthwarrio.pinpoint.core.session.InspectionSessions;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SelectorUniquenessTest {

    @Test
    void synthesizedSelectorsResolveToTheirElement() throws IOException {
        JsoupDocumentTree tree = JsoupDocumentTree.parse(resource("/pages/shop.html"));
        PinpointEngine engine = new InspectionSessions().open(tree).getEngine();
        List<TreeNode> elements = tree.bodyElements();

        int resolved = 0;
        for (TreeNode node : elements) {
            SynthesizedSelector selector = engine.synthesizeSelector(node);
            List<TreeNode> matches = tree.querySelectorAll(selector.getSelector());

            if (selector.isUnique()) {
                assertEquals(List.of(node), matches, "selector " + selector.getSelector());
                resolved++;
            }
        }

        assertTrue(elements.size() > 50);
        assertTrue(resolved >= elements.size() * 0.95, resolved + " of " + elements.size());
    }

    @Test
    void scoresOnRealPageStayInBounds() throws IOException {
        JsoupDocumentTree tree = JsoupDocumentTree.parse(resource("/pages/shop.html"));
        HtmlInspector inspector = new HtmlInspector(tree, new InspectionSessions());

        inspector.inspectAll("body *").forEach(record -> record.getCandidates().forEach(c -> {
            assertTrue(c.getScore() >= 0 && c.getScore() <= 100, c.toString());
            if (c.getKind() == StrategyKind.XPATH) {
                assertEquals(0, c.getScore());
            }
        }));
    }

    @Test
    void fallbackChainsStayWithinCardinality() throws IOException {
        JsoupDocumentTree tree = JsoupDocumentTree.parse(resource("/pages/shop.html"));
        HtmlInspector inspector = new HtmlInspector(tree, new InspectionSessions());

        inspector.inspectAll("body *").forEach(record -> {
            assertTrue(count(record.getPlaywrightLocator(), ".or(") <= 2, record.getPlaywrightLocator());
            assertTrue(count(record.getSeleniumLocator(), "driver.findElement(") <= 2, record.getSeleniumLocator());
            boolean waitsA = record.getPlaywrightLocator().contains("waitForSelector");
            boolean waitsB = record.getSeleniumLocator().contains("WebDriverWait");
            assertEquals(record.isDynamic(), waitsA);
            assertEquals(record.isDynamic(), waitsB);
        });
    }

    private static int count(String text, String needle) {
        int n = 0;
        int i = text.indexOf(needle);
        while (i >= 0) {
            n++;
            i = text.indexOf(needle, i + needle.length());
        }
        return n;
    }

    private static String resource(String path) throws IOException {
        try (InputStream in = SelectorUniquenessTest.class.getResourceAsStream(path)) {
            assertNotNull(in, "missing test resource " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

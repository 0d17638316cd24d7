package io.hearthwarrio.pinpoint.core;

import org.junit.jupiter.api.Test;

import static io.hearthwarrio.pinpoint.core.FakeNode.element;
import static org.junit.jupiter.api.Assertions.*;

public class SemanticContextResolverTest {
    private final SemanticContextResolver resolver = new SemanticContextResolver(EngineSettings.defaults());

    @Test
    void landmarkAncestorBecomesTagQualifier() {
        FakeNode input = element("input");
        element("form").append(element("div").append(input));

        SemanticContext context = resolver.resolveContext(input);

        assertEquals("locator('form')", context.getAncestorQualifier());
        assertEquals("locator('form').", context.scopePrefix());
        assertFalse(context.hasLabel());
    }

    @Test
    void testIdOnAncestorIsPreferredOverTag() {
        FakeNode button = element("button");
        element("section").attr("data-testid", "checkout").append(button);

        assertEquals("getByTestId('checkout')", resolver.resolveContext(button).getAncestorQualifier());
    }

    @Test
    void ariaLabelledAncestorBecomesRegion() {
        FakeNode button = element("button");
        element("div").attr("aria-label", "Billing").append(element("span").append(button));

        assertEquals("getByRole('region', { name: 'Billing' })",
                resolver.resolveContext(button).getAncestorQualifier());
    }

    @Test
    void closestMatchingAncestorWins() {
        FakeNode input = element("input");
        element("main").append(element("form").append(input));

        assertEquals("locator('form')", resolver.resolveContext(input).getAncestorQualifier());
    }

    @Test
    void ancestorsBeyondProbeDepthAreIgnored() {
        FakeNode span = element("span");
        element("form").append(element("div").append(element("div").append(element("div").append(element("div").append(span)))));

        assertSame(SemanticContext.NONE, resolver.resolveContext(span));
    }

    @Test
    void precedingLabelGivesLabelQualifierWithPrecedence() {
        FakeNode input = element("input").attr("name", "pincode");
        element("form").append(element("label").text("  PIN\n Code "), input);

        SemanticContext context = resolver.resolveContext(input);

        assertEquals("getByLabel('PIN Code')", context.getLabelQualifier());
        assertEquals("PIN Code", context.getLabelText());
        assertEquals("getByLabel('PIN Code')", context.primaryQualifier());
        assertEquals("locator('form')", context.getAncestorQualifier());
    }

    @Test
    void labelProbeOnlyAppliesToFormControls() {
        FakeNode span = element("span");
        element("div").append(element("label").text("Name"), span);

        assertFalse(resolver.resolveContext(span).hasLabel());
    }

    @Test
    void emptyLabelIsIgnored() {
        FakeNode input = element("input");
        element("div").append(element("label").text("   "), input);

        assertSame(SemanticContext.NONE, resolver.resolveContext(input));
    }

    @Test
    void labelTextQuotesAreEscaped() {
        FakeNode input = element("input");
        element("div").append(element("label").text("Owner's name"), input);

        assertEquals("getByLabel('Owner\\'s name')", resolver.resolveContext(input).getLabelQualifier());
    }
}

package io.hearthwarrio.pinpoint.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LocatorLiteralsTest {

    @Test
    void singleQuotesAreBackslashEscapedInBothGrammars() {
        assertEquals("'Don\\'t panic'", LocatorLiterals.singleQuoted("Don't panic"));
        assertEquals("\"Don\\'t \\\"panic\\\"\"", LocatorLiterals.javaString("Don't \"panic\""));
    }

    @Test
    void cssIdentifierEscapesSpecialCharacters() {
        assertEquals("user\\.name", LocatorLiterals.cssIdentifier("user.name"));
        assertEquals("a\\:b", LocatorLiterals.cssIdentifier("a:b"));
        assertEquals("plain-id_1", LocatorLiterals.cssIdentifier("plain-id_1"));
        assertEquals("\\31 abc", LocatorLiterals.cssIdentifier("1abc"));
        assertEquals("-\\32 x", LocatorLiterals.cssIdentifier("-2x"));
        assertEquals("a1", LocatorLiterals.cssIdentifier("a1"));
    }

    @Test
    void xpathLiteralPicksQuotesThatDoNotClash() {
        assertEquals("'a'", LocatorLiterals.xpath("a"));
        assertEquals("\"it's\"", LocatorLiterals.xpath("it's"));
        assertEquals("concat('a', \"'\", '\"b')", LocatorLiterals.xpath("a'\"b"));
    }
}

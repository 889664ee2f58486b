package com.flowpascal.playground.translator.pascal;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public final class PascalStringsTest {

    @Test
    void doubleQuotedLiteralsBecomePascalLiterals() {
        assertEquals("s = 'it''s'", PascalStrings.rewriteStringLiterals("s = \"it's\""));
        assertEquals("'a' + 'b'", PascalStrings.rewriteStringLiterals("\"a\" + 'b'"));
    }

    @Test
    void unterminatedQuoteIsCopied() {
        assertEquals("x = \"abc", PascalStrings.rewriteStringLiterals("x = \"abc"));
    }

    @Test
    void identifiersSkipLiteralsAndReservedWords() {
        assertEquals(List.of("x", "z", "w"),
            PascalStrings.identifiers("x + 'y' + abs(z) div w"));
    }

    @Test
    void notEqualsIsSpelledThePascalWay() {
        assertEquals("a <> b", PascalStrings.toPascalOperators("a != b"));
    }

    @Test
    void quotedLiteralDetection() {
        assertTrue(PascalStrings.isQuotedLiteral("\"x\""));
        assertTrue(PascalStrings.isQuotedLiteral("''"));
        assertFalse(PascalStrings.isQuotedLiteral("'"));
        assertFalse(PascalStrings.isQuotedLiteral("x"));
    }
}

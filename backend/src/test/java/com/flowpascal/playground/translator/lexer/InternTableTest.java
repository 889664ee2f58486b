package com.flowpascal.playground.translator.lexer;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public final class InternTableTest {

    @Test
    void idsStartAtOneAndRepeatForEqualText() {
        InternTable table = new InternTable();

        assertEquals(1, table.intern("x := 1"));
        assertEquals(2, table.intern("y := 2"));
        assertEquals(1, table.intern("x := 1"));
        assertEquals(2, table.size());
    }

    @Test
    void lookupIsExactText() {
        InternTable table = new InternTable();
        table.intern("a");

        assertEquals(Optional.of(1), table.lookup("a"));
        assertTrue(table.lookup("A").isEmpty());
    }

    @Test
    void putOverwritesAndKeepsLaterIdsUnique() {
        InternTable table = new InternTable();
        table.intern("a");
        table.put("a", 5);

        assertEquals(Optional.of(5), table.lookup("a"));
        assertEquals(6, table.intern("b"));
    }
}

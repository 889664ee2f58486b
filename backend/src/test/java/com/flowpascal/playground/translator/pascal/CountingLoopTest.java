package com.flowpascal.playground.translator.pascal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public final class CountingLoopTest {

    @Test
    void ascendingLoop() {
        CountingLoop loop = CountingLoop.match("i := 1 to 10").orElseThrow();

        assertEquals("i", loop.counter());
        assertEquals("1", loop.start());
        assertEquals("10", loop.end());
        assertEquals(CountingLoop.Direction.ASCENDING, loop.direction());
    }

    @Test
    void descendingLoopWithExpressionBounds() {
        CountingLoop loop = CountingLoop.match("k:=n - 1 downto 0").orElseThrow();

        assertEquals("k", loop.counter());
        assertEquals("n - 1", loop.start());
        assertEquals("DOWNTO", loop.direction().keyword());
    }

    @Test
    void directionKeywordIsCaseInsensitive() {
        assertTrue(CountingLoop.match("I := 1 TO N").isPresent());
    }

    @Test
    void otherConditionsDoNotMatch() {
        assertTrue(CountingLoop.match("x < 10").isEmpty());
        assertTrue(CountingLoop.match("i := 1 tomorrow").isEmpty());
        assertTrue(CountingLoop.match("i = 1 to 10").isEmpty());
        assertTrue(CountingLoop.match(null).isEmpty());
    }
}

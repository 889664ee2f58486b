package com.flowpascal.playground.translator.semantic;

public record ArrayBounds(int low, int high) {

    public static final ArrayBounds DEFAULT = new ArrayBounds(0, 100);
}

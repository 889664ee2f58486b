package com.flowpascal.playground.dto;

import com.flowpascal.playground.translator.semantic.Symbol;

public record SymbolInfo(
    String name,
    String type,
    boolean declared,
    int line,
    int pos
) {

    public static SymbolInfo from(Symbol symbol) {
        return new SymbolInfo(symbol.getName(), symbol.getType(), symbol.isDeclared(), symbol.getLine(), symbol.getPos());
    }
}

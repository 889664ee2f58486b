package com.flowpascal.playground.translator.semantic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SymbolTable {

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final ArrayBounds defaultBounds;

    public SymbolTable() {
        this(ArrayBounds.DEFAULT);
    }

    public SymbolTable(ArrayBounds defaultBounds) {
        this.defaultBounds = defaultBounds;
    }

    /**
     * Adds {@code name} or merges new evidence into the existing symbol.
     * <p>
     * On re-definition the base type only widens from integer to real, the array
     * flag and the declared flag never revert, and the earliest line is kept.
     *
     * @param bounds explicit array bounds, or {@code null} for the default range
     */
    public Symbol define(String name, BaseType type, boolean isArray, ArrayBounds bounds,
            boolean declared, int line, int pos) {
        Symbol existing = symbols.get(name);
        if (existing == null) {
            Symbol symbol = new Symbol(name, type, isArray, bounds != null ? bounds : defaultBounds,
                    declared, line, pos);
            symbols.put(name, symbol);
            return symbol;
        }

        if (isArray) {
            existing.markArray(bounds);
        }
        existing.widenTo(type);
        if (declared) {
            existing.markDeclared();
        }
        if (line < existing.getLine()) {
            existing.moveTo(line, pos);
        }
        return existing;
    }

    public Symbol define(String name, BaseType type, boolean declared, int line, int pos) {
        return define(name, type, false, null, declared, line, pos);
    }

    public Symbol reference(String name, int line, int pos) {
        return define(name, BaseType.INTEGER, false, line, pos);
    }

    public Optional<Symbol> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public List<Symbol> getAllSymbols() {
        return new ArrayList<>(symbols.values());
    }

    public int size() {
        return symbols.size();
    }
}

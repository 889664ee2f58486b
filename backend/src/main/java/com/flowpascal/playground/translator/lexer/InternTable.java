package com.flowpascal.playground.translator.lexer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InternTable {

    private final Map<String, Integer> ids = new LinkedHashMap<>();
    private int nextId = 1;

    public int intern(String text) {
        Integer existing = ids.get(text);
        if (existing != null) {
            return existing;
        }
        int id = nextId++;
        ids.put(text, id);
        return id;
    }

    public Optional<Integer> lookup(String text) {
        return Optional.ofNullable(ids.get(text));
    }

    public void put(String text, int id) {
        ids.put(text, id);
        if (id >= nextId) {
            nextId = id + 1;
        }
    }

    public int size() {
        return ids.size();
    }

    public Map<String, Integer> entries() {
        return Collections.unmodifiableMap(ids);
    }
}

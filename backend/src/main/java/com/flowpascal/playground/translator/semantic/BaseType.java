package com.flowpascal.playground.translator.semantic;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BaseType {
    INTEGER("integer"),
    REAL("real"),
    BOOLEAN("boolean"),
    STRING("string");

    private final String pascalName;

    BaseType(String pascalName) {
        this.pascalName = pascalName;
    }

    @JsonValue
    public String pascalName() {
        return pascalName;
    }
}

package com.flowpascal.playground.translator.diagnostic;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiagnosticSource {
    LEXER("lexer"),
    PARSER("parser"),
    SEMANTIC("semantic"),
    GENERATOR("generator"),
    REQUEST("request");

    private final String label;

    DiagnosticSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

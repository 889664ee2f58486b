package com.flowpascal.playground.translator.diagnostic;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

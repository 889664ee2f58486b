package com.flowpascal.playground.translator.diagnostic;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Uniform error/warning record shared by every translation stage.
 * <p>
 * {@code line} and {@code pos} are 1-based source coordinates, or both {@code -1}
 * when the problem cannot be attributed to a position (end of input, request errors).
 */
public record Diagnostic(
        Severity type,
        int line,
        int pos,
        String message,
        DiagnosticSource source) {

    public static final int UNKNOWN_POSITION = -1;

    public static Diagnostic error(DiagnosticSource source, int line, int pos, String message) {
        return new Diagnostic(Severity.ERROR, line, pos, message, source);
    }

    public static Diagnostic warning(DiagnosticSource source, int line, int pos, String message) {
        return new Diagnostic(Severity.WARNING, line, pos, message, source);
    }

    public static Diagnostic unattributed(DiagnosticSource source, String message) {
        return new Diagnostic(Severity.ERROR, UNKNOWN_POSITION, UNKNOWN_POSITION, message, source);
    }

    @JsonIgnore
    public boolean isError() {
        return type == Severity.ERROR;
    }

    @Override
    public String toString() {
        if (line == UNKNOWN_POSITION) {
            return source.label() + " " + type.label() + ": " + message;
        }
        return source.label() + " " + type.label() + " (" + line + "," + pos + "): " + message;
    }
}

package com.flowpascal.playground.exception;

import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.diagnostic.DiagnosticSource;

public class TranslationException extends Exception {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.unattributed(DiagnosticSource.REQUEST, getMessage());
    }
}

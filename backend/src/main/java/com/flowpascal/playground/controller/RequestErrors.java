package com.flowpascal.playground.controller;

import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.diagnostic.DiagnosticSource;

import org.springframework.web.bind.MethodArgumentNotValidException;

final class RequestErrors {

    private RequestErrors() {
    }

    static Diagnostic invalidArguments(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        return Diagnostic.unattributed(DiagnosticSource.REQUEST, errorMessage.toString().strip());
    }

    static Diagnostic unreadableBody() {
        return Diagnostic.unattributed(DiagnosticSource.REQUEST, "Request body is missing or is not valid JSON");
    }

    static Diagnostic internal(Exception e) {
        return Diagnostic.unattributed(DiagnosticSource.REQUEST, "Internal server error: " + e.getMessage());
    }
}

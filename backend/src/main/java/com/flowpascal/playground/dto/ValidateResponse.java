package com.flowpascal.playground.dto;

import com.flowpascal.playground.translator.diagnostic.Diagnostic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateResponse(
        boolean success,
        List<Diagnostic> errors,
        List<Diagnostic> warnings,
        String message,
        List<DiagramToken> tokens,
        long analysisTimeMs) {

    public static ValidateResponse of(List<Diagnostic> errors, List<Diagnostic> warnings, List<DiagramToken> tokens,
            long analysisTimeMs) {
        boolean success = errors.isEmpty();
        return new ValidateResponse(
                success,
                errors,
                warnings,
                success ? "Validation completed" : "Errors found",
                tokens,
                analysisTimeMs);
    }

    public static ValidateResponse requestError(Diagnostic error) {
        return new ValidateResponse(false, List.of(error), List.of(), "Errors found", null, 0);
    }

    @JsonIgnore
    public boolean rejected() {
        return tokens == null;
    }
}

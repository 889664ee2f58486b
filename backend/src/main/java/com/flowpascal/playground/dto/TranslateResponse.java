package com.flowpascal.playground.dto;

import com.flowpascal.playground.translator.diagnostic.Diagnostic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslateResponse(
        boolean success,
        String pascalCode,
        List<Diagnostic> errors,
        List<Diagnostic> warnings,
        List<SymbolInfo> symbols,
        String astDebug,
        AstNodeView ast,
        Long translationTimeMs,
        String resultType
) {

    public static final String SUCCESS = "success";
    public static final String GENERATION_ERROR = "generation_error";

    public static TranslateResponse generated(String pascalCode, List<Diagnostic> errors, List<Diagnostic> warnings,
            List<SymbolInfo> symbols, String astDebug, AstNodeView ast, long translationTimeMs) {
        return new TranslateResponse(
                errors.isEmpty(),
                pascalCode,
                errors,
                warnings,
                symbols,
                astDebug,
                ast,
                translationTimeMs,
                errors.isEmpty() ? SUCCESS : GENERATION_ERROR);
    }

    // errors must not be empty
    public static TranslateResponse stageFailure(List<Diagnostic> errors, List<Diagnostic> warnings,
            long translationTimeMs) {
        return new TranslateResponse(
                false,
                "",
                errors,
                warnings,
                null,
                null,
                null,
                translationTimeMs,
                errors.get(0).source().label() + "_error");
    }

    public static TranslateResponse requestError(Diagnostic error) {
        return new TranslateResponse(
                false,
                "",
                List.of(error),
                List.of(),
                null,
                null,
                null,
                null,
                error.source().label() + "_error");
    }

    @JsonIgnore
    public boolean reachedGeneration() {
        return SUCCESS.equals(resultType) || GENERATION_ERROR.equals(resultType);
    }
}

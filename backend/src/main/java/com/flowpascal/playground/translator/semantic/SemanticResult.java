package com.flowpascal.playground.translator.semantic;

import com.flowpascal.playground.translator.diagnostic.Diagnostic;

import java.util.List;

public record SemanticResult(SymbolTable symbolTable, List<Diagnostic> errors, List<Diagnostic> warnings) {

    public boolean success() {
        return errors.isEmpty();
    }
}

package com.flowpascal.playground.translator;

import com.flowpascal.playground.translator.ast.Node;
import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.lexer.Token;
import com.flowpascal.playground.translator.semantic.SymbolTable;

import java.util.List;

public record TranslationResult(
        String code,
        boolean generated,
        List<Diagnostic> errors,
        List<Diagnostic> warnings,
        List<Token> tokens,
        Node ast,
        SymbolTable symbolTable) {

    public boolean success() {
        return errors.isEmpty();
    }
}

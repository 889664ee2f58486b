package com.flowpascal.playground.translator.lexer;

import com.flowpascal.playground.translator.diagnostic.Diagnostic;

import java.util.List;

public record ScanResult(
        List<Token> tokens,
        boolean success,
        List<Diagnostic> diagnostics,
        InternTable actionTable,
        InternTable conditionTable) {
}

package com.flowpascal.playground.translator.parser;

import com.flowpascal.playground.translator.ast.Node;
import com.flowpascal.playground.translator.diagnostic.Diagnostic;

import java.util.List;

public record ParseResult(Node root, boolean success, List<Diagnostic> diagnostics) {
}

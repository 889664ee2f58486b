package com.flowpascal.playground.translator.semantic;

import com.flowpascal.playground.translator.ast.Node;
import com.flowpascal.playground.translator.ast.NodeKind;
import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.diagnostic.DiagnosticSource;
import com.flowpascal.playground.translator.pascal.ActionContent;
import com.flowpascal.playground.translator.pascal.CountingLoop;
import com.flowpascal.playground.translator.pascal.PascalReservedWords;
import com.flowpascal.playground.translator.pascal.PascalStrings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class SemanticAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final ArrayBounds defaultBounds;

    private SymbolTable symbolTable;
    private List<Diagnostic> errors;
    private List<Diagnostic> warnings;

    public SemanticAnalyzer() {
        this(ArrayBounds.DEFAULT);
    }

    public SemanticAnalyzer(ArrayBounds defaultBounds) {
        this.defaultBounds = defaultBounds;
    }

    public SemanticResult analyze(Node root) {
        symbolTable = new SymbolTable(defaultBounds);
        errors = new ArrayList<>();
        warnings = new ArrayList<>();

        visit(root);

        logger.debug("Semantic analysis found {} symbols, {} errors, {} warnings",
                symbolTable.size(), errors.size(), warnings.size());
        return new SemanticResult(symbolTable, List.copyOf(errors), List.copyOf(warnings));
    }

    private void visit(Node node) {
        if (node == null) {
            return;
        }
        String value = node.value();
        if (value != null && !value.isBlank()) {
            if (node.kind() == NodeKind.ACTION_CONTENT) {
                analyzeAction(value, node.line(), node.pos());
            } else if (node.kind() == NodeKind.CONDITION_CONTENT) {
                analyzeCondition(value, node.line(), node.pos());
            }
        }
        for (Node child : node.children()) {
            visit(child);
        }
    }

    private void analyzeAction(String content, int line, int pos) {
        ActionContent action = ActionContent.classify(content);

        if (action instanceof ActionContent.Input input) {
            for (String entry : input.entries()) {
                if (PascalStrings.isIdentifier(entry)) {
                    symbolTable.define(entry, BaseType.INTEGER, true, line, pos);
                } else {
                    error(line, pos, "Invalid variable name in input: '" + entry + "'");
                }
            }
        } else if (action instanceof ActionContent.Output output) {
            if (output.items().isEmpty()) {
                warning(line, pos, "Empty output");
                return;
            }
            for (String item : output.items()) {
                if (!PascalStrings.isQuotedLiteral(item) && PascalStrings.isIdentifier(item)
                        && !PascalReservedWords.isReserved(item)) {
                    use(item, "output", line, pos);
                }
            }
        } else if (action instanceof ActionContent.ArrayAssignment assignment) {
            BaseType elementType = TypeInference.infer(assignment.value(), symbolTable);
            symbolTable.define(assignment.name(), elementType, true, null, true, line, pos);
            for (String name : PascalStrings.identifiers(assignment.index())) {
                symbolTable.reference(name, line, pos);
            }
        } else if (action instanceof ActionContent.ScalarAssignment assignment) {
            BaseType type = TypeInference.infer(assignment.value(), symbolTable);
            symbolTable.define(assignment.name(), type, true, line, pos);
            for (String name : PascalStrings.identifiers(assignment.value())) {
                if (!name.equals(assignment.name())) {
                    use(name, "an expression", line, pos);
                }
            }
        } else {
            error(line, pos, "Invalid block content: '" + content.strip() + "'. Only '"
                    + ActionContent.INPUT_MARKER + " ...', '" + ActionContent.OUTPUT_MARKER
                    + " ...' or 'variable := expression' are permitted.");
        }
    }

    private void analyzeCondition(String content, int line, int pos) {
        String condition = PascalStrings.toPascalOperators(content);

        Optional<CountingLoop> countingLoop = CountingLoop.match(condition);
        if (countingLoop.isPresent()) {
            CountingLoop loop = countingLoop.get();
            symbolTable.define(loop.counter(), BaseType.INTEGER, true, line, pos);
            for (String bound : List.of(loop.start(), loop.end())) {
                for (String name : PascalStrings.identifiers(bound)) {
                    symbolTable.reference(name, line, pos);
                }
            }
            return;
        }

        for (String name : PascalStrings.identifiers(condition)) {
            if (!symbolTable.contains(name)) {
                warning(line, pos, "Variable '" + name + "' is used in a condition before it is declared");
            }
            symbolTable.define(name, BaseType.INTEGER, true, line, pos);
        }
    }

    private void use(String name, String where, int line, int pos) {
        if (!symbolTable.contains(name)) {
            warning(line, pos, "Variable '" + name + "' is used in " + where + " before it is declared");
        }
        symbolTable.reference(name, line, pos);
    }

    private void error(int line, int pos, String message) {
        errors.add(Diagnostic.error(DiagnosticSource.SEMANTIC, line, pos, message));
    }

    private void warning(int line, int pos, String message) {
        warnings.add(Diagnostic.warning(DiagnosticSource.SEMANTIC, line, pos, message));
    }
}

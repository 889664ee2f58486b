package com.flowpascal.playground.translator.codegen;

import com.flowpascal.playground.translator.ast.Node;
import com.flowpascal.playground.translator.ast.NodeKind;
import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.diagnostic.DiagnosticSource;
import com.flowpascal.playground.translator.pascal.ActionContent;
import com.flowpascal.playground.translator.pascal.CountingLoop;
import com.flowpascal.playground.translator.pascal.PascalReservedWords;
import com.flowpascal.playground.translator.pascal.PascalStrings;
import com.flowpascal.playground.translator.semantic.Symbol;
import com.flowpascal.playground.translator.semantic.SymbolTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Lowers a checked syntax tree into a Pascal program.
 * <p>
 * {@link #generate()} always returns text. Problems met while lowering are
 * recorded as generator diagnostics, the offending node is skipped, and the
 * returned program is prefixed with a comment listing every message.
 */
public class PascalCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(PascalCodeGenerator.class);

    public static final String DEFAULT_PROGRAM_NAME = "Generated";
    public static final String DEFAULT_INDENT_UNIT = "    ";

    private final Node root;
    private final SymbolTable symbolTable;
    private final String programName;
    private final String indentUnit;

    private final List<String> lines = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int depth;

    public PascalCodeGenerator(Node root, SymbolTable symbolTable) {
        this(root, symbolTable, DEFAULT_PROGRAM_NAME, DEFAULT_INDENT_UNIT);
    }

    public PascalCodeGenerator(Node root, SymbolTable symbolTable, String programName, String indentUnit) {
        this.root = root;
        this.symbolTable = symbolTable;
        this.programName = programName;
        this.indentUnit = indentUnit;
    }

    public String generate() {
        lines.clear();
        diagnostics.clear();
        depth = 0;

        try {
            if (root == null || root.kind() != NodeKind.PROGRAM) {
                error("Expected a 'program' node as the tree root", Diagnostic.UNKNOWN_POSITION,
                        Diagnostic.UNKNOWN_POSITION);
            } else {
                emitProgram();
            }
        } catch (RuntimeException e) {
            logger.error("Code generation failed: {}", e.getMessage(), e);
            error("Critical generation error: " + e.getMessage(), Diagnostic.UNKNOWN_POSITION,
                    Diagnostic.UNKNOWN_POSITION);
        }

        String body = String.join("\n", lines);
        if (diagnostics.isEmpty()) {
            return body;
        }

        String summary = diagnostics.stream()
                .map(Diagnostic::message)
                .map(message -> message.replace("*)", "* )"))
                .collect(Collectors.joining("; "));
        logger.debug("Generated code with {} errors", diagnostics.size());
        return "(* GENERATION ERRORS: " + summary + " *)\n" + body;
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    private void emitProgram() {
        emit("PROGRAM " + programName + ";");
        emit("");
        emitDeclarations();

        emit("BEGIN");
        depth++;
        for (Node child : root.children()) {
            if (child.kind() != NodeKind.STARTUML && child.kind() != NodeKind.ENDUML) {
                visit(child);
            }
        }
        depth--;
        emit("END.");
    }

    private void emitDeclarations() {
        Map<String, SortedSet<String>> namesByType = new TreeMap<>();
        for (Symbol symbol : symbolTable.getAllSymbols()) {
            String name = symbol.getName();
            if (name == null) {
                error("Symbol without a name in the symbol table", symbol.getLine(), symbol.getPos());
                continue;
            }
            if (PascalReservedWords.isReserved(name)) {
                continue;
            }
            namesByType.computeIfAbsent(symbol.getType(), type -> new TreeSet<>()).add(name);
        }

        if (namesByType.isEmpty()) {
            return;
        }
        emit("VAR");
        depth++;
        namesByType.forEach((type, names) -> emit(String.join(", ", names) + ": " + type + ";"));
        depth--;
        emit("");
    }

    private void visit(Node node) {
        try {
            switch (node.kind()) {
                case ACTION -> node.firstChild(NodeKind.ACTION_CONTENT).ifPresentOrElse(
                        content -> generateAction(content.value(), content.line(), content.pos()),
                        () -> error("Action without content", node.line(), node.pos()));
                case IF -> generateIf(node);
                case WHILE_LOOP -> generateWhile(node);
                case REPEAT_UNTIL_LOOP -> generateRepeatUntil(node);
                case START, STOP, STARTUML, ENDUML, CONDITION_CONTENT, ACTION_CONTENT,
                        BRANCH_LABEL, ELSE_BRANCH_LABEL, REPEAT_UNTIL_BRANCH_LABEL -> {
                }
                default -> node.children().forEach(this::visit);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to lower node '{}': {}", node.kind().label(), e.getMessage());
            error("Failed to process node '" + node.kind().label() + "': " + e.getMessage(), node.line(), node.pos());
        }
    }

    private void generateAction(String content, int line, int pos) {
        ActionContent action = ActionContent.classify(content);

        if (action instanceof ActionContent.Input input) {
            if (input.entries().isEmpty()) {
                error("Empty variable list in input", line, pos);
                return;
            }
            List<String> invalid = input.entries().stream()
                    .filter(entry -> !PascalStrings.isIdentifier(entry))
                    .toList();
            if (!invalid.isEmpty()) {
                error("Invalid variable names in input: " + invalid, line, pos);
                return;
            }
            emit("readln(" + String.join(", ", input.entries()) + ");");
        } else if (action instanceof ActionContent.Output output) {
            if (output.items().isEmpty()) {
                emit("writeln;");
                return;
            }
            String arguments = output.items().stream()
                    .map(PascalCodeGenerator::outputArgument)
                    .collect(Collectors.joining(", "));
            emit("writeln(" + arguments + ");");
        } else if (action instanceof ActionContent.ArrayAssignment assignment) {
            emit(assignment.name() + "[" + expression(assignment.index()) + "] := "
                    + expression(assignment.value()) + ";");
        } else if (action instanceof ActionContent.ScalarAssignment assignment) {
            emit(assignment.name() + " := " + expression(assignment.value()) + ";");
        } else {
            error("Unsupported action content: '" + content.strip() + "'", line, pos);
        }
    }

    private static String outputArgument(String item) {
        if (PascalStrings.isQuotedLiteral(item)) {
            return PascalStrings.rewriteStringLiterals(item);
        }
        if (PascalStrings.isIdentifier(item)) {
            return item;
        }
        return PascalStrings.quote(item);
    }

    private void generateIf(Node node) {
        Optional<String> condition = condition(node);
        if (condition.isEmpty()) {
            error("Missing condition in IF statement", node.line(), node.pos());
            return;
        }
        Optional<Node> thenBranch = node.firstChild(NodeKind.THEN_BRANCH);
        Optional<Node> elseBranch = node.firstChild(NodeKind.ELSE_BRANCH);

        emit("IF (" + condition.get() + ") THEN");
        if (elseBranch.isPresent()) {
            emitBlock(thenBranch.orElse(null), "");
            emit("ELSE");
            emitBlock(elseBranch.get(), ";");
        } else {
            emitBlock(thenBranch.orElse(null), ";");
        }
    }

    private void generateWhile(Node node) {
        Optional<String> condition = condition(node);
        if (condition.isEmpty()) {
            error("Missing loop condition", node.line(), node.pos());
            return;
        }
        Optional<Node> body = node.firstChild(NodeKind.WHILE_BODY);
        if (body.isEmpty()) {
            error("Missing loop body", node.line(), node.pos());
            return;
        }

        Optional<CountingLoop> countingLoop = CountingLoop.match(condition.get());
        if (countingLoop.isPresent()) {
            CountingLoop loop = countingLoop.get();
            emit("FOR " + loop.counter() + " := " + loop.start() + " " + loop.direction().keyword() + " "
                    + loop.end() + " DO");
        } else {
            emit("WHILE (" + condition.get() + ") DO");
        }
        emitBlock(body.get(), ";");
    }

    private void generateRepeatUntil(Node node) {
        Optional<Node> body = node.firstChild(NodeKind.REPEAT_BODY);
        if (body.isEmpty()) {
            error("Missing REPEAT-UNTIL loop body", node.line(), node.pos());
            return;
        }
        Optional<String> condition = condition(node);
        if (condition.isEmpty()) {
            error("Missing UNTIL condition", node.line(), node.pos());
            return;
        }

        emit("REPEAT");
        depth++;
        body.get().children().forEach(this::visit);
        depth--;
        emit("UNTIL (" + condition.get() + ");");
    }

    private void emitBlock(Node block, String terminator) {
        emit("BEGIN");
        depth++;
        if (block != null) {
            block.children().forEach(this::visit);
        }
        depth--;
        emit("END" + terminator);
    }

    private static Optional<String> condition(Node node) {
        return node.firstChild(NodeKind.CONDITION_CONTENT)
                .map(Node::value)
                .filter(value -> !value.isBlank())
                .map(PascalCodeGenerator::expression);
    }

    private static String expression(String text) {
        return PascalStrings.rewriteStringLiterals(PascalStrings.toPascalOperators(text.strip()));
    }

    private void emit(String line) {
        lines.add(line.isEmpty() ? line : indentUnit.repeat(depth) + line);
    }

    private void error(String message, int line, int pos) {
        diagnostics.add(Diagnostic.error(DiagnosticSource.GENERATOR, line, pos, message));
    }
}

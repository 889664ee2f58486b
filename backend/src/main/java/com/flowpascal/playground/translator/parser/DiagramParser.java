package com.flowpascal.playground.translator.parser;

import com.flowpascal.playground.translator.ast.Node;
import com.flowpascal.playground.translator.ast.NodeKind;
import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.diagnostic.DiagnosticSource;
import com.flowpascal.playground.translator.lexer.Delimiter;
import com.flowpascal.playground.translator.lexer.Keyword;
import com.flowpascal.playground.translator.lexer.Token;
import com.flowpascal.playground.translator.lexer.TokenClass;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser over the scanner's token list.
 *
 * <pre>
 * program      := '@startuml' 'start' statement* 'stop' '@enduml'
 * statement    := action | if_stmt | while_stmt | repeat_stmt
 * action       := ':' ACTION ';'
 * if_stmt      := 'if' '(' COND ')' 'then' label statement* ['else' label statement*] 'endif'
 * while_stmt   := 'while' '(' COND ')' 'is' label statement* 'endwhile' label?
 * repeat_stmt  := 'repeat' statement* 'repeatwhile' '(' COND ')' 'is' label?
 * label        := '(' COND ')'
 * </pre>
 *
 * A missing terminal records a diagnostic and ends only the rule being parsed,
 * which hands back the node built so far. The parser never throws.
 */
public class DiagramParser {

    private static final Logger logger = LoggerFactory.getLogger(DiagramParser.class);

    private static final Set<Keyword> BLOCK_TERMINATORS = EnumSet.of(
            Keyword.STOP, Keyword.ENDUML, Keyword.ELSE, Keyword.ENDIF, Keyword.ENDWHILE, Keyword.REPEAT_WHILE);

    private final List<Token> tokens;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int position;

    private ParseResult result;

    public DiagramParser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public ParseResult parse() {
        if (result == null) {
            Node root = parseProgram();
            logger.debug("Parsed {} top-level nodes with {} errors", root.children().size(), diagnostics.size());
            result = new ParseResult(root, diagnostics.isEmpty(), List.copyOf(diagnostics));
        }
        return result;
    }

    private Node parseProgram() {
        Node program = new Node(NodeKind.PROGRAM, 1, 1);

        Token startuml = expect(Keyword.STARTUML, "Expected '@startuml'");
        if (startuml == null) {
            return program;
        }
        program.addChild(leaf(NodeKind.STARTUML, startuml));

        Token start = expect(Keyword.START, "Expected 'start'");
        if (start == null) {
            return program;
        }
        program.addChild(leaf(NodeKind.START, start));

        parseStatements(true).forEach(program::addChild);

        Token stop = expect(Keyword.STOP, "Expected 'stop'");
        if (stop == null) {
            return program;
        }
        program.addChild(leaf(NodeKind.STOP, stop));

        Token enduml = expect(Keyword.ENDUML, "Expected '@enduml'");
        if (enduml == null) {
            return program;
        }
        program.addChild(leaf(NodeKind.ENDUML, enduml));

        if (current() != null) {
            error("Unexpected content after '@enduml'");
        }
        return program;
    }

    private List<Node> parseStatements(boolean forceProgress) {
        List<Node> statements = new ArrayList<>();
        while (current() != null && !atBlockEnd()) {
            Node statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            } else if (forceProgress) {
                advance();
            } else {
                break;
            }
        }
        return statements;
    }

    private boolean atBlockEnd() {
        Token token = current();
        if (token == null || !token.isKeyword()) {
            return false;
        }
        return BLOCK_TERMINATORS.stream().anyMatch(token::is);
    }

    private Node parseStatement() {
        Token token = current();
        if (token == null) {
            return null;
        }
        if (token.is(Delimiter.COLON)) {
            return parseAction();
        }
        if (token.is(Keyword.IF)) {
            return parseIf();
        }
        if (token.is(Keyword.WHILE)) {
            return parseWhile();
        }
        if (token.is(Keyword.REPEAT)) {
            return parseRepeat();
        }
        error("Unexpected token '" + token.text() + "'");
        return null;
    }

    private Node parseAction() {
        Token colon = advance();
        Node node = new Node(NodeKind.ACTION, colon.line(), colon.pos());

        Token content = expectPayload(TokenClass.ACTION_CONTENT, "Expected action content after ':'");
        if (content == null) {
            return node;
        }
        node.addChild(leaf(NodeKind.ACTION_CONTENT, content));

        expect(Delimiter.SEMICOLON, "Expected ';' after action content");
        return node;
    }

    private Node parseIf() {
        Token ifToken = advance();
        Node node = new Node(NodeKind.IF, ifToken.line(), ifToken.pos());

        if (!parseCondition(node, "'if'")) {
            return node;
        }
        if (expect(Keyword.THEN, "Expected 'then'") == null) {
            return node;
        }

        Node thenLabel = parseBranchLabel(NodeKind.BRANCH_LABEL, "'then'");
        if (thenLabel == null) {
            return node;
        }
        node.addChild(thenLabel);
        node.addChild(block(NodeKind.THEN_BRANCH, parseStatements(false)));

        if (check(Keyword.ELSE)) {
            advance();
            Node elseLabel = parseBranchLabel(NodeKind.ELSE_BRANCH_LABEL, "'else'");
            if (elseLabel == null) {
                return node;
            }
            node.addChild(elseLabel);
            node.addChild(block(NodeKind.ELSE_BRANCH, parseStatements(false)));
        }

        expect(Keyword.ENDIF, "Expected 'endif'");
        return node;
    }

    private Node parseWhile() {
        Token whileToken = advance();
        Node node = new Node(NodeKind.WHILE_LOOP, whileToken.line(), whileToken.pos());

        if (!parseCondition(node, "'while'")) {
            return node;
        }
        if (expect(Keyword.IS, "Expected 'is'") == null) {
            return node;
        }

        Node label = parseBranchLabel(NodeKind.BRANCH_LABEL, "'is'");
        if (label == null) {
            return node;
        }
        node.addChild(label);
        node.addChild(block(NodeKind.WHILE_BODY, parseStatements(false)));

        if (expect(Keyword.ENDWHILE, "Expected 'endwhile'") == null) {
            return node;
        }
        if (check(Delimiter.OPEN_PAREN)) {
            node.addChild(parseBranchLabel(NodeKind.BRANCH_LABEL, "'endwhile'"));
        }
        return node;
    }

    private Node parseRepeat() {
        Token repeatToken = advance();
        Node node = new Node(NodeKind.REPEAT_UNTIL_LOOP, repeatToken.line(), repeatToken.pos());

        node.addChild(block(NodeKind.REPEAT_BODY, parseStatements(false)));

        if (expect(Keyword.REPEAT_WHILE, "Expected 'repeat while'") == null) {
            return node;
        }
        if (!parseCondition(node, "'repeat while'")) {
            return node;
        }
        if (expect(Keyword.IS, "Expected 'is'") == null) {
            return node;
        }
        if (check(Delimiter.OPEN_PAREN)) {
            node.addChild(parseBranchLabel(NodeKind.REPEAT_UNTIL_BRANCH_LABEL, "'is'"));
        }
        return node;
    }

    private boolean parseCondition(Node owner, String after) {
        if (expect(Delimiter.OPEN_PAREN, "Expected '(' after " + after) == null) {
            return false;
        }
        Token condition = expectPayload(TokenClass.CONDITION_CONTENT, "Expected a condition after " + after);
        if (condition == null) {
            return false;
        }
        owner.addChild(leaf(NodeKind.CONDITION_CONTENT, condition));
        return expect(Delimiter.CLOSE_PAREN, "Expected ')' after the condition") != null;
    }

    private Node parseBranchLabel(NodeKind kind, String after) {
        if (expect(Delimiter.OPEN_PAREN, "Expected '(' before the branch label after " + after) == null) {
            return null;
        }
        Token label = expectPayload(TokenClass.CONDITION_CONTENT, "Expected a branch label after " + after);
        if (label == null) {
            return null;
        }
        if (expect(Delimiter.CLOSE_PAREN, "Expected ')' after the branch label") == null) {
            return null;
        }
        return leaf(kind, label);
    }

    private static Node block(NodeKind kind, List<Node> statements) {
        if (statements.isEmpty()) {
            return null;
        }
        Node first = statements.get(0);
        Node block = new Node(kind, first.line(), first.pos());
        statements.forEach(block::addChild);
        return block;
    }

    private static Node leaf(NodeKind kind, Token token) {
        return new Node(kind, token.text(), token.line(), token.pos());
    }

    private Token current() {
        return position < tokens.size() ? tokens.get(position) : null;
    }

    private Token advance() {
        Token token = current();
        if (token != null) {
            position++;
        }
        return token;
    }

    private boolean check(Keyword keyword) {
        Token token = current();
        return token != null && token.is(keyword);
    }

    private boolean check(Delimiter delimiter) {
        Token token = current();
        return token != null && token.is(delimiter);
    }

    private Token expect(Keyword keyword, String message) {
        return check(keyword) ? advance() : mismatch(message);
    }

    private Token expect(Delimiter delimiter, String message) {
        return check(delimiter) ? advance() : mismatch(message);
    }

    private Token expectPayload(TokenClass payloadClass, String message) {
        Token token = current();
        return token != null && token.tokenClass() == payloadClass ? advance() : mismatch(message);
    }

    private Token mismatch(String message) {
        Token token = current();
        if (token == null) {
            error(message + ", but reached the end of input");
        } else {
            error(message + ", found '" + token.text() + "'");
        }
        return null;
    }

    private void error(String message) {
        Token token = current();
        Diagnostic diagnostic = token == null
                ? Diagnostic.unattributed(DiagnosticSource.PARSER, message)
                : Diagnostic.error(DiagnosticSource.PARSER, token.line(), token.pos(), message);
        diagnostics.add(diagnostic);
        logger.debug("Syntax error: {}", diagnostic);
    }
}

package com.flowpascal.playground.translator.lexer;

import com.flowpascal.playground.translator.diagnostic.Diagnostic;
import com.flowpascal.playground.translator.diagnostic.DiagnosticSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class DiagramScanner {

    private static final Logger logger = LoggerFactory.getLogger(DiagramScanner.class);

    private static final char END = '\0';

    private final String source;
    private final int endIndex;

    private int position;
    private int line = 1;
    private int column = 1;

    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final InternTable actionTable = new InternTable();
    private final InternTable conditionTable = new InternTable();

    private ScanResult result;

    public DiagramScanner(String source) {
        String text = source == null ? "" : source.stripTrailing();
        this.source = text + END;
        this.endIndex = text.length();
    }

    public ScanResult scan() {
        if (result != null) {
            return result;
        }

        while (!atEnd()) {
            skipWhitespace();
            if (atEnd()) {
                break;
            }

            char c = current();
            if (Character.isLetter(c) || c == '@') {
                scanWord();
            } else if (c == Delimiter.COLON.symbol()) {
                scanPayload(Delimiter.COLON, Delimiter.SEMICOLON, TokenClass.ACTION_CONTENT, actionTable,
                        "Expected ';' at the end of an action");
            } else if (c == Delimiter.OPEN_PAREN.symbol()) {
                scanPayload(Delimiter.OPEN_PAREN, Delimiter.CLOSE_PAREN, TokenClass.CONDITION_CONTENT, conditionTable,
                        "Expected ')' at the end of a condition");
            } else if (c == Delimiter.SEMICOLON.symbol()) {
                emitDelimiter(Delimiter.SEMICOLON, line, column);
                advance();
            } else {
                error("Unexpected character: '" + c + "'");
                advance();
                recover();
            }
        }

        logger.debug("Scanned {} tokens ({} actions, {} conditions) with {} errors",
                tokens.size(), actionTable.size(), conditionTable.size(), diagnostics.size());

        result = new ScanResult(
                List.copyOf(tokens),
                diagnostics.isEmpty(),
                List.copyOf(diagnostics),
                actionTable,
                conditionTable);
        return result;
    }

    private void scanWord() {
        int startIndex = position;
        int startLine = line;
        int startColumn = column;

        String word = readWord();

        if (word.equalsIgnoreCase(Keyword.REPEAT.spelling()) && Character.isWhitespace(current())) {
            int fusedEnd = peekFollowingWhile();
            if (fusedEnd >= 0) {
                while (position < fusedEnd) {
                    advance();
                }
                tokens.add(new Token(TokenClass.KEYWORD, Keyword.REPEAT_WHILE.code(),
                        source.substring(startIndex, position), startLine, startColumn));
                return;
            }
        }

        Keyword.lookup(word).ifPresentOrElse(
                keyword -> tokens.add(new Token(TokenClass.KEYWORD, keyword.code(), word, startLine, startColumn)),
                () -> {
                    error("Unknown keyword: '" + word + "'");
                    recover();
                });
    }

    /**
     * Looks past the whitespace after {@code repeat} without moving the scanner.
     *
     * @return index just past a following {@code while} word, or -1 if there is none
     */
    private int peekFollowingWhile() {
        int i = position;
        while (i < endIndex && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        int wordStart = i;
        while (i < endIndex && isWordPart(source.charAt(i))) {
            i++;
        }
        String next = source.substring(wordStart, i);
        return next.equalsIgnoreCase(Keyword.WHILE.spelling()) ? i : -1;
    }

    private void scanPayload(Delimiter open, Delimiter close, TokenClass payloadClass, InternTable table,
            String missingCloseMessage) {
        emitDelimiter(open, line, column);
        advance();

        StringBuilder buffer = new StringBuilder();
        int contentLine = line;
        int contentColumn = column;
        boolean contentStarted = false;

        while (!atEnd() && current() != close.symbol()) {
            char c = current();
            if (!contentStarted && !Character.isWhitespace(c)) {
                contentStarted = true;
                contentLine = line;
                contentColumn = column;
            }
            buffer.append(c);
            advance();
        }

        String content = buffer.toString().strip();
        if (!content.isEmpty()) {
            int id = table.intern(content);
            tokens.add(new Token(payloadClass, id, content, contentLine, contentColumn));
        }

        if (!atEnd() && current() == close.symbol()) {
            emitDelimiter(close, line, column);
            advance();
        } else {
            error(missingCloseMessage);
            recover();
        }
    }

    private String readWord() {
        StringBuilder word = new StringBuilder();
        while (!atEnd() && isWordPart(current())) {
            word.append(current());
            advance();
        }
        return word.toString();
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '@' || c == '_' || c == '-';
    }

    private void emitDelimiter(Delimiter delimiter, int tokenLine, int tokenColumn) {
        tokens.add(new Token(TokenClass.DELIMITER, delimiter.code(),
                String.valueOf(delimiter.symbol()), tokenLine, tokenColumn));
    }

    private void error(String message) {
        diagnostics.add(Diagnostic.error(DiagnosticSource.LEXER, line, column, message));
        logger.debug("Lexical error at ({},{}): {}", line, column, message);
    }

    private void recover() {
        while (!atEnd()) {
            char c = current();
            if (Character.isWhitespace(c) || Delimiter.isDelimiter(c) || c == '@') {
                return;
            }
            advance();
        }
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(current())) {
            advance();
        }
    }

    private boolean atEnd() {
        return position >= endIndex;
    }

    private char current() {
        return source.charAt(Math.min(position, endIndex));
    }

    private void advance() {
        if (atEnd()) {
            return;
        }
        if (current() == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position++;
    }
}

package com.flowpascal.playground.translator.lexer;

public enum Delimiter {
    OPEN_PAREN(1, '('),
    CLOSE_PAREN(2, ')'),
    SEMICOLON(3, ';'),
    COLON(4, ':');

    private final int code;
    private final char symbol;

    Delimiter(int code, char symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public int code() {
        return code;
    }

    public char symbol() {
        return symbol;
    }

    public static boolean isDelimiter(char c) {
        for (Delimiter delimiter : values()) {
            if (delimiter.symbol == c) {
                return true;
            }
        }
        return false;
    }
}

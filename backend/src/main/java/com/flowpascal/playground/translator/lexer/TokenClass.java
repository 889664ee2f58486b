package com.flowpascal.playground.translator.lexer;

public enum TokenClass {
    KEYWORD(1),
    DELIMITER(2),
    NUMBER(3),
    ACTION_CONTENT(4),
    CONDITION_CONTENT(5);

    private final int code;

    TokenClass(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}

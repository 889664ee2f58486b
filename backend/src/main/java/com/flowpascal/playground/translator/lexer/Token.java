package com.flowpascal.playground.translator.lexer;

public record Token(TokenClass tokenClass, int value, String text, int line, int pos) {

    public boolean is(Keyword keyword) {
        return tokenClass == TokenClass.KEYWORD && value == keyword.code();
    }

    public boolean is(Delimiter delimiter) {
        return tokenClass == TokenClass.DELIMITER && value == delimiter.code();
    }

    public boolean isKeyword() {
        return tokenClass == TokenClass.KEYWORD;
    }
}

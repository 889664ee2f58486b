package com.flowpascal.playground.dto;

import com.flowpascal.playground.translator.lexer.Token;

public record DiagramToken(
    int line,
    int pos,
    String tokenClass,
    int classCode,
    int value,
    String text
) {

    public static DiagramToken from(Token token) {
        return new DiagramToken(
                token.line(),
                token.pos(),
                token.tokenClass().name(),
                token.tokenClass().code(),
                token.value(),
                token.text());
    }
}

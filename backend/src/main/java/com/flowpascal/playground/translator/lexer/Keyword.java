package com.flowpascal.playground.translator.lexer;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum Keyword {
    STARTUML(1, "@startuml"),
    START(2, "start"),
    STOP(3, "stop"),
    IF(4, "if"),
    THEN(5, "then"),
    ELSE(6, "else"),
    ENDIF(7, "endif"),
    WHILE(8, "while"),
    IS(9, "is"),
    ENDWHILE(10, "endwhile"),
    REPEAT(11, "repeat"),
    REPEAT_WHILE(12, "repeatwhile"),
    ENDUML(13, "@enduml");

    private static final Map<String, Keyword> BY_SPELLING = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Keyword::spelling, Function.identity()));

    private final int code;
    private final String spelling;

    Keyword(int code, String spelling) {
        this.code = code;
        this.spelling = spelling;
    }

    public int code() {
        return code;
    }

    public String spelling() {
        return spelling;
    }

    public static Optional<Keyword> lookup(String word) {
        return Optional.ofNullable(BY_SPELLING.get(word.toLowerCase(Locale.ROOT)));
    }
}

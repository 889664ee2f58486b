package com.flowpascal.playground.translator.pascal;

import java.util.Locale;
import java.util.Set;

public final class PascalReservedWords {

    private static final Set<String> WORDS = Set.of(
            "and", "abs", "array", "as", "begin", "case", "class", "const", "constructor",
            "continue", "destructor", "div", "do", "downto", "else", "end", "enum",
            "except", "exports", "file", "finalization", "finally", "for", "foreach",
            "forward", "function", "goto", "if", "implementation", "in", "inherited",
            "initialization", "inline", "interface", "is", "label", "mod", "new",
            "nil", "not", "object", "of", "operator", "or", "packed", "procedure",
            "program", "property", "raise", "record", "repeat", "sealed", "set",
            "shl", "shr", "static", "string", "then", "to", "try", "type",
            "unit", "until", "uses", "var", "while", "with", "xor",
            "true", "false",
            "integer", "real", "boolean", "char",
            "private", "protected", "public", "internal",
            "yield", "break");

    private PascalReservedWords() {
    }

    public static boolean isReserved(String word) {
        return word != null && WORDS.contains(word.toLowerCase(Locale.ROOT));
    }
}

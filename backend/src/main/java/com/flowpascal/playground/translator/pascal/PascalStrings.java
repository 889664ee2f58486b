package com.flowpascal.playground.translator.pascal;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PascalStrings {

    public static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private static final Pattern IDENTIFIER_WORD = Pattern.compile("\\b[a-zA-Z_][a-zA-Z0-9_]*\\b");

    private PascalStrings() {
    }

    public static boolean isIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    public static boolean isQuotedLiteral(String text) {
        return text.length() >= 2 && isQuote(text.charAt(0)) && isQuote(text.charAt(text.length() - 1));
    }

    public static String quote(String inner) {
        return "'" + inner.replace("'", "''") + "'";
    }

    /**
     * Rewrites every quoted segment of {@code expression} as a Pascal literal and
     * leaves the rest untouched. An unterminated quote is copied as is.
     */
    public static String rewriteStringLiterals(String expression) {
        if (expression == null || expression.isEmpty()) {
            return expression;
        }
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            int close = isQuote(c) ? expression.indexOf(c, i + 1) : -1;
            if (close < 0) {
                out.append(c);
                i++;
                continue;
            }
            out.append(quote(expression.substring(i + 1, close)));
            i = close + 1;
        }
        return out.toString();
    }

    public static List<String> identifiers(String expression) {
        List<String> names = new ArrayList<>();
        Matcher matcher = IDENTIFIER_WORD.matcher(blankStringLiterals(expression));
        while (matcher.find()) {
            String name = matcher.group();
            if (!PascalReservedWords.isReserved(name)) {
                names.add(name);
            }
        }
        return names;
    }

    public static String blankStringLiterals(String expression) {
        StringBuilder out = new StringBuilder(expression);
        int i = 0;
        while (i < out.length()) {
            char c = out.charAt(i);
            int close = isQuote(c) ? out.indexOf(String.valueOf(c), i + 1) : -1;
            if (close < 0) {
                i++;
                continue;
            }
            for (int j = i; j <= close; j++) {
                out.setCharAt(j, ' ');
            }
            i = close + 1;
        }
        return out.toString();
    }

    public static String toPascalOperators(String text) {
        return text == null ? null : text.replace("!=", "<>");
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}

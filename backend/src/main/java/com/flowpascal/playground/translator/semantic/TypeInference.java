package com.flowpascal.playground.translator.semantic;

import com.flowpascal.playground.translator.pascal.PascalStrings;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TypeInference {

    private static final Pattern ABS_CALL = Pattern.compile("^abs\\s*\\((.*)\\)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ARRAY_ACCESS = Pattern.compile(
            "^([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\[\\s*(.+?)\\s*\\]$", Pattern.DOTALL);
    private static final Pattern NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Pattern OPERAND = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*|[\\d.]+");

    private TypeInference() {
    }

    public static BaseType infer(String expression, SymbolTable symbols) {
        String expr = expression.strip();

        Matcher abs = ABS_CALL.matcher(expr);
        if (abs.matches() && isBalanced(abs.group(1))) {
            return infer(abs.group(1), symbols);
        }

        Matcher access = ARRAY_ACCESS.matcher(expr);
        if (access.matches()) {
            return symbols.lookup(access.group(1))
                    .filter(Symbol::isArray)
                    .map(Symbol::getBaseType)
                    .orElse(BaseType.INTEGER);
        }

        if (PascalStrings.isQuotedLiteral(expr)) {
            return BaseType.STRING;
        }

        String lower = expr.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return BaseType.BOOLEAN;
        }

        if (NUMBER.matcher(expr).matches()) {
            return expr.contains(".") || lower.contains("e") ? BaseType.REAL : BaseType.INTEGER;
        }

        if (PascalStrings.isIdentifier(expr)) {
            return symbols.lookup(expr).map(Symbol::getBaseType).orElse(BaseType.INTEGER);
        }

        String code = PascalStrings.blankStringLiterals(expr);
        if (code.indexOf('/') >= 0) {
            return BaseType.REAL;
        }

        Matcher operands = OPERAND.matcher(code);
        while (operands.find()) {
            String operand = operands.group();
            if (Character.isDigit(operand.charAt(0)) || operand.charAt(0) == '.') {
                if (operand.contains(".")) {
                    return BaseType.REAL;
                }
            } else if (symbols.lookup(operand).map(Symbol::getBaseType).orElse(null) == BaseType.REAL) {
                return BaseType.REAL;
            }
        }

        return BaseType.INTEGER;
    }

    private static boolean isBalanced(String text) {
        int depth = 0;
        for (char c : text.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth < 0) {
                return false;
            }
        }
        return depth == 0;
    }
}

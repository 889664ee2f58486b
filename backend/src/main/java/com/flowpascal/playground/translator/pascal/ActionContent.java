package com.flowpascal.playground.translator.pascal;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public sealed interface ActionContent {

    String INPUT_MARKER = "Ввод:";
    String OUTPUT_MARKER = "Вывод:";

    Pattern ARRAY_ASSIGNMENT = Pattern.compile(
            "^([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\[\\s*(.+?)\\s*\\]\\s*(:?=)\\s*(.+)$", Pattern.DOTALL);

    Pattern SCALAR_ASSIGNMENT = Pattern.compile(
            "^([a-zA-Z_][a-zA-Z0-9_]*)\\s*(:?=)\\s*(.+)$", Pattern.DOTALL);

    record Input(List<String> entries) implements ActionContent {
    }

    record Output(List<String> items) implements ActionContent {
    }

    record ArrayAssignment(String name, String index, String value) implements ActionContent {
    }

    record ScalarAssignment(String name, String value) implements ActionContent {
    }

    record Invalid(String text) implements ActionContent {
    }

    static ActionContent classify(String payload) {
        String content = payload == null ? "" : payload.strip();

        if (content.startsWith(INPUT_MARKER)) {
            return new Input(splitList(content.substring(INPUT_MARKER.length())));
        }
        if (content.startsWith(OUTPUT_MARKER)) {
            return new Output(splitList(content.substring(OUTPUT_MARKER.length())));
        }

        Matcher array = ARRAY_ASSIGNMENT.matcher(content);
        if (array.matches()) {
            return new ArrayAssignment(array.group(1), array.group(2).strip(), array.group(4).strip());
        }

        Matcher scalar = SCALAR_ASSIGNMENT.matcher(content);
        if (scalar.matches()) {
            return new ScalarAssignment(scalar.group(1), scalar.group(3).strip());
        }

        return new Invalid(content);
    }

    private static List<String> splitList(String list) {
        List<String> items = new ArrayList<>();
        StringBuilder item = new StringBuilder();
        char openQuote = 0;
        for (char c : list.toCharArray()) {
            if (openQuote != 0) {
                if (c == openQuote) {
                    openQuote = 0;
                }
            } else if (c == '"' || c == '\'') {
                openQuote = c;
            } else if (c == ',') {
                items.add(item.toString().strip());
                item.setLength(0);
                continue;
            }
            item.append(c);
        }
        items.add(item.toString().strip());
        return items.stream().filter(entry -> !entry.isEmpty()).toList();
    }
}

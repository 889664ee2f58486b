package com.flowpascal.playground.translator.pascal;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record CountingLoop(String counter, String start, Direction direction, String end) {

    private static final Pattern SHAPE = Pattern.compile(
            "^\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*:=\\s*(.+?)\\s+(to|downto)\\s+(.+?)\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public enum Direction {
        ASCENDING("TO"),
        DESCENDING("DOWNTO");

        private final String keyword;

        Direction(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public static Optional<CountingLoop> match(String condition) {
        if (condition == null) {
            return Optional.empty();
        }
        Matcher matcher = SHAPE.matcher(condition);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Direction direction = matcher.group(3).equalsIgnoreCase("downto") ? Direction.DESCENDING : Direction.ASCENDING;
        return Optional.of(new CountingLoop(
                matcher.group(1),
                matcher.group(2).strip(),
                direction,
                matcher.group(4).strip()));
    }
}

package org.drift.migration.differs.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Order-insensitive form of a constraint clause: lowercased, trimmed, split on
 * whitespace, sorted and joined with single spaces. {@code NOT NULL UNIQUE} and
 * {@code unique not null} normalize to the same text.
 *
 * <p>This is a token-set approximation. {@code CHECK (a > 0)} and {@code CHECK (0 < a)}
 * normalize differently, and clauses with the same tokens in a different meaning
 * normalize identically.
 */
public final class ConstraintTokens {

    private ConstraintTokens() {
    }

    public static String normalize(String constraints) {
        if (constraints == null) {
            return "";
        }
        String trimmed = constraints.toLowerCase(Locale.ROOT).trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        return Arrays.stream(trimmed.split("\\s+"))
                .sorted()
                .collect(Collectors.joining(" "));
    }

    public static boolean equivalent(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}

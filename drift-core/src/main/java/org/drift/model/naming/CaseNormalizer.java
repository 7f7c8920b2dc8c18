package org.drift.model.naming;

import java.util.Locale;

/**
 * Identifier normalization used to key tables, columns, indexes and constraints
 * when two schema trees are matched by name.
 */
@FunctionalInterface
public interface CaseNormalizer {
    String normalize(String raw);

    default boolean same(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    static CaseNormalizer lower()   { return s -> s == null ? "" : s.trim().toLowerCase(Locale.ROOT); }
    static CaseNormalizer preserve(){ return s -> s == null ? "" : s.trim(); }

    static CaseNormalizer forIgnoreCase(boolean ignoreCase) {
        return ignoreCase ? lower() : preserve();
    }
}

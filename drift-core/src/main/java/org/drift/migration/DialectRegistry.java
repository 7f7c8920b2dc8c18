package org.drift.migration;

import org.drift.migration.dialect.postgres.PostgresDialect;
import org.drift.migration.spi.dialect.Dialect;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a {@link Dialect} by name or alias, case-insensitively.
 */
public final class DialectRegistry {
    private static final DialectRegistry DEFAULTS = new DialectRegistry(List.of(
            new PostgresDialect()
    ));

    private final List<Dialect> dialects;

    public DialectRegistry(List<Dialect> dialects) {
        this.dialects = List.copyOf(Objects.requireNonNull(dialects, "dialects must not be null"));
    }

    public static DialectRegistry defaults() {
        return DEFAULTS;
    }

    public Optional<Dialect> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        return dialects.stream()
                .filter(d -> d.name().equalsIgnoreCase(key)
                        || d.aliases().stream().anyMatch(alias -> alias.equalsIgnoreCase(key)))
                .findFirst();
    }

    public Dialect require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unsupported dialect: " + name));
    }

    public List<Dialect> getDialects() {
        return dialects;
    }
}

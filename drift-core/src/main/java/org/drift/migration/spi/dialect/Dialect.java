package org.drift.migration.spi.dialect;

import org.drift.migration.spi.TypeMapper;

import java.util.Set;

/**
 * A target database engine. Only type-name mapping is dialect specific; statement
 * shapes are shared.
 */
public interface Dialect {

    /**
     * Registry name, e.g. {@code postgres}.
     */
    String name();

    /**
     * Additional names the registry resolves to this dialect.
     */
    default Set<String> aliases() {
        return Set.of();
    }

    TypeMapper typeMapper();
}

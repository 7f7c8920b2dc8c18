package org.drift.migration.dialect.postgres;

import org.drift.migration.spi.TypeMapper;
import org.drift.migration.spi.dialect.Dialect;

import java.util.Set;

public class PostgresDialect implements Dialect {

    public static final String NAME = "postgres";

    private final TypeMapper typeMapper = new PostgresTypeMapper();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> aliases() {
        return Set.of("postgresql", "pg");
    }

    @Override
    public TypeMapper typeMapper() {
        return typeMapper;
    }
}

package org.drift.migration.dialect.postgres;

import org.drift.migration.spi.TypeMapper;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

public class PostgresTypeMapper implements TypeMapper {

    private static final Map<String, String> TYPE_MAP = Map.ofEntries(
            // 문자열
            entry("text", "TEXT"),
            entry("string", "TEXT"),
            entry("varchar", "VARCHAR"),
            entry("char", "CHAR"),
            // 정수
            entry("smallint", "SMALLINT"),
            entry("int", "INTEGER"),
            entry("integer", "INTEGER"),
            entry("bigint", "BIGINT"),
            entry("serial", "SERIAL"),
            entry("bigserial", "BIGSERIAL"),
            // 실수
            entry("float", "DOUBLE PRECISION"),
            entry("double", "DOUBLE PRECISION"),
            entry("real", "REAL"),
            entry("decimal", "NUMERIC"),
            entry("numeric", "NUMERIC"),
            // 기타
            entry("bool", "BOOLEAN"),
            entry("boolean", "BOOLEAN"),
            entry("date", "DATE"),
            entry("time", "TIME"),
            entry("timestamp", "TIMESTAMP"),
            entry("timestamptz", "TIMESTAMP WITH TIME ZONE"),
            entry("interval", "INTERVAL"),
            entry("uuid", "UUID"),
            entry("json", "JSON"),
            entry("jsonb", "JSONB"),
            entry("bytea", "BYTEA"),
            entry("blob", "BYTEA")
    );

    @Override
    public Optional<String> map(String logicalType) {
        if (logicalType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TYPE_MAP.get(logicalType.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public Map<String, String> mappings() {
        return TYPE_MAP;
    }
}

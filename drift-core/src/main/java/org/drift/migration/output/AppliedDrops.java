package org.drift.migration.output;

import java.util.Locale;
import java.util.Set;

/**
 * Tables and columns that earlier up migrations already dropped and did not recreate.
 * Names are lowercased; columns are keyed as {@code table.column}.
 */
public record AppliedDrops(Set<String> tables, Set<String> columns) {

    public static final AppliedDrops NONE = new AppliedDrops(Set.of(), Set.of());

    public AppliedDrops {
        tables = Set.copyOf(tables);
        columns = Set.copyOf(columns);
    }

    public boolean isTableDropped(String table) {
        return tables.contains(key(table));
    }

    public boolean isColumnDropped(String table, String column) {
        return columns.contains(columnKey(table, column));
    }

    public boolean isEmpty() {
        return tables.isEmpty() && columns.isEmpty();
    }

    static String columnKey(String table, String column) {
        return key(table) + "." + key(column);
    }

    static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}

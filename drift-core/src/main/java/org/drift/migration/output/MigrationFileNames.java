package org.drift.migration.output;

/**
 * Up and down file names of one migration, e.g. {@code changes-1700000000.sql} and
 * {@code changes-1700000000.down.sql}.
 */
public record MigrationFileNames(String up, String down) {

    private static final String SQL_SUFFIX = ".sql";

    public static MigrationFileNames forUp(String upName) {
        int idx = upName.indexOf(SQL_SUFFIX);
        String down = idx < 0
                ? upName + ".down"
                : upName.substring(0, idx) + ".down" + upName.substring(idx);
        return new MigrationFileNames(upName, down);
    }
}

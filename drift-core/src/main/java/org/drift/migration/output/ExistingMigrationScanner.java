package org.drift.migration.output;

import org.slf4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads the up migrations already in the output directory and collects the tables and
 * columns they dropped.
 *
 * <p>Files are processed in name order (timestamp order for the default name format).
 * Within a file, {@code CREATE TABLE IF NOT EXISTS} is applied before the drops, so a
 * table recreated later is no longer considered dropped. A dropped table forgets its
 * dropped columns. Down files ({@code .down.sql}) are ignored.
 */
public class ExistingMigrationScanner {

    private static final String IDENT = "([A-Za-z0-9_]+)";
    private static final Pattern CREATE_TABLE = Pattern.compile(
            "CREATE\\s+TABLE\\s+IF\\s+NOT\\s+EXISTS\\s+" + IDENT, Pattern.CASE_INSENSITIVE);
    private static final Pattern DROP_TABLE = Pattern.compile(
            "DROP\\s+TABLE\\s+IF\\s+EXISTS\\s+" + IDENT, Pattern.CASE_INSENSITIVE);
    private static final Pattern DROP_COLUMN = Pattern.compile(
            "ALTER\\s+TABLE\\s+" + IDENT + "\\s+DROP\\s+COLUMN\\s+IF\\s+EXISTS\\s+" + IDENT, Pattern.CASE_INSENSITIVE);

    private final Logger logger;

    public ExistingMigrationScanner(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * @return drops found in {@code outputDir}; {@link AppliedDrops#NONE} if the directory does not exist
     * @throws IOException if the directory cannot be listed
     */
    public AppliedDrops scan(Path outputDir) throws IOException {
        if (!Files.isDirectory(outputDir)) {
            return AppliedDrops.NONE;
        }

        List<Path> upFiles;
        try (Stream<Path> stream = Files.list(outputDir)) {
            upFiles = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> isUpFile(p.getFileName().toString()))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .toList();
        }

        Set<String> tables = new LinkedHashSet<>();
        Set<String> columns = new LinkedHashSet<>();
        for (Path file : upFiles) {
            String sql;
            try {
                sql = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                // 읽을 수 없는 파일은 건너뛰고 나머지로 판단
                logger.warn("Failed to read migration file {}: {}", file.getFileName(), e.getMessage());
                continue;
            }
            apply(file.getFileName().toString(), sql, tables, columns);
        }

        logger.debug("Existing migrations dropped {} tables and {} columns", tables.size(), columns.size());
        return new AppliedDrops(tables, columns);
    }

    private void apply(String fileName, String sql, Set<String> tables, Set<String> columns) {
        Matcher created = CREATE_TABLE.matcher(sql);
        while (created.find()) {
            String table = AppliedDrops.key(created.group(1));
            if (tables.remove(table)) {
                logger.debug("Table {} was recreated in {}", table, fileName);
            }
        }

        Matcher droppedTable = DROP_TABLE.matcher(sql);
        while (droppedTable.find()) {
            String table = AppliedDrops.key(droppedTable.group(1));
            tables.add(table);
            columns.removeIf(c -> c.startsWith(table + "."));
            logger.debug("Found existing DROP TABLE for {} in {}", table, fileName);
        }

        Matcher droppedColumn = DROP_COLUMN.matcher(sql);
        while (droppedColumn.find()) {
            String table = AppliedDrops.key(droppedColumn.group(1));
            if (!tables.contains(table)) {
                columns.add(AppliedDrops.columnKey(table, droppedColumn.group(2)));
                logger.debug("Found existing DROP COLUMN for {}.{} in {}", table, droppedColumn.group(2), fileName);
            }
        }
    }

    private static boolean isUpFile(String name) {
        return name.endsWith(".sql") && !name.contains(".down.sql");
    }
}

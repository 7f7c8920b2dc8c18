package org.drift.migration.output;

import org.slf4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes migration files in the {@code -- +migrate Up / Down} layout.
 *
 * <p>Each statement is separated by a blank line and terminated by exactly one {@code ;}.
 * File names come from a printf-style format that receives the epoch second of the
 * injected {@link Clock}; when a name is taken the second is bumped until both the up
 * and the down name are free.
 */
public class MigrationFileWriter {

    public static final String UP_HEADER = "-- +migrate Up";
    public static final String DOWN_HEADER = "-- +migrate Down";

    private final String fileNameFormat;
    private final Clock clock;
    private final Logger logger;

    public MigrationFileWriter(String fileNameFormat, Clock clock, Logger logger) {
        this.fileNameFormat = Objects.requireNonNull(fileNameFormat, "fileNameFormat must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * Picks file names in {@code outputDir} that neither the up nor the down file uses yet.
     *
     * @throws FileAlreadyExistsException if the name is taken and the format does not
     *         depend on the timestamp
     */
    public MigrationFileNames nextNames(Path outputDir) throws IOException {
        long seconds = clock.instant().getEpochSecond();
        MigrationFileNames names = namesFor(seconds);
        while (Files.exists(outputDir.resolve(names.up())) || Files.exists(outputDir.resolve(names.down()))) {
            logger.debug("Migration file {} already exists, trying the next second", names.up());
            seconds++;
            MigrationFileNames next = namesFor(seconds);
            if (next.equals(names)) {
                throw new FileAlreadyExistsException(outputDir.resolve(names.up()).toString());
            }
            names = next;
        }
        return names;
    }

    public Path writeUp(Path file, List<String> statements) throws IOException {
        return write(file, UP_HEADER, statements);
    }

    public Path writeDown(Path file, List<String> statements) throws IOException {
        return write(file, DOWN_HEADER, statements);
    }

    private Path write(Path file, String header, List<String> statements) throws IOException {
        Files.writeString(file, render(header, statements), StandardCharsets.UTF_8);
        logger.info("Wrote {} ({} statements)", file, statements.size());
        return file;
    }

    public static String render(String header, List<String> statements) {
        return header + "\n\n" + statements.stream()
                .map(MigrationFileWriter::terminate)
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * Trailing whitespace and semicolons removed, then a single {@code ;} appended.
     */
    public static String terminate(String statement) {
        String s = statement.stripTrailing();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).stripTrailing();
        }
        return s + ";";
    }

    private MigrationFileNames namesFor(long seconds) {
        String up;
        try {
            up = String.format(fileNameFormat, seconds);
        } catch (IllegalFormatException e) {
            throw new IllegalArgumentException("Invalid migration file name format: " + fileNameFormat, e);
        }
        if (up.isBlank()) {
            throw new IllegalArgumentException("Migration file name format produced an empty name: " + fileNameFormat);
        }
        return MigrationFileNames.forUp(up);
    }
}

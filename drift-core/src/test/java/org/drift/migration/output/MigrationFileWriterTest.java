package org.drift.migration.output;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationFileWriterTest {

    @TempDir
    Path tempDir;

    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.ofEpochSecond(42), ZoneOffset.UTC);
    }

    private MigrationFileWriter writer(String format) {
        return new MigrationFileWriter(format, clock, LoggerFactory.getLogger(MigrationFileWriterTest.class));
    }

    @Test
    @DisplayName("문장 끝의 공백과 세미콜론을 정리하고 하나만 붙임")
    void statementsAreTerminatedOnce() {
        String rendered = MigrationFileWriter.render(MigrationFileWriter.UP_HEADER, List.of(
                "DROP TABLE a;;  ",
                "DROP TABLE b",
                "DROP INDEX IF EXISTS i;\nCREATE INDEX i ON t (c);\n"));

        assertThat(rendered).isEqualTo("""
                -- +migrate Up

                DROP TABLE a;

                DROP TABLE b;

                DROP INDEX IF EXISTS i;
                CREATE INDEX i ON t (c);""");
    }

    @Test
    void downNameReplacesFirstSqlSuffix() {
        assertThat(MigrationFileNames.forUp("changes-1.sql").down()).isEqualTo("changes-1.down.sql");
        assertThat(MigrationFileNames.forUp("v1.sql.bak").down()).isEqualTo("v1.down.sql.bak");
        assertThat(MigrationFileNames.forUp("migration_1").down()).isEqualTo("migration_1.down");
    }

    @Test
    @DisplayName("down 파일만 있어도 다음 초로 넘어감")
    void takenDownNameBumpsTimestamp() throws IOException {
        Files.writeString(tempDir.resolve("changes-42.down.sql"), "x");

        MigrationFileNames names = writer("changes-%d.sql").nextNames(tempDir);

        assertThat(names.up()).isEqualTo("changes-43.sql");
    }

    @Test
    @DisplayName("타임스탬프가 없는 형식이 이미 있으면 예외")
    void constantFormatCollisionFails() throws IOException {
        Files.writeString(tempDir.resolve("schema.sql"), "x");

        assertThatThrownBy(() -> writer("schema.sql").nextNames(tempDir))
                .isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    void invalidFormatIsRejected() {
        assertThatThrownBy(() -> writer("changes-%q.sql").nextNames(tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("changes-%q.sql");
    }

    @Test
    void writesHeaderAndStatements() throws IOException {
        Path file = writer("m-%d.sql").writeDown(tempDir.resolve("m.down.sql"), List.of("DROP TABLE t;"));

        assertThat(Files.readString(file)).isEqualTo("-- +migrate Down\n\nDROP TABLE t;");
    }
}

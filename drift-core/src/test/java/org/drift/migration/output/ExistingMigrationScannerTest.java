package org.drift.migration.output;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExistingMigrationScannerTest {

    @TempDir
    Path tempDir;

    private final Logger logger = LoggerFactory.getLogger(ExistingMigrationScannerTest.class);
    private ExistingMigrationScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new ExistingMigrationScanner(logger);
    }

    @Test
    @DisplayName("디렉토리가 없으면 빈 결과")
    void missingDirectoryIsEmpty() throws IOException {
        AppliedDrops drops = scanner.scan(tempDir.resolve("nope"));

        assertThat(drops.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("DROP TABLE / DROP COLUMN 수집, 대소문자 무시")
    void collectsDrops() throws IOException {
        Files.writeString(tempDir.resolve("changes-1.sql"), """
                -- +migrate Up

                drop table if exists Legacy;

                ALTER TABLE users DROP COLUMN IF EXISTS Nickname;""");

        AppliedDrops drops = scanner.scan(tempDir);

        assertThat(drops.isTableDropped("legacy")).isTrue();
        assertThat(drops.isColumnDropped("USERS", "nickname")).isTrue();
        assertThat(drops.isTableDropped("users")).isFalse();
    }

    @Test
    @DisplayName("down 파일과 sql 이외 파일은 무시")
    void ignoresDownAndOtherFiles() throws IOException {
        Files.writeString(tempDir.resolve("changes-1.down.sql"), "DROP TABLE IF EXISTS users;");
        Files.writeString(tempDir.resolve("notes.txt"), "DROP TABLE IF EXISTS orders;");

        AppliedDrops drops = scanner.scan(tempDir);

        assertThat(drops.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("파일명 순서대로 적용: 나중에 다시 만든 테이블은 삭제 상태 해제")
    void laterCreateClearsDrop() throws IOException {
        Files.writeString(tempDir.resolve("changes-2.sql"), "CREATE TABLE IF NOT EXISTS legacy (\n  id integer\n);");
        Files.writeString(tempDir.resolve("changes-1.sql"), "DROP TABLE IF EXISTS legacy;");

        AppliedDrops drops = scanner.scan(tempDir);

        assertThat(drops.isTableDropped("legacy")).isFalse();
    }

    @Test
    @DisplayName("테이블 삭제 시 그 테이블의 삭제된 컬럼 기록도 지움")
    void tableDropForgetsItsColumns() throws IOException {
        Files.writeString(tempDir.resolve("changes-1.sql"), "ALTER TABLE legacy DROP COLUMN IF EXISTS note;");
        Files.writeString(tempDir.resolve("changes-2.sql"),
                "DROP TABLE IF EXISTS legacy;\n\nALTER TABLE legacy DROP COLUMN IF EXISTS other;");

        AppliedDrops drops = scanner.scan(tempDir);

        assertThat(drops.tables()).containsExactly("legacy");
        assertThat(drops.columns()).isEmpty();
    }
}

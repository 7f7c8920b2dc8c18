package org.drift.config;

import org.drift.migration.GeneratorOptions;
import org.drift.migration.differs.AnalyzerOptions;
import org.drift.options.DriftOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private static final String CONFIG = """
            profiles:
              dev:
                dialect: postgres
                output:
                  directory: db/migrations
                  includeDown: true
              prod:
                dialect: postgresql
                output:
                  directory: /var/migrations
                  fileNameFormat: "V%d__auto.sql"
                analyzer:
                  ignoreCase: false
                  detectRenames: true
            """;

    private ConfigurationLoader loader(Path start, String envProfile) {
        return new ConfigurationLoader(start, name -> DriftOptions.Profile.ENV_VAR.equals(name) ? envProfile : null);
    }

    @Test
    @DisplayName("설정 파일이 없으면 기본값")
    void defaultsWithoutConfigFile() {
        Map<String, String> config = loader(tempDir, null).loadConfiguration(null);

        assertThat(config)
                .containsEntry(DriftOptions.Generator.DIALECT_KEY, "postgres")
                .containsEntry(DriftOptions.Generator.OUTPUT_DIR_KEY, "migrations")
                .containsEntry(DriftOptions.Generator.FILE_NAME_FORMAT_KEY, "changes-%d.sql")
                .containsEntry(DriftOptions.Generator.INCLUDE_DOWN_KEY, "false")
                .containsEntry(DriftOptions.Generator.CHECK_EXISTING_KEY, "true")
                .containsEntry(DriftOptions.Analyzer.IGNORE_CASE_KEY, "true");
    }

    @Test
    @DisplayName("상위 디렉토리의 drift.yaml을 찾고 dev 프로파일 적용")
    void findsConfigInParentDirectory() throws IOException {
        Files.writeString(tempDir.resolve("drift.yaml"), CONFIG);
        Path nested = Files.createDirectories(tempDir.resolve("service/src"));

        Map<String, String> config = loader(nested, null).loadConfiguration(null);

        assertThat(config)
                .containsEntry(DriftOptions.Generator.OUTPUT_DIR_KEY, "db/migrations")
                .containsEntry(DriftOptions.Generator.INCLUDE_DOWN_KEY, "true")
                .containsEntry(DriftOptions.Generator.FILE_NAME_FORMAT_KEY, "changes-%d.sql");
    }

    @Test
    @DisplayName("우선순위: 명시 프로파일 > 환경변수 > dev")
    void profilePrecedence() throws IOException {
        Files.writeString(tempDir.resolve("drift.yaml"), CONFIG);

        assertThat(loader(tempDir, "prod").loadConfiguration(null))
                .containsEntry(DriftOptions.Generator.OUTPUT_DIR_KEY, "/var/migrations");
        assertThat(loader(tempDir, "prod").loadConfiguration("dev"))
                .containsEntry(DriftOptions.Generator.OUTPUT_DIR_KEY, "db/migrations");
        assertThat(loader(tempDir, " ").resolveActiveProfile(null)).isEqualTo("dev");
    }

    @Test
    void prodProfileBuildsOptions() throws IOException {
        Files.writeString(tempDir.resolve("drift.yaml"), CONFIG);
        Map<String, String> config = loader(tempDir, null).loadConfiguration("prod");

        GeneratorOptions generator = GeneratorOptions.fromConfiguration(config);
        AnalyzerOptions analyzer = AnalyzerOptions.fromConfiguration(config);

        assertThat(generator.getDialect()).isEqualTo("postgresql");
        assertThat(generator.getOutputDir()).isEqualTo(Path.of("/var/migrations"));
        assertThat(generator.getFileNameFormat()).isEqualTo("V%d__auto.sql");
        assertThat(generator.isIncludeDown()).isFalse();
        assertThat(analyzer.isIgnoreCase()).isFalse();
        assertThat(analyzer.isDetectRenames()).isTrue();
    }

    @Test
    @DisplayName("없는 프로파일은 기본값")
    void unknownProfileFallsBackToDefaults() throws IOException {
        Files.writeString(tempDir.resolve("drift.yaml"), CONFIG);

        Map<String, String> config = loader(tempDir, null).loadConfiguration("staging");

        assertThat(config).containsEntry(DriftOptions.Generator.OUTPUT_DIR_KEY, "migrations");
    }

    @Test
    @DisplayName("잘못된 YAML은 경고 후 기본값")
    void malformedFileFallsBackToDefaults() throws IOException {
        Files.writeString(tempDir.resolve("drift.yaml"), "profiles: [unclosed");

        Map<String, String> config = loader(tempDir, null).loadConfiguration(null);

        assertThat(config).containsEntry(DriftOptions.Generator.DIALECT_KEY, "postgres");
    }
}

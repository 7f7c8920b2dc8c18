package org.drift.migration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.drift.options.DriftOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class GeneratorOptions {
    @NonNull @Builder.Default String dialect = DriftOptions.Generator.DIALECT_DEFAULT;
    @NonNull @Builder.Default Path outputDir = Path.of(DriftOptions.Generator.OUTPUT_DIR_DEFAULT);
    @NonNull @Builder.Default String fileNameFormat = DriftOptions.Generator.FILE_NAME_FORMAT_DEFAULT;
    @Builder.Default boolean includeDown = DriftOptions.Generator.INCLUDE_DOWN_DEFAULT;
    @Builder.Default boolean checkExistingMigrations = DriftOptions.Generator.CHECK_EXISTING_DEFAULT;
    @NonNull @Builder.Default Logger logger = LoggerFactory.getLogger(MigrationGenerator.class);
    // 파일명 타임스탬프용, 테스트에서 고정 시계 주입
    @NonNull @Builder.Default Clock clock = Clock.systemUTC();

    public static GeneratorOptions defaults() {
        return GeneratorOptions.builder().build();
    }

    /**
     * Builds options from a map produced by {@link org.drift.config.ConfigurationLoader}.
     * Missing or blank keys keep their defaults.
     */
    public static GeneratorOptions fromConfiguration(Map<String, String> config) {
        GeneratorOptionsBuilder builder = GeneratorOptions.builder();

        String dialect = config.get(DriftOptions.Generator.DIALECT_KEY);
        if (dialect != null && !dialect.isBlank()) {
            builder.dialect(dialect.trim());
        }
        String outputDir = config.get(DriftOptions.Generator.OUTPUT_DIR_KEY);
        if (outputDir != null && !outputDir.isBlank()) {
            builder.outputDir(Path.of(outputDir.trim()));
        }
        String fileNameFormat = config.get(DriftOptions.Generator.FILE_NAME_FORMAT_KEY);
        if (fileNameFormat != null && !fileNameFormat.isBlank()) {
            builder.fileNameFormat(fileNameFormat.trim());
        }
        String includeDown = config.get(DriftOptions.Generator.INCLUDE_DOWN_KEY);
        if (includeDown != null && !includeDown.isBlank()) {
            builder.includeDown(Boolean.parseBoolean(includeDown.trim()));
        }
        String checkExisting = config.get(DriftOptions.Generator.CHECK_EXISTING_KEY);
        if (checkExisting != null && !checkExisting.isBlank()) {
            builder.checkExistingMigrations(Boolean.parseBoolean(checkExisting.trim()));
        }
        return builder.build();
    }
}

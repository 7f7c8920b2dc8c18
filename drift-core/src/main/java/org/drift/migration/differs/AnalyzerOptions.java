package org.drift.migration.differs;

import lombok.Builder;
import lombok.Value;
import org.drift.options.DriftOptions;

import java.util.Map;

@Value
@Builder
public class AnalyzerOptions {
    @Builder.Default boolean ignoreCase = DriftOptions.Analyzer.IGNORE_CASE_DEFAULT;
    // 아래 세 옵션은 아직 비교 로직에 연결되어 있지 않음
    @Builder.Default boolean ignoreWhitespace = false;
    @Builder.Default boolean detectRenames = false;
    @Builder.Default boolean validateConstraints = false;

    public static AnalyzerOptions defaults() {
        return AnalyzerOptions.builder().build();
    }

    /**
     * Builds options from a map produced by {@link org.drift.config.ConfigurationLoader}.
     * Missing keys keep their defaults.
     */
    public static AnalyzerOptions fromConfiguration(Map<String, String> config) {
        return AnalyzerOptions.builder()
                .ignoreCase(flag(config, DriftOptions.Analyzer.IGNORE_CASE_KEY, DriftOptions.Analyzer.IGNORE_CASE_DEFAULT))
                .ignoreWhitespace(flag(config, DriftOptions.Analyzer.IGNORE_WHITESPACE_KEY, false))
                .detectRenames(flag(config, DriftOptions.Analyzer.DETECT_RENAMES_KEY, false))
                .validateConstraints(flag(config, DriftOptions.Analyzer.VALIDATE_CONSTRAINTS_KEY, false))
                .build();
    }

    private static boolean flag(Map<String, String> config, String key, boolean defaultValue) {
        String value = config.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}

package org.drift.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.drift.options.DriftOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = DriftOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = DriftOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = DriftOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory.toAbsolutePath();
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: 명시 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param profile 호출자가 지정한 프로파일 (null 가능)
     * @return {@link DriftOptions} 키로 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String profile) {
        String activeProfile = resolveActiveProfile(profile);

        Optional<DriftConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            // 설정 파일이 없으면 기본값 사용
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String profile) {
        if (profile != null && !profile.trim().isEmpty()) {
            return profile.trim();
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile.trim();
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 drift.yaml을 찾습니다.
     */
    private Optional<DriftConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    DriftConfiguration config = yamlMapper.readValue(configFile.toFile(), DriftConfiguration.class);
                    log.debug("Loaded configuration from {}", configFile);
                    return Optional.ofNullable(config);
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(DriftConfiguration config, String profile) {
        var profiles = config.getProfiles();
        var profileConfig = profiles == null ? null : profiles.get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        if (profileConfig.getDialect() != null) {
            configMap.put(DriftOptions.Generator.DIALECT_KEY, profileConfig.getDialect());
        }

        // output 설정
        var output = profileConfig.getOutput();
        if (output != null) {
            putIfPresent(configMap, DriftOptions.Generator.OUTPUT_DIR_KEY, output.getDirectory());
            putIfPresent(configMap, DriftOptions.Generator.FILE_NAME_FORMAT_KEY, output.getFileNameFormat());
            putIfPresent(configMap, DriftOptions.Generator.INCLUDE_DOWN_KEY, output.getIncludeDown());
            putIfPresent(configMap, DriftOptions.Generator.CHECK_EXISTING_KEY, output.getCheckExisting());
        }

        // analyzer 설정
        var analyzer = profileConfig.getAnalyzer();
        if (analyzer != null) {
            putIfPresent(configMap, DriftOptions.Analyzer.IGNORE_CASE_KEY, analyzer.getIgnoreCase());
            putIfPresent(configMap, DriftOptions.Analyzer.IGNORE_WHITESPACE_KEY, analyzer.getIgnoreWhitespace());
            putIfPresent(configMap, DriftOptions.Analyzer.DETECT_RENAMES_KEY, analyzer.getDetectRenames());
            putIfPresent(configMap, DriftOptions.Analyzer.VALIDATE_CONSTRAINTS_KEY, analyzer.getValidateConstraints());
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> map, String key, Object value) {
        if (value != null) {
            map.put(key, String.valueOf(value));
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
            DriftOptions.Generator.DIALECT_KEY, DriftOptions.Generator.DIALECT_DEFAULT,
            DriftOptions.Generator.OUTPUT_DIR_KEY, DriftOptions.Generator.OUTPUT_DIR_DEFAULT,
            DriftOptions.Generator.FILE_NAME_FORMAT_KEY, DriftOptions.Generator.FILE_NAME_FORMAT_DEFAULT,
            DriftOptions.Generator.INCLUDE_DOWN_KEY, String.valueOf(DriftOptions.Generator.INCLUDE_DOWN_DEFAULT),
            DriftOptions.Generator.CHECK_EXISTING_KEY, String.valueOf(DriftOptions.Generator.CHECK_EXISTING_DEFAULT),
            DriftOptions.Analyzer.IGNORE_CASE_KEY, String.valueOf(DriftOptions.Analyzer.IGNORE_CASE_DEFAULT)
        );
    }
}

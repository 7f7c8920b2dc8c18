package org.drift.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * {@code drift.yaml} 매핑 모델
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DriftConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("dialect")
        private String dialect;

        @JsonProperty("output")
        private OutputConfiguration output;

        @JsonProperty("analyzer")
        private AnalyzerConfiguration analyzer;
    }

    /**
     * 마이그레이션 파일 출력 설정
     */
    @Data
    public static class OutputConfiguration {

        @JsonProperty("directory")
        private String directory;

        @JsonProperty("fileNameFormat")
        private String fileNameFormat;

        @JsonProperty("includeDown")
        private Boolean includeDown;

        @JsonProperty("checkExisting")
        private Boolean checkExisting;
    }

    /**
     * 스키마 비교 설정
     */
    @Data
    public static class AnalyzerConfiguration {

        @JsonProperty("ignoreCase")
        private Boolean ignoreCase;

        @JsonProperty("ignoreWhitespace")
        private Boolean ignoreWhitespace;

        @JsonProperty("detectRenames")
        private Boolean detectRenames;

        @JsonProperty("validateConstraints")
        private Boolean validateConstraints;
    }
}

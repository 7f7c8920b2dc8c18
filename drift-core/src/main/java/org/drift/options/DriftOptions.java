package org.drift.options;

/**
 * Defines configuration option constants used throughout drift.
 * The configuration loader produces maps keyed by these constants, and the analyzer and
 * generator options read them back.
 */
public final class DriftOptions {

    private DriftOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "DRIFT_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "drift.yaml";
    }

    /**
     * Migration file generation settings.
     */
    public static final class Generator {
        private Generator() {}

        public static final String DIALECT_KEY = "drift.generator.dialect";
        public static final String DIALECT_DEFAULT = "postgres";

        public static final String OUTPUT_DIR_KEY = "drift.generator.outputDir";
        public static final String OUTPUT_DIR_DEFAULT = "migrations";

        /**
         * printf-style up file name; receives the epoch second as its only argument.
         */
        public static final String FILE_NAME_FORMAT_KEY = "drift.generator.fileNameFormat";
        public static final String FILE_NAME_FORMAT_DEFAULT = "changes-%d.sql";

        public static final String INCLUDE_DOWN_KEY = "drift.generator.includeDown";
        public static final boolean INCLUDE_DOWN_DEFAULT = false;

        /**
         * Skip drops that up files already in the output directory have applied.
         */
        public static final String CHECK_EXISTING_KEY = "drift.generator.checkExisting";
        public static final boolean CHECK_EXISTING_DEFAULT = true;
    }

    /**
     * Schema comparison settings. Only {@link #IGNORE_CASE_KEY} changes comparison behavior;
     * the remaining flags are accepted and reported as ignored.
     */
    public static final class Analyzer {
        private Analyzer() {}

        public static final String IGNORE_CASE_KEY = "drift.analyzer.ignoreCase";
        public static final boolean IGNORE_CASE_DEFAULT = true;

        public static final String IGNORE_WHITESPACE_KEY = "drift.analyzer.ignoreWhitespace";
        public static final String DETECT_RENAMES_KEY = "drift.analyzer.detectRenames";
        public static final String VALIDATE_CONSTRAINTS_KEY = "drift.analyzer.validateConstraints";
    }
}

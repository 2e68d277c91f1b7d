package com.changesentinel.runner;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration for one batch run.
 *
 * <p>
 * Values are resolved from environment variables with defaults; command-line
 * arguments ({@code <input> [output]}) override the paths.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment(String...)} for the command line, or the
 * {@link Builder} for tests. The builder validates at {@link Builder#build()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    public static final String ENV_INPUT = "CHANGE_SENTINEL_INPUT";
    public static final String ENV_OUTPUT = "CHANGE_SENTINEL_OUTPUT";
    public static final String ENV_PROFILES_FILE = "CHANGE_SENTINEL_PROFILES_FILE";
    public static final String ENV_TIMEOUT_SECONDS = "CHANGE_SENTINEL_TIMEOUT_SECONDS";

    /** Output path meaning "write the report to standard output". */
    public static final String STDOUT = "-";

    private final String inputPath;
    private final String outputPath;
    private final String profilesPath;
    private final long timeoutSeconds;

    private RunnerConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.profilesPath = b.profilesPath;
        this.timeoutSeconds = b.timeoutSeconds;
    }

    /**
     * Build a {@link RunnerConfig} from environment variables, letting
     * {@code args[0]} and {@code args[1]} override input and output.
     *
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment(String... args) {
        try {
            return new Builder()
                    .inputPath(args.length > 0 ? args[0] : env(ENV_INPUT, ""))
                    .outputPath(args.length > 1 ? args[1] : env(ENV_OUTPUT, STDOUT))
                    .profilesPath(env(ENV_PROFILES_FILE, ""))
                    .timeoutSeconds(Long.parseLong(env(ENV_TIMEOUT_SECONDS, "0")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public boolean writesToStdout() {
        return STDOUT.equals(outputPath);
    }

    public String getProfilesPath() {
        return profilesPath;
    }

    /**
     * @return the wall-clock budget for the whole run, or {@code null} for
     *         none
     */
    public Duration getTimeout() {
        return timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}. {@code inputPath} is required;
     * the timeout must not be negative (zero means none).
     */
    public static class Builder {
        private String inputPath;
        private String outputPath = STDOUT;
        private String profilesPath = "";
        private long timeoutSeconds;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder profilesPath(String v) {
            this.profilesPath = v;
            return this;
        }

        public Builder timeoutSeconds(long v) {
            this.timeoutSeconds = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            if (inputPath == null || inputPath.isBlank()) {
                throw new IllegalArgumentException("inputPath must not be null or blank; pass it as the "
                        + "first argument or set " + ENV_INPUT);
            }
            if (outputPath == null || outputPath.isBlank()) {
                throw new IllegalArgumentException("outputPath must not be null or blank");
            }
            Objects.requireNonNull(profilesPath, "profilesPath must not be null");
            if (timeoutSeconds < 0) {
                throw new IllegalArgumentException("timeoutSeconds must be >= 0, got: " + timeoutSeconds);
            }
            return new RunnerConfig(this);
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", profilesPath='" + profilesPath + '\'' +
                ", timeoutSeconds=" + timeoutSeconds +
                '}';
    }
}

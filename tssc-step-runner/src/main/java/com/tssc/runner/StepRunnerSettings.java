package com.tssc.runner;

import com.tssc.step.StepWorkspace;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Where a pipeline run keeps its results and working files, and which environment it targets.
 * <p>
 * From environment variables: TSSC_RESULTS_DIR (default {@value #DEFAULT_RESULTS_DIR}),
 * TSSC_WORK_DIR (default {@value #DEFAULT_WORK_DIR}), TSSC_RESULTS_FILE_NAME (default
 * {@value StepWorkspace#DEFAULT_RESULTS_FILE_NAME}), TSSC_ENVIRONMENT (default none).
 */
public final class StepRunnerSettings {

    private static final String ENV_RESULTS_DIR = "TSSC_RESULTS_DIR";
    private static final String ENV_WORK_DIR = "TSSC_WORK_DIR";
    private static final String ENV_RESULTS_FILE_NAME = "TSSC_RESULTS_FILE_NAME";
    private static final String ENV_ENVIRONMENT = "TSSC_ENVIRONMENT";

    public static final String DEFAULT_RESULTS_DIR = "tssc-results";
    public static final String DEFAULT_WORK_DIR = "tssc-working";

    private final Path resultsDirPath;
    private final String resultsFileName;
    private final Path workDirPath;
    private final String environment;

    private StepRunnerSettings(Builder b) {
        this.resultsDirPath = b.resultsDirPath != null ? b.resultsDirPath : Paths.get(DEFAULT_RESULTS_DIR);
        this.resultsFileName = b.resultsFileName != null ? b.resultsFileName : StepWorkspace.DEFAULT_RESULTS_FILE_NAME;
        this.workDirPath = b.workDirPath != null ? b.workDirPath : Paths.get(DEFAULT_WORK_DIR);
        this.environment = b.environment;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Settings from the process environment. */
    public static StepRunnerSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Settings from the given variables; blank or missing variables fall back to defaults.
     */
    public static StepRunnerSettings fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder b = builder();
        String resultsDir = trimToNull(env.get(ENV_RESULTS_DIR));
        if (resultsDir != null) b.resultsDirPath(Paths.get(resultsDir));
        String workDir = trimToNull(env.get(ENV_WORK_DIR));
        if (workDir != null) b.workDirPath(Paths.get(workDir));
        b.resultsFileName(trimToNull(env.get(ENV_RESULTS_FILE_NAME)));
        b.environment(trimToNull(env.get(ENV_ENVIRONMENT)));
        return b.build();
    }

    public Path getResultsDirPath() {
        return resultsDirPath;
    }

    public String getResultsFileName() {
        return resultsFileName;
    }

    public Path getWorkDirPath() {
        return workDirPath;
    }

    /** Environment to run steps against, or null. */
    public String getEnvironment() {
        return environment;
    }

    /** Workspace handed to every step implementer of the run. */
    public StepWorkspace toWorkspace() {
        return StepWorkspace.of(resultsDirPath, resultsFileName, workDirPath);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "StepRunnerSettings{resultsDirPath=" + resultsDirPath + ", resultsFileName=" + resultsFileName
                + ", workDirPath=" + workDirPath + ", environment=" + environment + "}";
    }

    public static final class Builder {
        private Path resultsDirPath;
        private String resultsFileName;
        private Path workDirPath;
        private String environment;

        private Builder() {
        }

        public Builder resultsDirPath(Path resultsDirPath) {
            this.resultsDirPath = resultsDirPath;
            return this;
        }

        public Builder resultsFileName(String resultsFileName) {
            this.resultsFileName = resultsFileName;
            return this;
        }

        public Builder workDirPath(Path workDirPath) {
            this.workDirPath = workDirPath;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public StepRunnerSettings build() {
            return new StepRunnerSettings(this);
        }
    }
}

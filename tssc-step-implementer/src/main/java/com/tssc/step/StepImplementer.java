package com.tssc.step;

import com.tssc.config.ConfigValue;
import com.tssc.config.SubStepConfig;
import com.tssc.result.StepIdentity;
import com.tssc.result.StepResult;
import com.tssc.result.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base contract for pluggable step implementers. A run moves through
 * {@link StepImplementerState}: resolve the runtime step configuration from the
 * {@link SubStepConfig} layers and {@link #stepImplementerConfigDefaults()}, validate
 * {@link #requiredRuntimeStepConfigKeys()}, run {@link #executeStep(WorkflowResult)}, then append
 * the result to the ledger and persist the snapshot and results file.
 * <p>
 * Implementers report expected negative outcomes (lint violations, a missing upstream artifact)
 * as a {@link StepResult} with success false. Anything thrown from {@link #executeStep} is treated
 * as fatal: it is rethrown as {@link StepExecutionException} and nothing is recorded.
 * <p>
 * Instances are single-use and not thread-safe; the runner creates one per sub step execution.
 */
public abstract class StepImplementer implements StepIdentity {

    private static final Logger log = LoggerFactory.getLogger(StepImplementer.class);

    private final StepWorkspace workspace;
    private final SubStepConfig config;
    private final String environment;
    private StepImplementerState state = StepImplementerState.CONSTRUCTED;

    /**
     * @param workspace   results and working directories
     * @param config      configuration of the sub step this implementer runs
     * @param environment environment to run against; null for none
     */
    protected StepImplementer(StepWorkspace workspace, SubStepConfig config, String environment) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.config = Objects.requireNonNull(config, "config");
        this.environment = environment;
    }

    /**
     * Lowest-precedence configuration values for this implementer. Must have no side effects.
     */
    public abstract Map<String, Object> stepImplementerConfigDefaults();

    /**
     * Runtime configuration keys that must be present and non-empty before the step runs, in the
     * order they are reported when missing.
     */
    public abstract List<String> requiredRuntimeStepConfigKeys();

    /**
     * Runs the step. The only part of the lifecycle with external side effects.
     *
     * @param workflowResult results of the steps run so far in this pipeline run; read-only by contract
     * @return result of this step; never null
     * @throws Exception on unexpected failure (fatal for the run)
     */
    protected abstract StepResult executeStep(WorkflowResult workflowResult) throws Exception;

    /**
     * Runs the step against the ledger persisted in the working directory (empty when this is the
     * first step of the run).
     *
     * @return whether the step succeeded
     * @throws StepConfigurationException when required runtime keys are missing
     * @throws StepExecutionException     when the implementer fails unexpectedly
     */
    public final boolean runStep() {
        return runStep(WorkflowResult.loadFromSnapshotFile(getWorkflowResultSnapshotPath()));
    }

    /**
     * Runs the step against the given ledger. On completion the ledger holds one more result and
     * has been written to the snapshot and results file.
     *
     * @param workflowResult ledger of the run; appended to in place
     * @return whether the step succeeded
     * @throws StepConfigurationException when required runtime keys are missing
     * @throws StepExecutionException     when the implementer fails unexpectedly
     */
    public final boolean runStep(WorkflowResult workflowResult) {
        Objects.requireNonNull(workflowResult, "workflowResult");
        if (state != StepImplementerState.CONSTRUCTED) {
            throw new IllegalStateException("Step implementer already run | step=" + getStepName()
                    + " | subStep=" + getSubStepName() + " | state=" + state);
        }
        log.info("Step start | step={} | subStep={} | implementer={} | environment={}",
                getStepName(), getSubStepName(), getSubStepImplementerName(), environment);
        logConfigurationLayers();

        Map<String, Object> runtimeStepConfig = getCopyOfRuntimeStepConfig();
        state = StepImplementerState.CONFIGURED;
        if (log.isDebugEnabled()) {
            log.debug("Runtime step configuration | step={} | config={}",
                    getStepName(), ConfigValue.convertLeavesToValues(runtimeStepConfig));
        }

        validateRuntimeStepConfig(runtimeStepConfig);
        state = StepImplementerState.VALIDATED;

        state = StepImplementerState.EXECUTING;
        StepResult stepResult = execute(workflowResult);

        workflowResult.addStepResult(stepResult);
        workflowResult.writeToSnapshotFile(getWorkflowResultSnapshotPath());
        workflowResult.writeResultsToYmlFile(getResultsFilePath());
        state = stepResult.isSuccess()
                ? StepImplementerState.COMPLETED_SUCCESS
                : StepImplementerState.COMPLETED_FAILURE;

        if (stepResult.isSuccess()) {
            log.info("Step end | step={} | subStep={} | success=true | resultsFile={}",
                    getStepName(), getSubStepName(), getResultsFilePath());
        } else {
            log.warn("Step end | step={} | subStep={} | success=false | message={} | resultsFile={}",
                    getStepName(), getSubStepName(), stepResult.getMessage(), getResultsFilePath());
        }
        log.debug("Step result | {}", stepResult.getStepResult());
        return stepResult.isSuccess();
    }

    private StepResult execute(WorkflowResult workflowResult) {
        StepResult stepResult;
        try {
            stepResult = executeStep(workflowResult);
        } catch (StepExecutionException e) {
            log.error("Step failed | step={} | subStep={} | error={}", getStepName(), getSubStepName(), e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            log.error("Step failed | step={} | subStep={} | error={}", getStepName(), getSubStepName(), e.getMessage(), e);
            throw new StepExecutionException(getStepName(), getSubStepName(),
                    "Unexpected error running step (" + getStepName() + ") sub step (" + getSubStepName()
                            + "): " + e.getMessage(), e);
        }
        if (stepResult == null) {
            throw new StepExecutionException(getStepName(), getSubStepName(),
                    "Step (" + getStepName() + ") sub step (" + getSubStepName() + ") returned no result");
        }
        return stepResult;
    }

    /**
     * Checks that every required key is present and non-empty. Null, empty strings, empty
     * collections and maps, and numeric zero count as empty; {@code Boolean.FALSE} is a value.
     *
     * @throws StepConfigurationException listing every missing key in declaration order
     */
    protected void validateRuntimeStepConfig(Map<String, Object> runtimeStepConfig) {
        List<String> missing = new ArrayList<>();
        for (String key : requiredRuntimeStepConfigKeys()) {
            if (!runtimeStepConfig.containsKey(key) || isEmptyValue(ConfigValue.unwrapForValue(runtimeStepConfig.get(key)))) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new StepConfigurationException("The runtime step configuration ("
                    + ConfigValue.convertLeavesToValues(runtimeStepConfig)
                    + ") is missing the required configuration keys (" + missing + ")", missing);
        }
    }

    private static boolean isEmptyValue(Object value) {
        if (value == null) return true;
        if (value instanceof Boolean) return false;
        if (value instanceof CharSequence) return ((CharSequence) value).length() == 0;
        if (value instanceof Collection) return ((Collection<?>) value).isEmpty();
        if (value instanceof Map) return ((Map<?, ?>) value).isEmpty();
        if (value instanceof Number) return ((Number) value).doubleValue() == 0d;
        return false;
    }

    private void logConfigurationLayers() {
        if (!log.isDebugEnabled()) return;
        log.debug("Step implementer configuration defaults | {}", ConfigValue.convertLeavesToValues(stepImplementerConfigDefaults()));
        log.debug("Global configuration defaults | {}", ConfigValue.convertLeavesToValues(getGlobalConfigDefaults()));
        log.debug("Global environment configuration defaults | {}", ConfigValue.convertLeavesToValues(getGlobalEnvironmentConfigDefaults()));
        log.debug("Step configuration | {}", ConfigValue.convertLeavesToValues(getStepConfig()));
        log.debug("Step environment configuration | {}", ConfigValue.convertLeavesToValues(getStepEnvironmentConfig()));
        log.debug("Step configuration runtime overrides | {}", ConfigValue.convertLeavesToValues(getStepConfigOverrides()));
    }

    public StepImplementerState getState() {
        return state;
    }

    public SubStepConfig getConfig() {
        return config;
    }

    /** Environment this step runs against, or null. */
    public String getEnvironment() {
        return environment;
    }

    public StepWorkspace getWorkspace() {
        return workspace;
    }

    @Override
    public String getStepName() {
        return config.getStepName();
    }

    @Override
    public String getSubStepName() {
        return config.getSubStepName();
    }

    @Override
    public String getSubStepImplementerName() {
        return config.getSubStepImplementerName();
    }

    public Map<String, Object> getStepConfig() {
        return config.getSubStepConfig();
    }

    public Map<String, Object> getStepConfigOverrides() {
        return config.getStepConfigOverrides();
    }

    public Map<String, Object> getStepEnvironmentConfig() {
        return config.getSubStepEnvConfig(environment);
    }

    public Map<String, Object> getGlobalConfigDefaults() {
        return config.getGlobalDefaults();
    }

    public Map<String, Object> getGlobalEnvironmentConfigDefaults() {
        return config.getGlobalEnvironmentDefaults(environment);
    }

    /**
     * Value of {@code key} from the merged configuration layers (implementer defaults lowest,
     * runtime overrides highest), as plain data.
     *
     * @return the value, or null when not configured
     */
    public Object getConfigValue(String key) {
        return config.getConfigValue(key, environment, stepImplementerConfigDefaults());
    }

    /** Deep copy of the merged runtime step configuration; leaves keep their {@link ConfigValue} wrappers. */
    public Map<String, Object> getCopyOfRuntimeStepConfig() {
        return config.getCopyOfRuntimeStepConfig(environment, stepImplementerConfigDefaults());
    }

    /**
     * Whether the given keys have non-null values.
     *
     * @param keys     keys to check
     * @param matchAny true: at least one key must have a value; false: all must
     */
    public boolean hasConfigValue(List<String> keys, boolean matchAny) {
        for (String key : keys) {
            boolean present = getConfigValue(key) != null;
            if (matchAny && present) return true;
            if (!matchAny && !present) return false;
        }
        return !matchAny;
    }

    /** Whether {@code key} has a non-null value. */
    public boolean hasConfigValue(String key) {
        return hasConfigValue(List.of(key), false);
    }

    /** Results directory, created if missing. */
    public Path getResultsDirPath() {
        return createDirectories(workspace.getResultsDirPath());
    }

    /** Results file path inside the results directory (directory created if missing). */
    public Path getResultsFilePath() {
        return getResultsDirPath().resolve(workspace.getResultsFileName());
    }

    /** Working directory, created if missing. */
    public Path getWorkDirPath() {
        return createDirectories(workspace.getWorkDirPath());
    }

    /** Working directory of this step ({@code <work-dir>/<step-name>}), created if missing. */
    public Path getWorkDirPathStep() {
        return createDirectories(getWorkDirPath().resolve(getStepName()));
    }

    /** Path of the workflow result snapshot in the working directory. */
    public Path getWorkflowResultSnapshotPath() {
        return getWorkDirPath().resolve(StepWorkspace.WORKFLOW_RESULT_SNAPSHOT_FILE_NAME);
    }

    /**
     * Creates a sub directory of this step's working directory.
     *
     * @param subDirRelativePath path relative to {@link #getWorkDirPathStep()}
     * @return the created directory
     */
    public Path createWorkingDirSubDir(String subDirRelativePath) {
        return createDirectories(getWorkDirPathStep().resolve(subDirRelativePath));
    }

    /**
     * Writes a file in this step's working directory (e.g. {@code tssc-working/unit-test/report.txt}).
     * The file name may contain sub directories, which are created.
     *
     * @param fileName file name relative to {@link #getWorkDirPathStep()}
     * @param contents bytes to write, replacing existing content; null only touches the file
     * @return path of the written file
     */
    public Path writeWorkingFile(String fileName, byte[] contents) {
        Path file = getWorkDirPathStep().resolve(fileName);
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            if (contents == null) {
                if (Files.exists(file)) {
                    Files.setLastModifiedTime(file, FileTime.fromMillis(System.currentTimeMillis()));
                } else {
                    Files.createFile(file);
                }
            } else {
                Files.write(file, contents);
            }
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write working file " + file, e);
        }
    }

    private static Path createDirectories(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }
}

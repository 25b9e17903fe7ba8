package com.tssc.step;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Directories and file names a step implementer writes to: the results directory holding the
 * YAML results file, and the working directory holding the workflow result snapshot and
 * per-step scratch directories.
 */
public final class StepWorkspace {

    /**
     * Snapshot file name. The snapshot sits at the root of the working directory, not in a step's
     * own {@code <work-dir>/<step-name>} directory, because every step of the run reloads the same
     * ledger: a per-step snapshot would hide earlier steps' results from later steps.
     */
    public static final String WORKFLOW_RESULT_SNAPSHOT_FILE_NAME = "tssc-results.pkl";
    /** Default results file name inside the results directory. */
    public static final String DEFAULT_RESULTS_FILE_NAME = "tssc-results.yml";

    private final Path resultsDirPath;
    private final String resultsFileName;
    private final Path workDirPath;

    private StepWorkspace(Path resultsDirPath, String resultsFileName, Path workDirPath) {
        this.resultsDirPath = Objects.requireNonNull(resultsDirPath, "resultsDirPath");
        this.resultsFileName = resultsFileName != null && !resultsFileName.isBlank()
                ? resultsFileName.trim()
                : DEFAULT_RESULTS_FILE_NAME;
        this.workDirPath = Objects.requireNonNull(workDirPath, "workDirPath");
    }

    /**
     * @param resultsDirPath  directory for the results file
     * @param resultsFileName results file name; null or blank means {@value #DEFAULT_RESULTS_FILE_NAME}
     * @param workDirPath     working directory for the snapshot and scratch files
     */
    public static StepWorkspace of(Path resultsDirPath, String resultsFileName, Path workDirPath) {
        return new StepWorkspace(resultsDirPath, resultsFileName, workDirPath);
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

    /** {@code <results-dir>/<results-file-name>} */
    public Path getResultsFilePath() {
        return resultsDirPath.resolve(resultsFileName);
    }

    /** {@code <work-dir>/tssc-results.pkl} */
    public Path getWorkflowResultSnapshotPath() {
        return workDirPath.resolve(WORKFLOW_RESULT_SNAPSHOT_FILE_NAME);
    }

    @Override
    public String toString() {
        return "StepWorkspace{resultsDirPath=" + resultsDirPath + ", resultsFileName=" + resultsFileName
                + ", workDirPath=" + workDirPath + "}";
    }
}

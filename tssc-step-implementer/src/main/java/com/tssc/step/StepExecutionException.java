package com.tssc.step;

/**
 * Unexpected failure while a step implementer runs (e.g. an external tool could not be invoked).
 * Fatal for the run: no result is recorded for the step. The original error is kept as the cause.
 */
public class StepExecutionException extends RuntimeException {

    private final String stepName;
    private final String subStepName;

    public StepExecutionException(String stepName, String subStepName, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
        this.subStepName = subStepName;
    }

    public StepExecutionException(String stepName, String subStepName, String message) {
        this(stepName, subStepName, message, null);
    }

    public String getStepName() {
        return stepName;
    }

    public String getSubStepName() {
        return subStepName;
    }
}

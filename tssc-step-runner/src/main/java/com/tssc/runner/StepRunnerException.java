package com.tssc.runner;

/**
 * Thrown when the runner is asked to do something the pipeline definition does not support,
 * such as running a step that has no configuration.
 */
public class StepRunnerException extends RuntimeException {

    public StepRunnerException(String message) {
        super(message);
    }
}

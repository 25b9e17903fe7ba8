package com.tssc.result;

/**
 * Thrown when the workflow result snapshot or results file cannot be read or written.
 */
public class WorkflowResultException extends RuntimeException {

    public WorkflowResultException(String message, Throwable cause) {
        super(message, cause);
    }
}

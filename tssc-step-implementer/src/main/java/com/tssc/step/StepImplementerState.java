package com.tssc.step;

/**
 * Lifecycle of a {@link StepImplementer} run. Transitions only move forward:
 * CONSTRUCTED → CONFIGURED → VALIDATED → EXECUTING → COMPLETED_SUCCESS | COMPLETED_FAILURE.
 * A fatal error leaves the implementer in the state where it occurred.
 */
public enum StepImplementerState {
    /** Created; runtime config not yet resolved. */
    CONSTRUCTED,
    /** Runtime step config resolved from all layers. */
    CONFIGURED,
    /** Required runtime keys present. */
    VALIDATED,
    /** Implementer logic running. */
    EXECUTING,
    /** Result recorded and persisted; step succeeded. */
    COMPLETED_SUCCESS,
    /** Result recorded and persisted; step reported failure. */
    COMPLETED_FAILURE;

    public boolean isCompleted() {
        return this == COMPLETED_SUCCESS || this == COMPLETED_FAILURE;
    }
}

package com.tssc.result;

/**
 * The three names that identify a step execution: step, sub step and sub step implementer.
 * Implemented by step implementers so results can be bound to them without a dependency on the
 * implementer contract.
 */
public interface StepIdentity {

    String getStepName();

    String getSubStepName();

    String getSubStepImplementerName();
}

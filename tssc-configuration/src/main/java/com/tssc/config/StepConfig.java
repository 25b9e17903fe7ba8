package com.tssc.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * All sub steps configured for one pipeline step, in definition order. The instance returned by
 * {@link Config#getStepConfig(String)} stays valid when more definitions are added: new sub steps
 * are appended to it and receive the overrides set on it.
 */
public final class StepConfig {

    private final String stepName;
    private final List<SubStepConfig> subSteps = new ArrayList<>();
    private Map<String, ?> stepConfigOverrides;

    StepConfig(String stepName, Map<String, ?> stepConfigOverrides) {
        this.stepName = Objects.requireNonNull(stepName, "stepName");
        this.stepConfigOverrides = stepConfigOverrides;
    }

    public String getStepName() {
        return stepName;
    }

    /** Sub steps in definition order (unmodifiable). */
    public List<SubStepConfig> getSubSteps() {
        return Collections.unmodifiableList(subSteps);
    }

    /**
     * Returns the sub step with the given name, or null.
     */
    public SubStepConfig getSubStep(String subStepName) {
        for (SubStepConfig subStep : subSteps) {
            if (subStep.getSubStepName().equals(subStepName)) {
                return subStep;
            }
        }
        return null;
    }

    /**
     * Injects runtime overrides into every sub step of this step.
     *
     * @param overrides runtime overrides; null clears them
     */
    public void setStepConfigOverrides(Map<String, ?> overrides) {
        this.stepConfigOverrides = overrides != null ? ConfigMerger.deepCopy(overrides) : null;
        for (SubStepConfig subStep : subSteps) {
            subStep.setStepConfigOverrides(overrides);
        }
    }

    /** Overrides last set on this step, or null. */
    Map<String, ?> getStepConfigOverrides() {
        return stepConfigOverrides;
    }

    void addSubStep(SubStepConfig subStep) {
        subSteps.add(Objects.requireNonNull(subStep, "subStep"));
    }

    @Override
    public String toString() {
        return "StepConfig{stepName=" + stepName + ", subSteps=" + subSteps + "}";
    }
}

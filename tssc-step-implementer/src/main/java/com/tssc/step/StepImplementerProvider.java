package com.tssc.step;

import com.tssc.config.SubStepConfig;

/**
 * SPI for pluggable step implementers. Implementations are discovered via
 * {@link java.util.ServiceLoader} ({@code META-INF/services/com.tssc.step.StepImplementerProvider})
 * and registered with {@link StepImplementerRegistry} under their step and implementer name, which
 * must match the {@code implementer} value in the pipeline definition.
 */
public interface StepImplementerProvider {

    /** Step this implementer fulfils (e.g. {@value DefaultSteps#UNIT_TEST}). */
    String getStepName();

    /** Implementer name used in the pipeline definition (e.g. "Maven"). */
    String getImplementerName();

    /**
     * Creates a new implementer for one sub step execution.
     *
     * @param workspace     results and working directories
     * @param subStepConfig configuration of the sub step
     * @param environment   environment to run against; null for none
     */
    StepImplementer createStepImplementer(StepWorkspace workspace, SubStepConfig subStepConfig, String environment);
}

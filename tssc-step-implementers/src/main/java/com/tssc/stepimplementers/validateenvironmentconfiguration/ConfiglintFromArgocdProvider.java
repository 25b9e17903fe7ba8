package com.tssc.stepimplementers.validateenvironmentconfiguration;

import com.tssc.config.SubStepConfig;
import com.tssc.step.DefaultSteps;
import com.tssc.step.StepImplementer;
import com.tssc.step.StepImplementerProvider;
import com.tssc.step.StepWorkspace;

/**
 * Provider for {@link ConfiglintFromArgocd}; used in the pipeline definition as
 * {@code implementer: ConfiglintFromArgocd} under {@code validate-environment-configuration}.
 */
public final class ConfiglintFromArgocdProvider implements StepImplementerProvider {

    @Override
    public String getStepName() {
        return DefaultSteps.VALIDATE_ENVIRONMENT_CONFIGURATION;
    }

    @Override
    public String getImplementerName() {
        return ConfiglintFromArgocd.IMPLEMENTER_NAME;
    }

    @Override
    public StepImplementer createStepImplementer(StepWorkspace workspace, SubStepConfig subStepConfig,
                                                 String environment) {
        return new ConfiglintFromArgocd(workspace, subStepConfig, environment);
    }
}

package com.tssc.runner;

import com.tssc.config.Config;
import com.tssc.config.StepConfig;
import com.tssc.config.SubStepConfig;
import com.tssc.step.StepImplementer;
import com.tssc.step.StepImplementerRegistry;
import com.tssc.step.StepWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Runs the sub steps of a pipeline step, in definition order, through implementers selected from
 * a {@link StepImplementerRegistry}. Each sub step gets a fresh implementer that reloads the
 * workflow result ledger from the snapshot, so consecutive runs (in this or another process)
 * see every earlier result.
 * <p>
 * The first failed sub step ends the step; later sub steps do not run. Whether later pipeline
 * steps run is decided by the caller from the returned flag.
 */
public final class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final Config config;
    private final StepImplementerRegistry registry;
    private final StepRunnerSettings settings;

    public StepRunner(Config config, StepImplementerRegistry registry, StepRunnerSettings settings) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Runner over the providers installed on the class path.
     */
    public static StepRunner withInstalledImplementers(Config config, StepRunnerSettings settings) {
        return new StepRunner(config, StepImplementerRegistry.loadInstalled(), settings);
    }

    /** {@link #runStep(String, Map)} without runtime overrides. */
    public boolean runStep(String stepName) {
        return runStep(stepName, null);
    }

    /**
     * Runs every sub step of the given step.
     *
     * @param stepName            step to run
     * @param stepConfigOverrides runtime overrides applied to every sub step of the step; may be null
     * @return true when every sub step succeeded; false at the first failed sub step
     * @throws StepRunnerException                   when the step has no configuration
     * @throws com.tssc.step.StepConfigurationException when an implementer is unknown or misconfigured
     * @throws com.tssc.step.StepExecutionException     when an implementer fails unexpectedly
     */
    public boolean runStep(String stepName, Map<String, ?> stepConfigOverrides) {
        Objects.requireNonNull(stepName, "stepName");
        StepConfig stepConfig = config.getStepConfig(stepName);
        if (stepConfig == null || stepConfig.getSubSteps().isEmpty()) {
            throw new StepRunnerException("Can not run step (" + stepName
                    + ") because no step configuration provided");
        }
        if (stepConfigOverrides != null) {
            config.setStepConfigOverrides(stepName, stepConfigOverrides);
        }

        StepWorkspace workspace = settings.toWorkspace();
        for (SubStepConfig subStep : stepConfig.getSubSteps()) {
            StepImplementer implementer = registry.createStepImplementer(workspace, subStep, settings.getEnvironment());
            boolean success = implementer.runStep();
            if (!success) {
                log.warn("Sub step failed; remaining sub steps skipped | step={} | subStep={}",
                        stepName, subStep.getSubStepName());
                return false;
            }
        }
        return true;
    }

    public Config getConfig() {
        return config;
    }

    public StepRunnerSettings getSettings() {
        return settings;
    }
}

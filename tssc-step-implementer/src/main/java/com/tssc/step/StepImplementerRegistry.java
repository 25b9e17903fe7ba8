package com.tssc.step;

import com.tssc.config.SubStepConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Closed set of step implementers keyed by step name and implementer name. The pipeline
 * definition selects an implementer by name; only registered providers can be selected.
 */
public final class StepImplementerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepImplementerRegistry.class);

    /** stepName → (implementerName → provider) */
    private final Map<String, Map<String, StepImplementerProvider>> providersByStep = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding every provider found on the class path via {@link ServiceLoader}.
     *
     * @throws IllegalArgumentException when two providers claim the same step and implementer name
     */
    public static StepImplementerRegistry loadInstalled() {
        StepImplementerRegistry registry = new StepImplementerRegistry();
        for (StepImplementerProvider provider : ServiceLoader.load(StepImplementerProvider.class)) {
            registry.register(provider);
        }
        log.info("Step implementers loaded | count={}", registry.size());
        return registry;
    }

    /**
     * Registers a provider under its step and implementer name.
     *
     * @throws IllegalArgumentException if a name is blank or the pair is already registered
     */
    public void register(StepImplementerProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String stepName = requireNonBlank(provider.getStepName(), "Step name");
        String implementerName = requireNonBlank(provider.getImplementerName(), "Implementer name");
        Map<String, StepImplementerProvider> byName =
                providersByStep.computeIfAbsent(stepName, k -> new ConcurrentHashMap<>());
        if (byName.putIfAbsent(implementerName, provider) != null) {
            throw new IllegalArgumentException("Step implementer already registered for step "
                    + stepName + ": " + implementerName);
        }
        log.debug("Step implementer registered | step={} | implementer={} | provider={}",
                stepName, implementerName, provider.getClass().getName());
    }

    /**
     * Returns the provider for the given step and implementer name, or null if not registered.
     */
    public StepImplementerProvider get(String stepName, String implementerName) {
        if (stepName == null || implementerName == null) return null;
        Map<String, StepImplementerProvider> byName = providersByStep.get(stepName.trim());
        return byName != null ? byName.get(implementerName.trim()) : null;
    }

    /**
     * Creates the implementer selected by the sub step's implementer name.
     *
     * @throws StepConfigurationException when no implementer is registered under that name for the step
     * @throws IllegalStateException      when the provider returns null or an implementer for another step
     */
    public StepImplementer createStepImplementer(StepWorkspace workspace, SubStepConfig subStepConfig,
                                                 String environment) {
        Objects.requireNonNull(subStepConfig, "subStepConfig");
        StepImplementerProvider provider = get(subStepConfig.getStepName(), subStepConfig.getSubStepImplementerName());
        if (provider == null) {
            throw new StepConfigurationException("No step implementer (" + subStepConfig.getSubStepImplementerName()
                    + ") registered for step (" + subStepConfig.getStepName() + "); available: "
                    + getImplementerNames(subStepConfig.getStepName()));
        }
        StepImplementer implementer = provider.createStepImplementer(workspace, subStepConfig, environment);
        if (implementer == null || !subStepConfig.getStepName().equals(implementer.getStepName())) {
            throw new IllegalStateException("Provider " + provider.getClass().getName()
                    + " did not create an implementer for step " + subStepConfig.getStepName());
        }
        return implementer;
    }

    /** Implementer names registered for the step, sorted; empty when none. */
    public List<String> getImplementerNames(String stepName) {
        Map<String, StepImplementerProvider> byName = stepName != null ? providersByStep.get(stepName) : null;
        if (byName == null) return Collections.emptyList();
        List<String> names = new ArrayList<>(byName.keySet());
        Collections.sort(names);
        return names;
    }

    /** Number of registered providers. */
    public int size() {
        int count = 0;
        for (Map<String, StepImplementerProvider> byName : providersByStep.values()) {
            count += byName.size();
        }
        return count;
    }

    private static String requireNonBlank(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must be non-blank");
        }
        return value.trim();
    }
}

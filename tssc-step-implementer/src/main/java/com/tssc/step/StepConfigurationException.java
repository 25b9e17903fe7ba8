package com.tssc.step;

import java.util.Collections;
import java.util.List;

/**
 * Thrown before a step executes when its configuration cannot be used: required runtime keys are
 * missing, or no implementer is registered for the configured name. Fatal for the run.
 */
public class StepConfigurationException extends RuntimeException {

    private final List<String> missingKeys;

    public StepConfigurationException(String message) {
        this(message, Collections.emptyList());
    }

    public StepConfigurationException(String message, List<String> missingKeys) {
        super(message);
        this.missingKeys = missingKeys != null ? List.copyOf(missingKeys) : Collections.emptyList();
    }

    /** Required keys that were missing, in declaration order; empty for other configuration errors. */
    public List<String> getMissingKeys() {
        return missingKeys;
    }
}

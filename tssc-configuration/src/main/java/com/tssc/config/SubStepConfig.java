package com.tssc.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of one sub step of a pipeline step, identified by step name, sub step name and
 * implementer name. Resolves the runtime step configuration from six layers, lowest precedence
 * first:
 * <ol>
 *   <li>step implementer defaults (passed by the caller)</li>
 *   <li>global defaults</li>
 *   <li>global environment defaults for the given environment</li>
 *   <li>sub step config</li>
 *   <li>sub step environment config for the given environment</li>
 *   <li>step config runtime overrides</li>
 * </ol>
 * All layers are held as unmodifiable deep copies. Callers may replace the runtime overrides via
 * {@link #setStepConfigOverrides(Map)}; {@link Config} refreshes the global layers when another
 * definition is added, so an instance obtained earlier stays current.
 */
public final class SubStepConfig {

    /** Source name recorded on override leaves injected without provenance. */
    public static final String RUNTIME_OVERRIDE_SOURCE = "runtime-override";
    /** Source name recorded on implementer default leaves. */
    public static final String STEP_IMPLEMENTER_DEFAULTS_SOURCE = "step-implementer-defaults";

    private final String stepName;
    private final String subStepName;
    private final String subStepImplementerName;
    private final Map<String, Object> subStepConfig;
    private final Map<String, Object> subStepEnvConfig;
    private volatile Map<String, Object> globalDefaults;
    private volatile Map<String, Object> globalEnvironmentDefaults;
    private volatile Map<String, Object> stepConfigOverrides;

    private SubStepConfig(Builder b) {
        this.stepName = requireNonBlank(b.stepName, "stepName");
        this.subStepImplementerName = requireNonBlank(b.subStepImplementerName, "subStepImplementerName");
        this.subStepName = b.subStepName != null && !b.subStepName.isBlank()
                ? b.subStepName.trim()
                : this.subStepImplementerName;
        this.subStepConfig = frozenCopy(b.subStepConfig);
        this.subStepEnvConfig = frozenCopy(b.subStepEnvConfig);
        this.globalDefaults = frozenCopy(b.globalDefaults);
        this.globalEnvironmentDefaults = frozenCopy(b.globalEnvironmentDefaults);
        this.stepConfigOverrides = frozenCopy(
                ConfigValue.convertLeavesToConfigValues(b.stepConfigOverrides, RUNTIME_OVERRIDE_SOURCE, null));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getStepName() {
        return stepName;
    }

    /** Sub step name; defaults to the implementer name when not configured. */
    public String getSubStepName() {
        return subStepName;
    }

    public String getSubStepImplementerName() {
        return subStepImplementerName;
    }

    /** Static sub step config (unmodifiable). */
    public Map<String, Object> getSubStepConfig() {
        return subStepConfig;
    }

    /** Environment name to sub step config for that environment (unmodifiable). */
    public Map<String, Object> getSubStepEnvConfigs() {
        return subStepEnvConfig;
    }

    public Map<String, Object> getGlobalDefaults() {
        return globalDefaults;
    }

    /** Environment name to global defaults for that environment (unmodifiable). */
    public Map<String, Object> getGlobalEnvironmentDefaults() {
        return globalEnvironmentDefaults;
    }

    public Map<String, Object> getStepConfigOverrides() {
        return stepConfigOverrides;
    }

    /**
     * Replaces the runtime overrides. The map is deep-copied; plain leaves are recorded with source
     * {@value #RUNTIME_OVERRIDE_SOURCE}.
     *
     * @param overrides runtime overrides; null clears them
     */
    public void setStepConfigOverrides(Map<String, ?> overrides) {
        this.stepConfigOverrides = frozenCopy(
                ConfigValue.convertLeavesToConfigValues(overrides, RUNTIME_OVERRIDE_SOURCE, null));
    }

    /**
     * Replaces both global layers with deep copies of the given maps.
     */
    void setGlobalDefaults(Map<String, ?> globalDefaults, Map<String, ?> globalEnvironmentDefaults) {
        this.globalDefaults = frozenCopy(globalDefaults);
        this.globalEnvironmentDefaults = frozenCopy(globalEnvironmentDefaults);
    }

    /**
     * Sub step config specific to the given environment.
     *
     * @return the environment's config, or an empty map when environment is null or not configured
     */
    public Map<String, Object> getSubStepEnvConfig(String environment) {
        return forEnvironment(subStepEnvConfig, environment);
    }

    /**
     * Global defaults specific to the given environment.
     *
     * @return the environment's defaults, or an empty map when environment is null or not configured
     */
    public Map<String, Object> getGlobalEnvironmentDefaults(String environment) {
        return forEnvironment(globalEnvironmentDefaults, environment);
    }

    /**
     * Deep copy of the runtime step configuration: the union of keys across all six layers, each
     * resolved by precedence. Leaves keep their {@link ConfigValue} wrapper so their source can be
     * reported; use {@link ConfigValue#convertLeavesToValues(Map)} for plain data. The result is a
     * fresh mutable map; changing it never affects this config.
     *
     * @param environment       environment name, or null
     * @param stepConfigDefaults step implementer defaults (lowest precedence), or null
     */
    public Map<String, Object> getCopyOfRuntimeStepConfig(String environment, Map<String, ?> stepConfigDefaults) {
        Map<String, Object> defaults = ConfigValue.convertLeavesToConfigValues(
                stepConfigDefaults, STEP_IMPLEMENTER_DEFAULTS_SOURCE, null);
        return ConfigMerger.deepMerge(Arrays.asList(
                defaults,
                globalDefaults,
                getGlobalEnvironmentDefaults(environment),
                subStepConfig,
                getSubStepEnvConfig(environment),
                stepConfigOverrides));
    }

    /**
     * Value of {@code key} from the highest-precedence layer that defines it, unwrapped to plain data.
     * Mapping and list values come back as plain containers with no {@link ConfigValue} inside.
     *
     * @return plain value, or null when no layer defines the key (or the defining layer holds null)
     */
    public Object getConfigValue(String key, String environment, Map<String, ?> stepConfigDefaults) {
        Objects.requireNonNull(key, "key");
        return ConfigValue.convertLeavesToValues(getCopyOfRuntimeStepConfig(environment, stepConfigDefaults).get(key));
    }

    /** {@link #getConfigValue(String, String, Map)} without environment or defaults. */
    public Object getConfigValue(String key) {
        return getConfigValue(key, null, null);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> forEnvironment(Map<String, Object> byEnvironment, String environment) {
        if (environment == null) return Collections.emptyMap();
        Object envConfig = byEnvironment.get(environment);
        if (envConfig instanceof Map) {
            return (Map<String, Object>) envConfig;
        }
        return Collections.emptyMap();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> frozenCopy(Map<String, ?> source) {
        if (source == null) return Collections.emptyMap();
        return (Map<String, Object>) freeze(source);
    }

    private static Object freeze(Object tree) {
        if (tree instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) tree).entrySet()) {
                copy.put(String.valueOf(e.getKey()), freeze(e.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (tree instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) tree) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return tree;
    }

    private static String requireNonBlank(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must be non-blank");
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return "SubStepConfig{stepName=" + stepName + ", subStepName=" + subStepName
                + ", subStepImplementerName=" + subStepImplementerName + "}";
    }

    /** Builder for {@link SubStepConfig}. Maps are copied at {@link #build()}. */
    public static final class Builder {
        private String stepName;
        private String subStepName;
        private String subStepImplementerName;
        private Map<String, ?> subStepConfig;
        private Map<String, ?> subStepEnvConfig;
        private Map<String, ?> globalDefaults;
        private Map<String, ?> globalEnvironmentDefaults;
        private Map<String, ?> stepConfigOverrides;

        private Builder() {
        }

        public Builder stepName(String stepName) {
            this.stepName = stepName;
            return this;
        }

        public Builder subStepName(String subStepName) {
            this.subStepName = subStepName;
            return this;
        }

        public Builder subStepImplementerName(String subStepImplementerName) {
            this.subStepImplementerName = subStepImplementerName;
            return this;
        }

        public Builder subStepConfig(Map<String, ?> subStepConfig) {
            this.subStepConfig = subStepConfig;
            return this;
        }

        /** Environment name to sub step config for that environment. */
        public Builder subStepEnvConfig(Map<String, ?> subStepEnvConfig) {
            this.subStepEnvConfig = subStepEnvConfig;
            return this;
        }

        public Builder globalDefaults(Map<String, ?> globalDefaults) {
            this.globalDefaults = globalDefaults;
            return this;
        }

        /** Environment name to global defaults for that environment. */
        public Builder globalEnvironmentDefaults(Map<String, ?> globalEnvironmentDefaults) {
            this.globalEnvironmentDefaults = globalEnvironmentDefaults;
            return this;
        }

        public Builder stepConfigOverrides(Map<String, ?> stepConfigOverrides) {
            this.stepConfigOverrides = stepConfigOverrides;
            return this;
        }

        public SubStepConfig build() {
            return new SubStepConfig(this);
        }
    }
}

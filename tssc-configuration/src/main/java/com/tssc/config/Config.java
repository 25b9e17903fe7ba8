package com.tssc.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed pipeline definition: global defaults, per-environment global defaults and the sub steps
 * of every step. Built from one or more already-loaded definition mappings of the form
 * <pre>
 * tssc-config:
 *   global-defaults: {...}
 *   global-environment-defaults:
 *     DEV: {...}
 *   unit-test:                    # a sub step mapping, or a list of them
 *     implementer: Maven
 *     name: maven-unit-test       # optional, defaults to implementer
 *     config: {...}
 *     environment-config:
 *       DEV: {...}
 * </pre>
 * Every leaf is wrapped in a {@link ConfigValue} recording the definition's source name and path.
 * Not thread-safe; build once, then read.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    public static final String TSSC_CONFIG_KEY = "tssc-config";
    public static final String GLOBAL_DEFAULTS_KEY = "global-defaults";
    public static final String GLOBAL_ENVIRONMENT_DEFAULTS_KEY = "global-environment-defaults";
    public static final String SUB_STEP_IMPLEMENTER_KEY = "implementer";
    public static final String SUB_STEP_NAME_KEY = "name";
    public static final String SUB_STEP_CONFIG_KEY = "config";
    public static final String SUB_STEP_ENVIRONMENT_CONFIG_KEY = "environment-config";

    private Map<String, Object> globalDefaults = new LinkedHashMap<>();
    private Map<String, Object> globalEnvironmentDefaults = new LinkedHashMap<>();
    private final Map<String, Map<String, ?>> overridesByStep = new LinkedHashMap<>();
    private final Map<String, StepConfig> stepConfigs = new LinkedHashMap<>();

    public Config() {
    }

    /**
     * Creates a config from a single definition.
     *
     * @param definition loaded definition mapping (must contain {@value #TSSC_CONFIG_KEY})
     * @param sourceName name recorded as the source of every value (e.g. a file name)
     */
    public static Config of(Map<String, ?> definition, String sourceName) {
        Config config = new Config();
        config.addConfig(definition, sourceName);
        return config;
    }

    /**
     * Adds a definition. Global defaults are merged with those of earlier definitions; a key given
     * different values by two definitions is a {@link ConfigException}. Sub steps are appended
     * after those of earlier definitions.
     *
     * @throws ConfigException when the definition is malformed or conflicts with an earlier one
     */
    public void addConfig(Map<String, ?> definition, String sourceName) {
        Objects.requireNonNull(definition, "definition");
        String source = sourceName != null ? sourceName : "unknown";
        Object root = definition.get(TSSC_CONFIG_KEY);
        if (!(root instanceof Map)) {
            throw new ConfigException("Config source (" + source + ") must have a top level key ("
                    + TSSC_CONFIG_KEY + ") with a mapping value");
        }
        Map<String, Object> tsscConfig = ConfigValue.convertLeavesToConfigValues(
                asMap(root, source, TSSC_CONFIG_KEY), source, List.<Object>of(TSSC_CONFIG_KEY));

        Map<String, Object> newGlobalDefaults = globalDefaults;
        Map<String, Object> newGlobalEnvDefaults = globalEnvironmentDefaults;
        Map<String, List<SubStepDefinition>> newDefinitions = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : tsscConfig.entrySet()) {
            String key = e.getKey();
            if (GLOBAL_DEFAULTS_KEY.equals(key)) {
                newGlobalDefaults = mergeStrict(newGlobalDefaults, asMap(e.getValue(), source, key), key);
            } else if (GLOBAL_ENVIRONMENT_DEFAULTS_KEY.equals(key)) {
                newGlobalEnvDefaults = mergeStrict(newGlobalEnvDefaults, asMap(e.getValue(), source, key), key);
            } else {
                newDefinitions.put(key, parseSubSteps(key, e.getValue(), source));
            }
        }

        globalDefaults = newGlobalDefaults;
        globalEnvironmentDefaults = newGlobalEnvDefaults;
        for (StepConfig stepConfig : stepConfigs.values()) {
            for (SubStepConfig subStep : stepConfig.getSubSteps()) {
                subStep.setGlobalDefaults(globalDefaults, globalEnvironmentDefaults);
            }
        }
        for (Map.Entry<String, List<SubStepDefinition>> e : newDefinitions.entrySet()) {
            addSubSteps(e.getKey(), e.getValue());
        }
        log.debug("Config added | source={} | steps={}", source, newDefinitions.keySet());
    }

    /** Global defaults merged across all definitions (unmodifiable). */
    public Map<String, Object> getGlobalDefaults() {
        return Collections.unmodifiableMap(globalDefaults);
    }

    /** Environment name to global defaults, merged across all definitions (unmodifiable). */
    public Map<String, Object> getGlobalEnvironmentDefaults() {
        return Collections.unmodifiableMap(globalEnvironmentDefaults);
    }

    /** Step configs by step name, in definition order (unmodifiable). */
    public Map<String, StepConfig> getStepConfigs() {
        return Collections.unmodifiableMap(stepConfigs);
    }

    /**
     * Returns the config of the given step, or null when the step is not defined.
     */
    public StepConfig getStepConfig(String stepName) {
        return stepConfigs.get(stepName);
    }

    /**
     * Injects runtime overrides into every sub step of the given step. Overrides are remembered
     * and also apply to sub steps added by later {@link #addConfig} calls. Nothing is created for
     * an undefined step.
     */
    public void setStepConfigOverrides(String stepName, Map<String, ?> overrides) {
        Objects.requireNonNull(stepName, "stepName");
        StepConfig stepConfig = stepConfigs.get(stepName);
        if (stepConfig != null) {
            stepConfig.setStepConfigOverrides(overrides);
        } else if (overrides == null) {
            overridesByStep.remove(stepName);
        } else {
            overridesByStep.put(stepName, ConfigMerger.deepCopy(overrides));
        }
    }

    private void addSubSteps(String stepName, List<SubStepDefinition> definitions) {
        StepConfig stepConfig = stepConfigs.computeIfAbsent(stepName,
                k -> new StepConfig(k, overridesByStep.remove(k)));
        for (SubStepDefinition def : definitions) {
            stepConfig.addSubStep(SubStepConfig.builder()
                    .stepName(stepName)
                    .subStepName(def.name)
                    .subStepImplementerName(def.implementer)
                    .subStepConfig(def.config)
                    .subStepEnvConfig(def.environmentConfig)
                    .globalDefaults(globalDefaults)
                    .globalEnvironmentDefaults(globalEnvironmentDefaults)
                    .stepConfigOverrides(stepConfig.getStepConfigOverrides())
                    .build());
        }
    }

    private static List<SubStepDefinition> parseSubSteps(String stepName, Object value, String source) {
        List<SubStepDefinition> defs = new ArrayList<>();
        if (value instanceof Map) {
            defs.add(parseSubStep(stepName, asMap(value, source, stepName), source));
        } else if (value instanceof List) {
            for (Object item : (List<?>) value) {
                defs.add(parseSubStep(stepName, asMap(item, source, stepName), source));
            }
        } else {
            throw new ConfigException("Config source (" + source + ") step (" + stepName
                    + ") must be a mapping or a list of mappings");
        }
        return defs;
    }

    private static SubStepDefinition parseSubStep(String stepName, Map<String, Object> subStep, String source) {
        Object implementer = ConfigValue.unwrapForValue(subStep.get(SUB_STEP_IMPLEMENTER_KEY));
        if (implementer == null || implementer.toString().isBlank()) {
            throw new ConfigException("Config source (" + source + ") step (" + stepName
                    + ") defines a sub step without the required key (" + SUB_STEP_IMPLEMENTER_KEY + ")");
        }
        Object name = ConfigValue.unwrapForValue(subStep.get(SUB_STEP_NAME_KEY));
        Map<String, Object> config = subStep.containsKey(SUB_STEP_CONFIG_KEY)
                ? asMap(subStep.get(SUB_STEP_CONFIG_KEY), source, stepName + "." + SUB_STEP_CONFIG_KEY)
                : Collections.emptyMap();
        Map<String, Object> envConfig = subStep.containsKey(SUB_STEP_ENVIRONMENT_CONFIG_KEY)
                ? asMap(subStep.get(SUB_STEP_ENVIRONMENT_CONFIG_KEY), source,
                        stepName + "." + SUB_STEP_ENVIRONMENT_CONFIG_KEY)
                : Collections.emptyMap();
        return new SubStepDefinition(
                name != null ? name.toString() : null, implementer.toString(), config, envConfig);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String source, String what) {
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new ConfigException("Config source (" + source + ") value for (" + what + ") must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Deep merge that refuses to change a value already defined by an earlier source.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> mergeStrict(Map<String, Object> current, Map<String, Object> incoming,
                                                   String path) {
        Map<String, Object> merged = ConfigMerger.deepCopy(current);
        for (Map.Entry<String, Object> e : incoming.entrySet()) {
            String keyPath = path + "." + e.getKey();
            Object existing = merged.get(e.getKey());
            Object value = e.getValue();
            if (existing == null && !merged.containsKey(e.getKey())) {
                merged.put(e.getKey(), ConfigMerger.deepCopy(value));
            } else if (existing instanceof Map && value instanceof Map) {
                merged.put(e.getKey(), mergeStrict((Map<String, Object>) existing, (Map<String, Object>) value, keyPath));
            } else if (!Objects.equals(ConfigValue.convertLeavesToValues(existing), ConfigValue.convertLeavesToValues(value))) {
                throw new ConfigException("Conflicting values for (" + keyPath + "): "
                        + describe(existing) + " and " + describe(value));
            }
        }
        return merged;
    }

    private static String describe(Object value) {
        if (value instanceof ConfigValue) {
            ConfigValue cv = (ConfigValue) value;
            return "'" + cv.getValue() + "' from " + cv.getSource();
        }
        return "'" + ConfigValue.convertLeavesToValues(value) + "'";
    }

    private static final class SubStepDefinition {
        private final String name;
        private final String implementer;
        private final Map<String, Object> config;
        private final Map<String, Object> environmentConfig;

        private SubStepDefinition(String name, String implementer, Map<String, Object> config,
                                  Map<String, Object> environmentConfig) {
            this.name = name;
            this.implementer = implementer;
            this.config = config;
            this.environmentConfig = environmentConfig;
        }
    }
}

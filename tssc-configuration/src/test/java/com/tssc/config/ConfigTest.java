package com.tssc.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    private static Map<String, Object> pipeline() {
        return Map.of(Config.TSSC_CONFIG_KEY, Map.of(
                Config.GLOBAL_DEFAULTS_KEY, Map.of("organization", "acme"),
                Config.GLOBAL_ENVIRONMENT_DEFAULTS_KEY, Map.of(
                        "PROD", Map.of("kube-api-uri", "https://prod.example")),
                "unit-test", Map.of(
                        "implementer", "Maven",
                        "config", Map.of("pom-file", "pom.xml")),
                "deploy", List.of(
                        Map.of("implementer", "ArgoCD", "name", "argo-primary",
                                "environment-config", Map.of("PROD", Map.of("namespace", "prod"))),
                        Map.of("implementer", "ArgoCD", "name", "argo-secondary"))));
    }

    @Test
    void of_parsesStepsAndSubStepsInDefinitionOrder() {
        Config config = Config.of(pipeline(), "pipeline.yml");

        StepConfig unitTest = config.getStepConfig("unit-test");
        assertNotNull(unitTest);
        assertEquals(1, unitTest.getSubSteps().size());
        SubStepConfig maven = unitTest.getSubSteps().get(0);
        assertEquals("Maven", maven.getSubStepName());
        assertEquals("Maven", maven.getSubStepImplementerName());
        assertEquals("pom.xml", maven.getConfigValue("pom-file"));

        StepConfig deploy = config.getStepConfig("deploy");
        assertEquals(2, deploy.getSubSteps().size());
        assertEquals("argo-primary", deploy.getSubSteps().get(0).getSubStepName());
        assertEquals("argo-secondary", deploy.getSubSteps().get(1).getSubStepName());
        assertNotNull(deploy.getSubStep("argo-secondary"));
        assertNull(deploy.getSubStep("nope"));
    }

    @Test
    void of_passesGlobalLayersToEverySubStep() {
        Config config = Config.of(pipeline(), "pipeline.yml");

        SubStepConfig primary = config.getStepConfig("deploy").getSubStep("argo-primary");
        assertEquals("acme", primary.getConfigValue("organization", "PROD", null));
        assertEquals("https://prod.example", primary.getConfigValue("kube-api-uri", "PROD", null));
        assertEquals("prod", primary.getConfigValue("namespace", "PROD", null));
        assertNull(primary.getConfigValue("namespace", "DEV", null));
    }

    @Test
    void of_recordsSourceAndPathOnLeaves() {
        Config config = Config.of(pipeline(), "pipeline.yml");

        ConfigValue organization = (ConfigValue) config.getGlobalDefaults().get("organization");
        assertEquals("pipeline.yml", organization.getSource());
        assertEquals(List.of(Config.TSSC_CONFIG_KEY, Config.GLOBAL_DEFAULTS_KEY, "organization"),
                organization.getPathParts());
    }

    @Test
    void subStepConfigValue_nestedMappingHasNoProvenanceWrappers() {
        Config config = Config.of(Map.of(Config.TSSC_CONFIG_KEY, Map.of(
                "unit-test", Map.of("implementer", "Maven",
                        "config", Map.of("auth", Map.of("user", "bob"))))), "pipeline.yml");

        Object auth = config.getStepConfig("unit-test").getSubStep("Maven").getConfigValue("auth", null, null);

        assertEquals(Map.of("user", "bob"), auth);
    }

    @Test
    void getStepConfig_returnsNullForUndefinedStep() {
        Config config = Config.of(pipeline(), "pipeline.yml");

        assertNull(config.getStepConfig("release"));
        assertEquals(Set.of("unit-test", "deploy"), config.getStepConfigs().keySet());
    }

    @Test
    void addConfig_rejectsMissingTopLevelKey() {
        Config config = new Config();

        ConfigException e = assertThrows(ConfigException.class,
                () -> config.addConfig(Map.of("other", Map.of()), "bad.yml"));
        assertTrue(e.getMessage().contains("bad.yml"));
        assertTrue(e.getMessage().contains(Config.TSSC_CONFIG_KEY));
    }

    @Test
    void addConfig_rejectsSubStepWithoutImplementer() {
        Map<String, Object> definition = Map.of(Config.TSSC_CONFIG_KEY, Map.of(
                "unit-test", Map.of("config", Map.of("a", 1))));

        ConfigException e = assertThrows(ConfigException.class, () -> Config.of(definition, "bad.yml"));
        assertTrue(e.getMessage().contains("unit-test"));
    }

    @Test
    void addConfig_rejectsScalarStep() {
        Map<String, Object> definition = Map.of(Config.TSSC_CONFIG_KEY, Map.of("unit-test", "Maven"));

        assertThrows(ConfigException.class, () -> Config.of(definition, "bad.yml"));
    }

    @Test
    void addConfig_mergesGlobalDefaultsAndAppendsSubSteps() {
        Config config = Config.of(pipeline(), "pipeline.yml");

        config.addConfig(Map.of(Config.TSSC_CONFIG_KEY, Map.of(
                Config.GLOBAL_DEFAULTS_KEY, Map.of("organization", "acme", "application", "shop"),
                "unit-test", Map.of("implementer", "Gradle"))), "extra.yml");

        assertEquals("shop", ConfigValue.unwrapForValue(config.getGlobalDefaults().get("application")));
        List<SubStepConfig> subSteps = config.getStepConfig("unit-test").getSubSteps();
        assertEquals(2, subSteps.size());
        assertEquals("Gradle", subSteps.get(1).getSubStepName());
        assertEquals("shop", subSteps.get(0).getConfigValue("application"));
    }

    @Test
    void addConfig_conflictingGlobalDefaultIsError() {
        Config config = Config.of(pipeline(), "pipeline.yml");

        ConfigException e = assertThrows(ConfigException.class, () -> config.addConfig(
                Map.of(Config.TSSC_CONFIG_KEY, Map.of(
                        Config.GLOBAL_DEFAULTS_KEY, Map.of("organization", "other"))), "extra.yml"));
        assertTrue(e.getMessage().contains("global-defaults.organization"));
        assertEquals("acme", ConfigValue.unwrapForValue(config.getGlobalDefaults().get("organization")));
    }

    @Test
    void setStepConfigOverrides_appliesToEverySubStepAndSurvivesAddConfig() {
        Config config = Config.of(pipeline(), "pipeline.yml");

        config.setStepConfigOverrides("deploy", Map.of("namespace", "override"));

        for (SubStepConfig subStep : config.getStepConfig("deploy").getSubSteps()) {
            assertEquals("override", subStep.getConfigValue("namespace", "PROD", null));
        }
        config.addConfig(Map.of(Config.TSSC_CONFIG_KEY, Map.of(
                "deploy", Map.of("implementer", "Helm"))), "extra.yml");
        assertEquals("override", config.getStepConfig("deploy").getSubStep("Helm").getConfigValue("namespace"));
    }

    @Test
    void addConfig_keepsEarlierStepConfigInstancesCurrent() {
        Config config = Config.of(pipeline(), "pipeline.yml");
        StepConfig unitTest = config.getStepConfig("unit-test");
        SubStepConfig maven = unitTest.getSubStep("Maven");
        unitTest.setStepConfigOverrides(Map.of("skip-tests", "false"));

        config.addConfig(Map.of(Config.TSSC_CONFIG_KEY, Map.of(
                Config.GLOBAL_DEFAULTS_KEY, Map.of("application", "shop"),
                "unit-test", Map.of("implementer", "Gradle"))), "extra.yml");

        assertSame(unitTest, config.getStepConfig("unit-test"));
        assertSame(maven, config.getStepConfig("unit-test").getSubStep("Maven"));
        assertEquals(2, unitTest.getSubSteps().size());
        assertEquals("shop", maven.getConfigValue("application"));
        assertEquals("false", maven.getConfigValue("skip-tests"));
        assertEquals("false", unitTest.getSubStep("Gradle").getConfigValue("skip-tests"));
    }

    @Test
    void setStepConfigOverrides_rememberedForStepDefinedLater() {
        Config config = Config.of(pipeline(), "pipeline.yml");
        config.setStepConfigOverrides("release", Map.of("tag", "v1"));

        config.addConfig(Map.of(Config.TSSC_CONFIG_KEY, Map.of(
                "release", Map.of("implementer", "Git"))), "extra.yml");

        assertEquals("v1", config.getStepConfig("release").getSubStep("Git").getConfigValue("tag"));
    }

    @Test
    void setStepConfigOverrides_undefinedStepCreatesNothing() {
        Config config = Config.of(pipeline(), "pipeline.yml");

        config.setStepConfigOverrides("release", Map.of("a", 1));

        assertNull(config.getStepConfig("release"));
    }
}

package com.tssc.runner;

import com.tssc.step.StepWorkspace;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class StepRunnerSettingsTest {

    @Test
    void fromEnvironment_usesDefaultsWhenUnset() {
        StepRunnerSettings settings = StepRunnerSettings.fromEnvironment(Map.of());

        assertEquals(Path.of("tssc-results"), settings.getResultsDirPath());
        assertEquals(Path.of("tssc-working"), settings.getWorkDirPath());
        assertEquals(StepWorkspace.DEFAULT_RESULTS_FILE_NAME, settings.getResultsFileName());
        assertNull(settings.getEnvironment());
    }

    @Test
    void fromEnvironment_readsVariablesAndIgnoresBlanks() {
        StepRunnerSettings settings = StepRunnerSettings.fromEnvironment(Map.of(
                "TSSC_RESULTS_DIR", "/var/tssc/results",
                "TSSC_WORK_DIR", " ",
                "TSSC_RESULTS_FILE_NAME", "results.yml",
                "TSSC_ENVIRONMENT", " PROD "));

        assertEquals(Path.of("/var/tssc/results"), settings.getResultsDirPath());
        assertEquals(Path.of("tssc-working"), settings.getWorkDirPath());
        assertEquals("results.yml", settings.getResultsFileName());
        assertEquals("PROD", settings.getEnvironment());
    }

    @Test
    void toWorkspace_carriesDirectoriesAndFileName() {
        StepRunnerSettings settings = StepRunnerSettings.builder()
                .resultsDirPath(Path.of("out"))
                .workDirPath(Path.of("work"))
                .resultsFileName("r.yml")
                .build();

        StepWorkspace workspace = settings.toWorkspace();

        assertEquals(Path.of("out"), workspace.getResultsDirPath());
        assertEquals(Path.of("work"), workspace.getWorkDirPath());
        assertEquals("r.yml", workspace.getResultsFileName());
    }
}

package com.tssc.result;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowResultTest {

    @TempDir
    Path tempDir;

    private static StepResult result(String step, String subStep, String artifact, Object value) {
        StepResult result = new StepResult(step, subStep, subStep);
        if (artifact != null) {
            result.addArtifact(artifact, value);
        }
        return result;
    }

    @Test
    void loadFromSnapshotFile_missingFileGivesEmptyLedger() {
        WorkflowResult loaded = WorkflowResult.loadFromSnapshotFile(tempDir.resolve("none.pkl"));

        assertTrue(loaded.getStepResults().isEmpty());
    }

    @Test
    void snapshot_roundTripsResultsInOrder() {
        WorkflowResult ledger = new WorkflowResult();
        StepResult first = result("generate-metadata", "Maven", "version", "1.0.0");
        StepResult second = result("deploy", "ArgoCD", "argocd-result-set", "file:///tmp/out.yml");
        second.setSuccess(false);
        second.setMessage("sync failed");
        ledger.addStepResult(first);
        ledger.addStepResult(second);
        Path snapshot = tempDir.resolve("nested/tssc-results.pkl");

        ledger.writeToSnapshotFile(snapshot);
        WorkflowResult loaded = WorkflowResult.loadFromSnapshotFile(snapshot);

        assertEquals(ledger, loaded);
        assertEquals(List.of("generate-metadata", "deploy"),
                List.of(loaded.getStepResults().get(0).getStepName(), loaded.getStepResults().get(1).getStepName()));
        assertEquals("sync failed", loaded.getStepResults().get(1).getMessage());
    }

    @Test
    void snapshot_keepsArtifactValueTypes() {
        Map<String, Object> coordinates = new LinkedHashMap<>();
        coordinates.put("size", 2048L);
        coordinates.put("modules", new ArrayList<>(List.of("core", "web")));
        StepResult packaged = new StepResult("package", "Maven", "Maven");
        packaged.addArtifact("size", 42L);
        packaged.addArtifact("jar", Path.of("/tmp/a.jar"), "file");
        packaged.addArtifact("checksum-ok", true);
        packaged.addArtifact("coordinates", coordinates);
        WorkflowResult ledger = new WorkflowResult();
        ledger.addStepResult(packaged);
        Path snapshot = tempDir.resolve("tssc-results.pkl");

        ledger.writeToSnapshotFile(snapshot);
        WorkflowResult loaded = WorkflowResult.loadFromSnapshotFile(snapshot);

        assertEquals(ledger, loaded);
        assertInstanceOf(Long.class, loaded.getArtifactValue("size"));
        assertEquals(Path.of("/tmp/a.jar"), loaded.getArtifactValue("jar"));
        Map<?, ?> reloadedCoordinates = (Map<?, ?>) loaded.getArtifactValue("coordinates");
        assertInstanceOf(Long.class, reloadedCoordinates.get("size"));
        assertEquals(List.of("core", "web"), reloadedCoordinates.get("modules"));
    }

    @Test
    void loadFromSnapshotFile_corruptFileIsError() throws Exception {
        Path snapshot = tempDir.resolve("tssc-results.pkl");
        Files.writeString(snapshot, "not a snapshot");

        assertThrows(WorkflowResultException.class, () -> WorkflowResult.loadFromSnapshotFile(snapshot));
    }

    @Test
    void getArtifactValue_returnsFirstMatchInAppendOrder() {
        WorkflowResult ledger = new WorkflowResult();
        ledger.addStepResult(result("tag-source", "Git", "tag", "v1"));
        ledger.addStepResult(result("deploy", "ArgoCD", "tag", "v2"));
        ledger.addStepResult(result("deploy", "Helm", "tag", "v3"));

        assertEquals("v1", ledger.getArtifactValue("tag"));
        assertEquals("v2", ledger.getArtifactValue("tag", "deploy", null));
        assertEquals("v3", ledger.getArtifactValue("tag", "deploy", "Helm"));
        assertNull(ledger.getArtifactValue("tag", "release", null));
        assertNull(ledger.getArtifactValue("missing"));
    }

    @Test
    void getArtifactValue_ignoresSubStepNameWithoutStepName() {
        WorkflowResult ledger = new WorkflowResult();
        ledger.addStepResult(result("tag-source", "Git", "tag", "v1"));
        ledger.addStepResult(result("deploy", "Helm", "tag", "v3"));

        assertEquals("v1", ledger.getArtifactValue("tag", null, "Helm"));
    }

    @Test
    void getStepResult_returnsOnlyTheRequestedStep() {
        WorkflowResult ledger = new WorkflowResult();
        ledger.addStepResult(result("unit-test", "Maven", null, null));
        ledger.addStepResult(result("deploy", "ArgoCD", "app", "shop"));
        ledger.addStepResult(result("deploy", "Helm", null, null));

        Map<String, Object> deploy = ledger.getStepResult("deploy");

        assertEquals(List.of("deploy"), List.copyOf(deploy.keySet()));
        Map<?, ?> subSteps = (Map<?, ?>) deploy.get("deploy");
        assertEquals(List.of("ArgoCD", "Helm"), List.copyOf(subSteps.keySet()));
        assertTrue(ledger.getStepResult("release").isEmpty());
    }

    @Test
    void getStepResult_firstResultWinsForRepeatedSubStep() {
        WorkflowResult ledger = new WorkflowResult();
        ledger.addStepResult(result("deploy", "ArgoCD", "attempt", 1));
        ledger.addStepResult(result("deploy", "ArgoCD", "attempt", 2));

        Map<?, ?> argo = (Map<?, ?>) ((Map<?, ?>) ledger.getStepResult("deploy").get("deploy")).get("ArgoCD");
        Map<?, ?> artifacts = (Map<?, ?>) argo.get(StepResult.ARTIFACTS_KEY);

        assertEquals(1, ((Map<?, ?>) artifacts.get("attempt")).get("value"));
    }

    @Test
    void writeResultsToYmlFile_writesAllResultsUnderTopLevelKey() throws Exception {
        WorkflowResult ledger = new WorkflowResult();
        ledger.addStepResult(result("unit-test", "Maven", "report", "target/surefire"));
        StepResult failed = result("deploy", "ArgoCD", null, null);
        failed.setSuccess(false);
        failed.setMessage("sync failed");
        ledger.addStepResult(failed);
        Path yml = tempDir.resolve("results/tssc-results.yml");

        ledger.writeResultsToYmlFile(yml);

        Map<?, ?> read = new ObjectMapper(new YAMLFactory()).readValue(yml.toFile(), Map.class);
        Map<?, ?> all = (Map<?, ?>) read.get(WorkflowResult.TSSC_RESULTS_KEY);
        Map<?, ?> argo = (Map<?, ?>) ((Map<?, ?>) all.get("deploy")).get("ArgoCD");
        assertEquals(false, argo.get("success"));
        assertEquals("sync failed", argo.get("message"));
        assertEquals("ArgoCD", argo.get("sub-step-implementer-name"));
        Map<?, ?> maven = (Map<?, ?>) ((Map<?, ?>) all.get("unit-test")).get("Maven");
        Map<?, ?> report = (Map<?, ?>) ((Map<?, ?>) maven.get("artifacts")).get("report");
        assertEquals(Map.of("value", "target/surefire", "type", "str"), report);
    }

    @Test
    void getAllStepResults_latestResultShownForRepeatedSubStep() {
        WorkflowResult ledger = new WorkflowResult();
        ledger.addStepResult(result("deploy", "ArgoCD", "attempt", 1));
        ledger.addStepResult(result("deploy", "ArgoCD", "attempt", 2));

        Map<?, ?> all = (Map<?, ?>) ledger.getAllStepResults().get(WorkflowResult.TSSC_RESULTS_KEY);
        Map<?, ?> argo = (Map<?, ?>) ((Map<?, ?>) all.get("deploy")).get("ArgoCD");
        Map<?, ?> attempt = (Map<?, ?>) ((Map<?, ?>) argo.get("artifacts")).get("attempt");

        assertEquals(2, attempt.get("value"));
        assertEquals(2, ledger.getStepResults().size());
    }
}

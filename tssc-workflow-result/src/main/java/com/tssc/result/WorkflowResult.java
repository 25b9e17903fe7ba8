package com.tssc.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.dataformat.smile.SmileFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, append-only ledger of the {@link StepResult}s of a pipeline run.
 * <p>
 * Two persisted forms are derived from the same in-memory list on every write:
 * <ul>
 *   <li>a binary snapshot (Jackson Smile) that the next step invocation reloads with
 *       {@link #loadFromSnapshotFile(Path)}; a missing snapshot means an empty ledger</li>
 *   <li>a YAML results file {@code {tssc-results: {step: {sub step: {...}}}}} for external tools</li>
 * </ul>
 * Lookups scan in append order and return the first match.
 */
public final class WorkflowResult {

    private static final Logger log = LoggerFactory.getLogger(WorkflowResult.class);

    /** Top-level key of the YAML results file. */
    public static final String TSSC_RESULTS_KEY = "tssc-results";

    /** Artifact value types the snapshot may name; anything else fails to load. */
    private static final PolymorphicTypeValidator SNAPSHOT_VALUE_TYPES = BasicPolymorphicTypeValidator.builder()
            .allowIfSubType("java.lang.")
            .allowIfSubType("java.math.")
            .allowIfSubType("java.util.")
            .allowIfSubType("java.nio.file.")
            .build();

    /** Records the concrete type of artifact values so they reload unchanged (Long stays Long, Path stays Path). */
    private static final ObjectMapper SNAPSHOT_MAPPER = new ObjectMapper(new SmileFactory())
            .activateDefaultTyping(SNAPSHOT_VALUE_TYPES, ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
            new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private final List<StepResult> workflowList;

    public WorkflowResult() {
        this.workflowList = new ArrayList<>();
    }

    @JsonCreator
    WorkflowResult(@JsonProperty("workflow-list") List<StepResult> workflowList) {
        this.workflowList = workflowList != null ? new ArrayList<>(workflowList) : new ArrayList<>();
    }

    /**
     * Reconstructs the ledger from a snapshot written by {@link #writeToSnapshotFile(Path)}.
     *
     * @param snapshotFile snapshot path
     * @return the stored ledger, or an empty ledger when the file does not exist
     * @throws WorkflowResultException when the file exists but cannot be read
     */
    public static WorkflowResult loadFromSnapshotFile(Path snapshotFile) {
        Objects.requireNonNull(snapshotFile, "snapshotFile");
        if (!Files.exists(snapshotFile)) {
            log.debug("Workflow result snapshot not found; starting with empty ledger | path={}", snapshotFile);
            return new WorkflowResult();
        }
        try {
            WorkflowResult loaded = SNAPSHOT_MAPPER.readValue(snapshotFile.toFile(), WorkflowResult.class);
            log.debug("Workflow result snapshot loaded | path={} | results={}", snapshotFile, loaded.workflowList.size());
            return loaded;
        } catch (IOException e) {
            throw new WorkflowResultException("Failed to load workflow result snapshot: " + snapshotFile, e);
        }
    }

    /**
     * Appends a result. Results with the same step and sub step names coexist.
     */
    public void addStepResult(StepResult stepResult) {
        workflowList.add(Objects.requireNonNull(stepResult, "stepResult"));
    }

    /** Results in append order (unmodifiable). */
    @JsonProperty("workflow-list")
    public List<StepResult> getStepResults() {
        return Collections.unmodifiableList(workflowList);
    }

    /**
     * Writes the whole ledger to the snapshot file, replacing any previous content. Parent
     * directories are created.
     *
     * @throws WorkflowResultException on I/O failure
     */
    public void writeToSnapshotFile(Path snapshotFile) {
        Objects.requireNonNull(snapshotFile, "snapshotFile");
        try {
            createParentDirectories(snapshotFile);
            SNAPSHOT_MAPPER.writeValue(snapshotFile.toFile(), this);
        } catch (IOException e) {
            throw new WorkflowResultException("Failed to write workflow result snapshot: " + snapshotFile, e);
        }
    }

    /**
     * Writes {@link #getAllStepResults()} as YAML, replacing any previous content. Parent
     * directories are created.
     *
     * @throws WorkflowResultException on I/O failure
     */
    public void writeResultsToYmlFile(Path ymlFile) {
        Objects.requireNonNull(ymlFile, "ymlFile");
        try {
            createParentDirectories(ymlFile);
            YAML_MAPPER.writeValue(ymlFile.toFile(), getAllStepResults());
        } catch (IOException e) {
            throw new WorkflowResultException("Failed to write workflow results file: " + ymlFile, e);
        }
    }

    /**
     * Every result's {@link StepResult#getStepResult()} merged under {@value #TSSC_RESULTS_KEY},
     * keyed by step name then sub step name. When a sub step ran more than once its latest result
     * is shown.
     */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> getAllStepResults() {
        Map<String, Object> all = new LinkedHashMap<>();
        for (StepResult stepResult : workflowList) {
            Map<String, Object> subSteps = (Map<String, Object>) all.computeIfAbsent(
                    stepResult.getStepName(), k -> new LinkedHashMap<String, Object>());
            Map<String, Object> own = (Map<String, Object>) stepResult.getStepResult().get(stepResult.getStepName());
            subSteps.putAll(own);
        }
        Map<String, Object> results = new LinkedHashMap<>();
        results.put(TSSC_RESULTS_KEY, all);
        return results;
    }

    /**
     * Value of the first artifact with the given name, scanning results in append order.
     *
     * @param artifact    artifact name
     * @param stepName    restricts the search to this step when non-null
     * @param subStepName restricts the search further to this sub step; only used with a step name
     * @return the artifact value, or null when no result matches
     */
    public Object getArtifactValue(String artifact, String stepName, String subStepName) {
        for (StepResult stepResult : workflowList) {
            if (stepName != null) {
                if (!stepName.equals(stepResult.getStepName())) continue;
                if (subStepName != null && !subStepName.equals(stepResult.getSubStepName())) continue;
            }
            StepResultArtifact found = stepResult.getArtifact(artifact);
            if (found != null) {
                return found.getValue();
            }
        }
        return null;
    }

    /** {@link #getArtifactValue(String, String, String)} across all steps. */
    public Object getArtifactValue(String artifact) {
        return getArtifactValue(artifact, null, null);
    }

    /**
     * Nested mapping {@code {step: {sub step: {...}}}} of the given step, merged across all of its
     * sub steps in the ledger. When a sub step ran more than once its first result is used.
     *
     * @return the mapping, or an empty map when the step has no result
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getStepResult(String stepName) {
        Map<String, Object> subSteps = new LinkedHashMap<>();
        for (StepResult stepResult : workflowList) {
            if (!stepResult.getStepName().equals(stepName)) continue;
            Map<String, Object> own = (Map<String, Object>) stepResult.getStepResult().get(stepName);
            own.forEach(subSteps::putIfAbsent);
        }
        if (subSteps.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(stepName, subSteps);
        return result;
    }

    private static void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return workflowList.equals(((WorkflowResult) o).workflowList);
    }

    @Override
    public int hashCode() {
        return workflowList.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowResult{workflowList=" + workflowList + "}";
    }
}

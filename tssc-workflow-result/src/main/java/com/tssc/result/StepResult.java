package com.tssc.result;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one step execution: success flag, message and named artifacts. A new result is
 * successful with an empty message and no artifacts. When success is set to false the message
 * should say why; artifacts may still be attached to a failed result.
 * <p>
 * {@link #getStepResult()} produces the canonical nested mapping used in the results file:
 * <pre>
 * step-name:
 *   sub-step-name:
 *     sub-step-implementer-name: ...
 *     success: true
 *     message: ''
 *     artifacts:
 *       artifact-name: {value: ..., type: str}
 * </pre>
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class StepResult {

    public static final String SUB_STEP_IMPLEMENTER_NAME_KEY = "sub-step-implementer-name";
    public static final String SUCCESS_KEY = "success";
    public static final String MESSAGE_KEY = "message";
    public static final String ARTIFACTS_KEY = "artifacts";
    public static final String ARTIFACT_VALUE_KEY = "value";
    public static final String ARTIFACT_TYPE_KEY = "type";

    private final String stepName;
    private final String subStepName;
    private final String subStepImplementerName;
    private boolean success = true;
    private String message = "";
    private final Map<String, StepResultArtifact> artifacts = new LinkedHashMap<>();

    public StepResult(String stepName, String subStepName, String subStepImplementerName) {
        this.stepName = Objects.requireNonNull(stepName, "stepName");
        this.subStepName = Objects.requireNonNull(subStepName, "subStepName");
        this.subStepImplementerName = Objects.requireNonNull(subStepImplementerName, "subStepImplementerName");
    }

    @JsonCreator
    StepResult(
            @JsonProperty("step-name") String stepName,
            @JsonProperty("sub-step-name") String subStepName,
            @JsonProperty("sub-step-implementer-name") String subStepImplementerName,
            @JsonProperty("success") boolean success,
            @JsonProperty("message") String message,
            @JsonProperty("artifacts") List<StepResultArtifact> artifacts) {
        this(stepName, subStepName, subStepImplementerName);
        this.success = success;
        this.message = message != null ? message : "";
        if (artifacts != null) {
            for (StepResultArtifact artifact : artifacts) {
                this.artifacts.put(artifact.getName(), artifact);
            }
        }
    }

    /**
     * New successful result bound to the step's names.
     */
    public static StepResult fromStepImplementer(StepIdentity stepImplementer) {
        Objects.requireNonNull(stepImplementer, "stepImplementer");
        return new StepResult(
                stepImplementer.getStepName(),
                stepImplementer.getSubStepName(),
                stepImplementer.getSubStepImplementerName());
    }

    @JsonProperty("step-name")
    public String getStepName() {
        return stepName;
    }

    @JsonProperty("sub-step-name")
    public String getSubStepName() {
        return subStepName;
    }

    @JsonProperty("sub-step-implementer-name")
    public String getSubStepImplementerName() {
        return subStepImplementerName;
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message != null ? message : "";
    }

    /**
     * Adds an artifact of type {@value StepResultArtifact#DEFAULT_TYPE}, replacing any artifact
     * with the same name.
     */
    public void addArtifact(String name, Object value) {
        addArtifact(name, value, StepResultArtifact.DEFAULT_TYPE);
    }

    /**
     * Adds an artifact, replacing value and type of any artifact with the same name.
     */
    public void addArtifact(String name, Object value, String valueType) {
        artifacts.put(name, new StepResultArtifact(name, value, valueType));
    }

    /** Artifact by name, or null. */
    public StepResultArtifact getArtifact(String name) {
        return artifacts.get(name);
    }

    /** Value of the named artifact, or null when absent. */
    public Object getArtifactValue(String name) {
        StepResultArtifact artifact = artifacts.get(name);
        return artifact != null ? artifact.getValue() : null;
    }

    /** Artifacts by name (unmodifiable). */
    public Map<String, StepResultArtifact> getArtifacts() {
        return Collections.unmodifiableMap(artifacts);
    }

    @JsonProperty("artifacts")
    private List<StepResultArtifact> getArtifactList() {
        return new ArrayList<>(artifacts.values());
    }

    /**
     * Canonical nested mapping {@code {step: {sub step: {sub-step-implementer-name, success,
     * message, artifacts: {name: {value, type}}}}}}.
     */
    public Map<String, Object> getStepResult() {
        Map<String, Object> artifactsMap = new LinkedHashMap<>();
        for (StepResultArtifact artifact : artifacts.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(ARTIFACT_VALUE_KEY, artifact.getValue());
            entry.put(ARTIFACT_TYPE_KEY, artifact.getType());
            artifactsMap.put(artifact.getName(), entry);
        }
        Map<String, Object> subStep = new LinkedHashMap<>();
        subStep.put(SUB_STEP_IMPLEMENTER_NAME_KEY, subStepImplementerName);
        subStep.put(SUCCESS_KEY, success);
        subStep.put(MESSAGE_KEY, message);
        subStep.put(ARTIFACTS_KEY, artifactsMap);

        Map<String, Object> step = new LinkedHashMap<>();
        step.put(subStepName, subStep);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(stepName, step);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepResult that = (StepResult) o;
        return success == that.success
                && stepName.equals(that.stepName)
                && subStepName.equals(that.subStepName)
                && subStepImplementerName.equals(that.subStepImplementerName)
                && message.equals(that.message)
                && artifacts.equals(that.artifacts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepName, subStepName, subStepImplementerName, success, message, artifacts);
    }

    @Override
    public String toString() {
        return "StepResult{stepName=" + stepName + ", subStepName=" + subStepName
                + ", subStepImplementerName=" + subStepImplementerName + ", success=" + success
                + ", message=" + message + ", artifacts=" + artifacts.values() + "}";
    }
}

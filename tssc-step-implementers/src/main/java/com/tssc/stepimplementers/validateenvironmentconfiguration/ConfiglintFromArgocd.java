package com.tssc.stepimplementers.validateenvironmentconfiguration;

import com.tssc.config.SubStepConfig;
import com.tssc.result.StepResult;
import com.tssc.result.WorkflowResult;
import com.tssc.step.StepImplementer;
import com.tssc.step.StepWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Implementer of the {@code validate-environment-configuration} step that prepares the output of
 * the deploy step (ArgoCD) as input for config linting.
 * <p>
 * Expected previous result: {@code argocd-result-set} ({@code file:///folder/file.yml}).
 * Result: {@code configlint-yml-path} (type {@code file}), the same URL.
 * No configuration keys.
 */
public final class ConfiglintFromArgocd extends StepImplementer {

    private static final Logger log = LoggerFactory.getLogger(ConfiglintFromArgocd.class);

    public static final String IMPLEMENTER_NAME = "ConfiglintFromArgocd";
    static final String ARGOCD_RESULT_SET = "argocd-result-set";
    static final String CONFIGLINT_YML_PATH = "configlint-yml-path";

    private static final Pattern SCHEME_AND_AUTHORITY = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:(//[^/]*)?");

    public ConfiglintFromArgocd(StepWorkspace workspace, SubStepConfig config, String environment) {
        super(workspace, config, environment);
    }

    @Override
    public Map<String, Object> stepImplementerConfigDefaults() {
        return Collections.emptyMap();
    }

    @Override
    public List<String> requiredRuntimeStepConfigKeys() {
        return Collections.emptyList();
    }

    @Override
    protected StepResult executeStep(WorkflowResult workflowResult) {
        StepResult stepResult = StepResult.fromStepImplementer(this);

        Object argocdResultSet = workflowResult.getArtifactValue(ARGOCD_RESULT_SET);
        if (argocdResultSet == null) {
            stepResult.setSuccess(false);
            stepResult.setMessage("Step results missing " + ARGOCD_RESULT_SET + " from deploy step");
            return stepResult;
        }

        String location = argocdResultSet.toString();
        Path ymlPath = toPath(location);
        if (ymlPath == null || !Files.exists(ymlPath)) {
            stepResult.setSuccess(false);
            stepResult.setMessage(ARGOCD_RESULT_SET + " " + (ymlPath != null ? ymlPath : location) + " not found");
            return stepResult;
        }

        stepResult.addArtifact(CONFIGLINT_YML_PATH, argocdResultSet.toString(), "file");
        return stepResult;
    }

    /**
     * Path part of a {@code file://} URL; anything without a scheme is a plain path. For an opaque
     * URL ({@code file:x.yml}) the scheme-specific part is used. Strings that do not parse as a URI
     * (e.g. {@code file:///tmp/100%.yml}) have their scheme and authority stripped.
     *
     * @return the path, or null when nothing usable remains
     */
    static Path toPath(String location) {
        String path;
        try {
            URI uri = new URI(location);
            if (uri.getScheme() == null) {
                path = location;
            } else if (uri.getPath() != null) {
                path = uri.getPath();
            } else {
                path = uri.getSchemeSpecificPart();
            }
        } catch (URISyntaxException e) {
            path = SCHEME_AND_AUTHORITY.matcher(location).replaceFirst("");
        }
        if (path == null || path.isEmpty()) {
            return null;
        }
        try {
            return Path.of(path);
        } catch (InvalidPathException e) {
            log.debug("Not a valid path | location={} | error={}", location, e.getMessage());
            return null;
        }
    }
}

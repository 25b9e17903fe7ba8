package com.tssc.step;

import java.util.List;

/**
 * Step names of the default supply-chain workflow, in workflow order.
 */
public final class DefaultSteps {

    public static final String GENERATE_METADATA = "generate-metadata";
    public static final String TAG_SOURCE = "tag-source";
    public static final String STATIC_CODE_ANALYSIS = "static-code-analysis";
    public static final String PACKAGE = "package";
    public static final String UNIT_TEST = "unit-test";
    public static final String PUSH_ARTIFACTS = "push-artifacts";
    public static final String CREATE_CONTAINER_IMAGE = "create-container-image";
    public static final String PUSH_CONTAINER_IMAGE = "push-container-image";
    public static final String SIGN_CONTAINER_IMAGE = "sign-container-image";
    public static final String CONTAINER_IMAGE_UNIT_TEST = "container-image-unit-test";
    public static final String CONTAINER_IMAGE_STATIC_COMPLIANCE_SCAN = "container-image-static-compliance-scan";
    public static final String CONTAINER_IMAGE_STATIC_VULNERABILITY_SCAN = "container-image-static-vulnerability-scan";
    public static final String CREATE_DEPLOYMENT_ENVIRONMENT = "create-deployment-environment";
    public static final String DEPLOY = "deploy";
    public static final String VALIDATE_ENVIRONMENT_CONFIGURATION = "validate-environment-configuration";
    public static final String UAT = "uat";
    public static final String RUNTIME_VULNERABILITY_SCAN = "runtime-vulnerability-scan";
    public static final String CANARY_TEST = "canary-test";
    public static final String PUBLISH_WORKFLOW_RESULTS = "publish-workflow-results";

    /** All default steps in workflow order. */
    public static final List<String> ALL = List.of(
            GENERATE_METADATA,
            TAG_SOURCE,
            STATIC_CODE_ANALYSIS,
            PACKAGE,
            UNIT_TEST,
            PUSH_ARTIFACTS,
            CREATE_CONTAINER_IMAGE,
            PUSH_CONTAINER_IMAGE,
            SIGN_CONTAINER_IMAGE,
            CONTAINER_IMAGE_UNIT_TEST,
            CONTAINER_IMAGE_STATIC_COMPLIANCE_SCAN,
            CONTAINER_IMAGE_STATIC_VULNERABILITY_SCAN,
            CREATE_DEPLOYMENT_ENVIRONMENT,
            DEPLOY,
            VALIDATE_ENVIRONMENT_CONFIGURATION,
            UAT,
            RUNTIME_VULNERABILITY_SCAN,
            CANARY_TEST,
            PUBLISH_WORKFLOW_RESULTS);

    private DefaultSteps() {
    }
}

package dev.triageai.semconv.trace;

import lombok.experimental.UtilityClass;

/**
 * Semantic conventions for Triage resource attributes
 */
@UtilityClass
public class SemanticResourceAttributes {

    /**
     * The name of the SDK that produced the spans
     */
    public static final String SEMRESATTRS_SDK_NAME = SemanticConventions.TRIAGE_SDK_NAME;

    public static final String SEMRESATTRS_SDK_VERSION = SemanticConventions.TRIAGE_SDK_VERSION;

    /**
     * The deployment environment, e.g. "production" or "staging"
     */
    public static final String SEMRESATTRS_ENVIRONMENT = "triage.environment";

    public static final String SEMRESATTRS_SERVICE_NAME = "service.name";
}

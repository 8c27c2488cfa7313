package dev.triageai.instrumentation.context;

import dev.triageai.semconv.trace.SemanticConventions;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import lombok.experimental.UtilityClass;

/**
 * Maps an {@link AnnotationContext} to the {@code triage.*} span attributes.
 * Only fields that are set produce an attribute.
 */
@UtilityClass
public class AttributeProjector {

    private static final AttributeKey<Long> SESSION_TURN_NUMBER =
            AttributeKey.longKey(SemanticConventions.TRIAGE_SESSION_TURN_NUMBER);

    public static Attributes project(AnnotationContext annotations) {
        if (annotations == null || annotations.isEmpty()) {
            return Attributes.empty();
        }

        AttributesBuilder builder = Attributes.builder();
        putIfSet(builder, SemanticConventions.TRIAGE_USER_ID, annotations.getUserId());
        putIfSet(builder, SemanticConventions.TRIAGE_USER_ROLE, annotations.getUserRole());
        putIfSet(builder, SemanticConventions.TRIAGE_TENANT_ID, annotations.getTenantId());
        putIfSet(builder, SemanticConventions.TRIAGE_TENANT_NAME, annotations.getTenantName());
        putIfSet(builder, SemanticConventions.TRIAGE_SESSION_ID, annotations.getSessionId());
        if (annotations.getSessionTurnNumber() != null) {
            builder.put(SESSION_TURN_NUMBER, annotations.getSessionTurnNumber().longValue());
        }
        putIfSet(builder, SemanticConventions.TRIAGE_SESSION_HISTORY_HASH, annotations.getSessionHistoryHash());
        putIfSet(builder, SemanticConventions.TRIAGE_INPUT_RAW, annotations.getInputRaw());
        putIfSet(builder, SemanticConventions.TRIAGE_INPUT_SANITIZED, annotations.getInputSanitized());
        putIfSet(builder, SemanticConventions.TRIAGE_TEMPLATE_ID, annotations.getTemplateId());
        putIfSet(builder, SemanticConventions.TRIAGE_TEMPLATE_VERSION, annotations.getTemplateVersion());
        putIfSet(builder, SemanticConventions.TRIAGE_CHUNK_ACLS, annotations.getChunkAcls());
        return builder.build();
    }

    private static void putIfSet(AttributesBuilder builder, String key, String value) {
        if (!AnnotationContext.isBlank(value)) {
            builder.put(key, value);
        }
    }
}

package dev.triageai.instrumentation.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Annotation helpers. Each returns a new {@link Context} whose {@link AnnotationContext} is the one
 * in {@code context} extended with the given fields; optional fields left out of a call keep their
 * previous value.
 *
 * <p>Every span started from the returned context (or while it is current) receives the
 * {@code triage.*} attributes through {@link TriageSpanProcessor}. The span already active in
 * {@code context}, if recording, is stamped immediately.
 *
 * <pre>{@code
 * Context ctx = Annotations.withUser(Context.current(), "u_42", "admin");
 * ctx = Annotations.withSession(ctx, "sess_1", 3, null);
 * try (Scope scope = ctx.makeCurrent()) {
 *     ...
 * }
 * }</pre>
 */
@UtilityClass
public class Annotations {

    private static final Logger log = LoggerFactory.getLogger(Annotations.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static Context withUser(Context context, String userId) {
        return withUser(context, userId, null);
    }

    public static Context withUser(Context context, String userId, String role) {
        return annotate(
                context,
                AnnotationContext.builder().userId(userId).userRole(role).build());
    }

    public static Context withTenant(Context context, String tenantId) {
        return withTenant(context, tenantId, null);
    }

    public static Context withTenant(Context context, String tenantId, String tenantName) {
        return annotate(
                context,
                AnnotationContext.builder().tenantId(tenantId).tenantName(tenantName).build());
    }

    public static Context withSession(Context context, String sessionId) {
        return withSession(context, sessionId, null, null);
    }

    /**
     * @param turnNumber the conversation turn, or {@code null} to leave it unchanged
     * @param historyHash a hash of the conversation so far, or {@code null} to leave it unchanged
     */
    public static Context withSession(Context context, String sessionId, Integer turnNumber, String historyHash) {
        return annotate(
                context,
                AnnotationContext.builder()
                        .sessionId(sessionId)
                        .sessionTurnNumber(turnNumber)
                        .sessionHistoryHash(historyHash)
                        .build());
    }

    public static Context withInput(Context context, String raw) {
        return withInput(context, raw, null);
    }

    public static Context withInput(Context context, String raw, String sanitized) {
        return annotate(
                context,
                AnnotationContext.builder().inputRaw(raw).inputSanitized(sanitized).build());
    }

    public static Context withTemplate(Context context, String templateId) {
        return withTemplate(context, templateId, null);
    }

    public static Context withTemplate(Context context, String templateId, String version) {
        return annotate(
                context,
                AnnotationContext.builder()
                        .templateId(templateId)
                        .templateVersion(version)
                        .build());
    }

    /**
     * Attaches access control metadata of retrieved chunks, serialized to JSON.
     * If the ACLs are {@code null} or cannot be serialized the context is returned unchanged.
     */
    public static Context withChunkAcls(Context context, List<? extends Map<String, ?>> acls) {
        if (acls == null) {
            return context;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(acls);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize chunk ACLs, dropping them", e);
            return context;
        }
        return annotate(context, AnnotationContext.builder().chunkAcls(json).build());
    }

    /**
     * Extends the annotations carried by {@code context} with every field set in {@code update}.
     */
    public static Context annotate(Context context, AnnotationContext update) {
        AnnotationContext extended = AnnotationContext.fromContext(context).extend(update);

        Span span = Span.fromContext(context);
        if (span.isRecording()) {
            Attributes attributes = AttributeProjector.project(update);
            if (!attributes.isEmpty()) {
                span.setAllAttributes(attributes);
            }
        }

        return context.with(extended);
    }
}

package dev.triageai.instrumentation.context;

import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentelemetry.context.ImplicitContextKeyed;
import lombok.Builder;
import lombok.Value;

/**
 * Request-scoped annotations describing who is calling, on behalf of which tenant and session,
 * with what input and prompt template. Every field is optional; {@code null} or empty means not set.
 *
 * <p>Instances are immutable. {@link #extend(AnnotationContext)} derives a new instance and leaves
 * the receiver untouched, so concurrent call chains can branch from a shared ancestor safely.
 * The current instance travels inside an OpenTelemetry {@link Context}; see {@link #fromContext(Context)}.
 */
@Value
@Builder(toBuilder = true)
public class AnnotationContext implements ImplicitContextKeyed {

    private static final ContextKey<AnnotationContext> KEY = ContextKey.named("triage-annotation-context");

    private static final AnnotationContext EMPTY = builder().build();

    String userId;
    String userRole;
    String tenantId;
    String tenantName;
    String sessionId;

    /**
     * {@code null} when not set. Zero is a valid turn.
     */
    Integer sessionTurnNumber;

    String sessionHistoryHash;
    String inputRaw;
    String inputSanitized;
    String templateId;
    String templateVersion;

    /**
     * Chunk access control lists, already serialized to JSON.
     */
    String chunkAcls;

    public static AnnotationContext empty() {
        return EMPTY;
    }

    /**
     * Returns the annotations carried by {@code context}, or the empty instance.
     */
    public static AnnotationContext fromContext(Context context) {
        AnnotationContext annotations = context.get(KEY);
        return annotations != null ? annotations : EMPTY;
    }

    public static AnnotationContext current() {
        return fromContext(Context.current());
    }

    @Override
    public Context storeInContext(Context context) {
        return context.with(KEY, this);
    }

    /**
     * Returns a copy of this context with every field set in {@code update} overwritten.
     * Fields not set in {@code update} keep their value from this context.
     */
    public AnnotationContext extend(AnnotationContext update) {
        if (update == null || update.isEmpty()) {
            return this;
        }
        return toBuilder()
                .userId(pick(update.userId, userId))
                .userRole(pick(update.userRole, userRole))
                .tenantId(pick(update.tenantId, tenantId))
                .tenantName(pick(update.tenantName, tenantName))
                .sessionId(pick(update.sessionId, sessionId))
                .sessionTurnNumber(update.sessionTurnNumber != null ? update.sessionTurnNumber : sessionTurnNumber)
                .sessionHistoryHash(pick(update.sessionHistoryHash, sessionHistoryHash))
                .inputRaw(pick(update.inputRaw, inputRaw))
                .inputSanitized(pick(update.inputSanitized, inputSanitized))
                .templateId(pick(update.templateId, templateId))
                .templateVersion(pick(update.templateVersion, templateVersion))
                .chunkAcls(pick(update.chunkAcls, chunkAcls))
                .build();
    }

    public boolean isEmpty() {
        return isBlank(userId)
                && isBlank(userRole)
                && isBlank(tenantId)
                && isBlank(tenantName)
                && isBlank(sessionId)
                && sessionTurnNumber == null
                && isBlank(sessionHistoryHash)
                && isBlank(inputRaw)
                && isBlank(inputSanitized)
                && isBlank(templateId)
                && isBlank(templateVersion)
                && isBlank(chunkAcls);
    }

    private static String pick(String update, String base) {
        return isBlank(update) ? base : update;
    }

    static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}

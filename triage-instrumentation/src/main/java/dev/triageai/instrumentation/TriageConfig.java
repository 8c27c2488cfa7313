package dev.triageai.instrumentation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Resolved configuration of the Triage SDK. Immutable once built.
 */
@Getter
@Builder
@ToString(exclude = "apiKey")
public class TriageConfig {

    private final String apiKey;

    @Builder.Default
    private final String endpoint = ConfigResolver.DEFAULT_ENDPOINT;

    private final String appName;

    @Builder.Default
    private final String environment = ConfigResolver.DEFAULT_ENVIRONMENT;

    @Builder.Default
    private final boolean enabled = true;

    /**
     * Whether prompt and completion messages are recorded on LLM spans.
     */
    @Builder.Default
    private final boolean traceContent = true;

    /**
     * The URL spans are exported to.
     */
    public String getTracesEndpoint() {
        return endpoint + ConfigResolver.OTLP_TRACES_PATH;
    }
}

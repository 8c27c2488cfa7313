package dev.triageai.instrumentation;

import lombok.Builder;
import lombok.Getter;

/**
 * Explicit call-site options passed to {@link Triage#init(TriageOptions)}.
 * A {@code null} field is not set and falls back to the environment, then to the default.
 */
@Getter
@Builder
public class TriageOptions {

    private final String apiKey;

    private final String endpoint;

    private final String appName;

    private final String environment;

    private final Boolean enabled;

    private final Boolean traceContent;

    public static TriageOptions none() {
        return builder().build();
    }
}

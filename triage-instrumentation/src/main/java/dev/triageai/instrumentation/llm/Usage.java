package dev.triageai.instrumentation.llm;

import lombok.Builder;
import lombok.Value;

/**
 * Token counts reported by the model. A count of zero is treated as not reported.
 */
@Value
@Builder
public class Usage {
    private static final Usage NONE = builder().build();

    long inputTokens;
    long outputTokens;
    long totalTokens;
    long reasoningTokens;
    long cacheReadTokens;
    long cacheWriteTokens;

    public static Usage none() {
        return NONE;
    }
}

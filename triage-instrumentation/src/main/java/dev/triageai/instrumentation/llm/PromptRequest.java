package dev.triageai.instrumentation.llm;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The request side of one model invocation. Sampling parameters are {@code null} when not set.
 */
@Value
@Builder
public class PromptRequest {
    /**
     * The model vendor, e.g. "openai" or "anthropic".
     */
    String vendor;

    String model;

    @Singular
    List<Message> messages;

    @Singular
    List<ToolDefinition> tools;

    Double temperature;
    Double topP;
    Double frequencyPenalty;
    Double presencePenalty;
    Long maxTokens;

    @Singular
    List<String> stopSequences;
}

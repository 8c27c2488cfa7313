package dev.triageai.instrumentation.llm;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The response side of one model invocation.
 */
@Value
@Builder
public class CompletionResponse {
    /**
     * The model that served the request, which may differ from the requested one.
     */
    String model;

    @Singular
    List<Message> messages;

    @Builder.Default
    Usage usage = Usage.none();

    /**
     * Why generation stopped, e.g. "stop", "length" or "tool_calls".
     */
    String finishReason;
}

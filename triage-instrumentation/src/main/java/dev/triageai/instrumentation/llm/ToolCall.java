package dev.triageai.instrumentation.llm;

import lombok.Builder;
import lombok.Value;

/**
 * A tool or function call requested by the model.
 */
@Value
@Builder
public class ToolCall {
    String id;
    String type;
    String name;

    /**
     * The call arguments as a JSON string.
     */
    String arguments;
}

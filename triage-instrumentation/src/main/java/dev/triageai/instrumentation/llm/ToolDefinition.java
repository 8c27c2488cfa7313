package dev.triageai.instrumentation.llm;

import lombok.Builder;
import lombok.Value;

/**
 * A tool offered to the model.
 */
@Value
@Builder
public class ToolDefinition {
    String name;
    String description;

    /**
     * The parameter schema, serialized to JSON when recorded. Typically a {@code Map} or a JSON string.
     */
    Object parameters;
}

package dev.triageai.instrumentation.llm;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A chat message of a prompt or a completion.
 */
@Value
@Builder
public class Message {
    String role;
    String content;

    @Singular
    List<ToolCall> toolCalls;

    /**
     * For tool result messages, the id of the tool call this message answers.
     */
    String toolCallId;

    public static Message of(String role, String content) {
        return builder().role(role).content(content).build();
    }
}

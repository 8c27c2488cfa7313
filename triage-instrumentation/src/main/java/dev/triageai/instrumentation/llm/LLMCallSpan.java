package dev.triageai.instrumentation.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.triageai.instrumentation.trace.config.ContentMaskingSpan;
import dev.triageai.semconv.trace.SemanticConventions;
import dev.triageai.semconv.trace.SemanticConventions.LLMRequestType;
import dev.triageai.semconv.trace.SemanticConventions.MessageAttributePostfixes;
import dev.triageai.semconv.trace.SemanticConventions.ToolAttributePostfixes;
import dev.triageai.semconv.trace.SemanticConventions.ToolCallAttributePostfixes;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One model invocation, recorded on one span.
 *
 * <p>The span is opened with the request attributes by {@link #open}. It is closed exactly once, by
 * {@link #logCompletion(CompletionResponse)} or {@link #end()}. {@link #setError(Throwable)} marks the
 * span failed but leaves it open:
 *
 * <pre>{@code
 * LLMCallSpan call = tracer.logPrompt(Context.current(), request);
 * try {
 *     call.logCompletion(toCompletion(client.chat(...)));
 * } catch (RuntimeException e) {
 *     call.setError(e);
 *     call.end();
 *     throw e;
 * }
 * }</pre>
 *
 * Every operation is a no-op on an instance that is not open. Instances are not thread-safe.
 */
public class LLMCallSpan {

    private static final Logger log = LoggerFactory.getLogger(LLMCallSpan.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String FALLBACK_VENDOR = "llm";

    private static final AttributeKey<List<String>> STOP_SEQUENCES =
            AttributeKey.stringArrayKey(SemanticConventions.GEN_AI_REQUEST_STOP_SEQUENCES);

    enum State {
        UNOPENED,
        OPEN,
        CLOSED
    }

    private final Span span;
    private final Context context;
    private final boolean traceContent;
    private State state;
    private boolean errorRecorded;

    private LLMCallSpan(Span span, Context context, boolean traceContent, State state) {
        this.span = span;
        this.context = context;
        this.traceContent = traceContent;
        this.state = state;
    }

    /**
     * An instance that was never opened. Every operation on it does nothing.
     */
    public static LLMCallSpan unopened() {
        return new LLMCallSpan(null, Context.root(), false, State.UNOPENED);
    }

    /**
     * Starts the span for {@code request} as a child of {@code parent} and records the request attributes.
     * Messages and tool definitions are recorded only when {@code traceContent} is set.
     *
     * <p>A {@code null} parent means the current context. Without a tracer or a request nothing is
     * recorded and an {@linkplain #unopened() unopened} instance is returned.
     */
    public static LLMCallSpan open(Tracer tracer, Context parent, PromptRequest request, boolean traceContent) {
        if (tracer == null || request == null) {
            log.debug("Not opening LLM span, tracer: {}, request: {}", tracer, request);
            return unopened();
        }
        if (parent == null) {
            parent = Context.current();
        }

        Span otelSpan = tracer.spanBuilder(spanName(request))
                .setParent(parent)
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        Span maskingSpan = new ContentMaskingSpan(otelSpan, traceContent);
        LLMCallSpan call = new LLMCallSpan(maskingSpan, parent.with(otelSpan), traceContent, State.OPEN);
        call.setRequestAttributes(request);

        log.debug("Started LLM span for vendor: {}, model: {}", request.getVendor(), request.getModel());
        return call;
    }

    /**
     * {@code <vendor>.chat <model>}, with {@code llm} standing in for a missing vendor and the model omitted when empty.
     */
    static String spanName(PromptRequest request) {
        String vendor = isEmpty(request.getVendor()) ? FALLBACK_VENDOR : request.getVendor();
        String spanName = vendor + "." + LLMRequestType.CHAT.getValue();
        if (!isEmpty(request.getModel())) {
            spanName = spanName + " " + request.getModel();
        }
        return spanName;
    }

    /**
     * Records the response attributes and ends the span.
     */
    public void logCompletion(CompletionResponse response) {
        if (state != State.OPEN) {
            log.debug("Ignoring completion for LLM span in state {}", state);
            return;
        }

        try {
            if (response != null) {
                setResponseAttributes(response);
            }
            if (!errorRecorded) {
                span.setStatus(StatusCode.OK);
            }
        } finally {
            close();
        }
    }

    /**
     * Records {@code error} and marks the span failed. The span stays open; call {@link #end()} afterwards.
     */
    public void setError(Throwable error) {
        if (state != State.OPEN) {
            return;
        }

        if (error != null) {
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
        } else {
            span.setStatus(StatusCode.ERROR, "Unknown error occurred");
        }
        errorRecorded = true;
    }

    /**
     * Ends the span without response attributes, for calls that produced no response.
     */
    public void end() {
        if (state != State.OPEN) {
            return;
        }
        close();
    }

    /**
     * The context to start nested spans from. Spans started from it are children of this LLM span.
     */
    public Context getContext() {
        return context;
    }

    /**
     * The underlying span, for additional attributes. Message and tool definition attributes written to
     * it are dropped when content tracing is off.
     */
    public Span getSpan() {
        return span != null ? span : Span.getInvalid();
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public boolean isClosed() {
        return state == State.CLOSED;
    }

    private void close() {
        state = State.CLOSED;
        span.end();
    }

    private void setRequestAttributes(PromptRequest request) {
        setIfNotEmpty(SemanticConventions.GEN_AI_SYSTEM, request.getVendor());
        setIfNotEmpty(SemanticConventions.LLM_VENDOR, request.getVendor());
        setIfNotEmpty(SemanticConventions.GEN_AI_REQUEST_MODEL, request.getModel());
        setIfNotEmpty(SemanticConventions.LLM_REQUEST_MODEL, request.getModel());
        span.setAttribute(SemanticConventions.LLM_REQUEST_TYPE, LLMRequestType.CHAT.getValue());

        if (request.getTemperature() != null) {
            span.setAttribute(SemanticConventions.GEN_AI_REQUEST_TEMPERATURE, request.getTemperature());
        }
        if (request.getTopP() != null) {
            span.setAttribute(SemanticConventions.GEN_AI_REQUEST_TOP_P, request.getTopP());
        }
        if (request.getFrequencyPenalty() != null) {
            span.setAttribute(SemanticConventions.GEN_AI_REQUEST_FREQUENCY_PENALTY, request.getFrequencyPenalty());
        }
        if (request.getPresencePenalty() != null) {
            span.setAttribute(SemanticConventions.GEN_AI_REQUEST_PRESENCE_PENALTY, request.getPresencePenalty());
        }
        if (request.getMaxTokens() != null) {
            span.setAttribute(SemanticConventions.GEN_AI_REQUEST_MAX_TOKENS, request.getMaxTokens());
        }
        if (!request.getStopSequences().isEmpty()) {
            span.setAttribute(STOP_SEQUENCES, request.getStopSequences());
        }

        if (traceContent) {
            setMessageAttributes(SemanticConventions.GEN_AI_PROMPT, request.getMessages());
            setToolDefinitionAttributes(request.getTools());
        }
    }

    private void setResponseAttributes(CompletionResponse response) {
        setIfNotEmpty(SemanticConventions.GEN_AI_RESPONSE_MODEL, response.getModel());
        setIfNotEmpty(SemanticConventions.LLM_RESPONSE_MODEL, response.getModel());
        setIfNotEmpty(SemanticConventions.GEN_AI_RESPONSE_FINISH_REASON, response.getFinishReason());

        Usage usage = response.getUsage() != null ? response.getUsage() : Usage.none();
        setTokenCount(SemanticConventions.GEN_AI_USAGE_INPUT_TOKENS, usage.getInputTokens());
        setTokenCount(SemanticConventions.GEN_AI_USAGE_OUTPUT_TOKENS, usage.getOutputTokens());
        setTokenCount(SemanticConventions.GEN_AI_USAGE_TOTAL_TOKENS, usage.getTotalTokens());
        setTokenCount(SemanticConventions.GEN_AI_USAGE_REASONING_TOKENS, usage.getReasoningTokens());
        setTokenCount(SemanticConventions.GEN_AI_USAGE_CACHE_READ_TOKENS, usage.getCacheReadTokens());
        setTokenCount(SemanticConventions.GEN_AI_USAGE_CACHE_WRITE_TOKENS, usage.getCacheWriteTokens());
        setTokenCount(SemanticConventions.LLM_USAGE_PROMPT_TOKENS, usage.getInputTokens());
        setTokenCount(SemanticConventions.LLM_USAGE_COMPLETION_TOKENS, usage.getOutputTokens());
        setTokenCount(SemanticConventions.LLM_USAGE_TOTAL_TOKENS, usage.getTotalTokens());

        if (traceContent) {
            setMessageAttributes(SemanticConventions.GEN_AI_COMPLETION, response.getMessages());
        }
    }

    private void setMessageAttributes(String prefix, List<Message> messages) {
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            String messagePrefix = prefix + "." + i + ".";

            setIfNotEmpty(messagePrefix + MessageAttributePostfixes.ROLE, message.getRole());
            setIfNotEmpty(messagePrefix + MessageAttributePostfixes.CONTENT, message.getContent());
            setIfNotEmpty(messagePrefix + MessageAttributePostfixes.TOOL_CALL_ID, message.getToolCallId());

            List<ToolCall> toolCalls = message.getToolCalls();
            for (int j = 0; j < toolCalls.size(); j++) {
                ToolCall toolCall = toolCalls.get(j);
                String toolCallPrefix = messagePrefix + MessageAttributePostfixes.TOOL_CALLS + "." + j + ".";

                setIfNotEmpty(toolCallPrefix + ToolCallAttributePostfixes.ID, toolCall.getId());
                setIfNotEmpty(toolCallPrefix + ToolCallAttributePostfixes.TYPE, toolCall.getType());
                setIfNotEmpty(toolCallPrefix + ToolCallAttributePostfixes.NAME, toolCall.getName());
                setIfNotEmpty(toolCallPrefix + ToolCallAttributePostfixes.FUNCTION_NAME, toolCall.getName());
                setIfNotEmpty(toolCallPrefix + ToolCallAttributePostfixes.ARGUMENTS, toolCall.getArguments());
                setIfNotEmpty(toolCallPrefix + ToolCallAttributePostfixes.FUNCTION_ARGUMENTS, toolCall.getArguments());
            }
        }
    }

    private void setToolDefinitionAttributes(List<ToolDefinition> tools) {
        for (int i = 0; i < tools.size(); i++) {
            ToolDefinition tool = tools.get(i);
            String toolPrefix = SemanticConventions.GEN_AI_REQUEST_TOOLS + "." + i + ".";

            setIfNotEmpty(toolPrefix + ToolAttributePostfixes.NAME, tool.getName());
            setIfNotEmpty(toolPrefix + ToolAttributePostfixes.DESCRIPTION, tool.getDescription());

            Object parameters = tool.getParameters();
            if (parameters instanceof String) {
                setIfNotEmpty(toolPrefix + ToolAttributePostfixes.PARAMETERS, (String) parameters);
            } else if (parameters != null) {
                try {
                    span.setAttribute(
                            toolPrefix + ToolAttributePostfixes.PARAMETERS, objectMapper.writeValueAsString(parameters));
                } catch (JsonProcessingException e) {
                    log.warn("Failed to serialize parameters of tool {}", tool.getName(), e);
                }
            }
        }
    }

    private void setTokenCount(String key, long count) {
        if (count > 0) {
            span.setAttribute(key, count);
        }
    }

    private void setIfNotEmpty(String key, String value) {
        if (!isEmpty(value)) {
            span.setAttribute(key, value);
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}

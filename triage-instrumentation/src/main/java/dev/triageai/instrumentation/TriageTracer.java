package dev.triageai.instrumentation;

import dev.triageai.instrumentation.llm.LLMCallSpan;
import dev.triageai.instrumentation.llm.PromptRequest;
import dev.triageai.instrumentation.trace.Agent;
import dev.triageai.instrumentation.trace.Task;
import dev.triageai.instrumentation.trace.ToolSpan;
import dev.triageai.instrumentation.trace.Workflow;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import lombok.Getter;
import lombok.NonNull;

/**
 * Triage tracer wrapper that provides convenience methods for creating LLM call spans and
 * workflow, task, agent and tool spans.
 */
public class TriageTracer implements Tracer {

    @Getter
    private final Tracer tracer;

    private final BooleanSupplier traceContent;

    /**
     * A tracer that records message content as long as the SDK's active configuration allows it.
     */
    public TriageTracer(Tracer tracer) {
        this(tracer, Triage::shouldTraceContent);
    }

    public TriageTracer(Tracer tracer, BooleanSupplier traceContent) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.traceContent = Objects.requireNonNull(traceContent, "traceContent must not be null");
    }

    /**
     * Creates a span builder with the given name.
     */
    @Override
    public SpanBuilder spanBuilder(@NonNull String spanName) {
        return tracer.spanBuilder(spanName);
    }

    /**
     * Opens the span of one model invocation beneath {@code parent}.
     */
    public LLMCallSpan logPrompt(Context parent, PromptRequest request) {
        return LLMCallSpan.open(this, parent, request, isTraceContent());
    }

    public Workflow startWorkflow(Context parent, String name) {
        return Workflow.start(this, parent, name);
    }

    public Task startTask(Context parent, String name) {
        return Task.start(this, parent, name);
    }

    public Agent startAgent(Context parent, String name) {
        return Agent.start(this, parent, name);
    }

    public ToolSpan startTool(Context parent, String name) {
        return ToolSpan.start(this, parent, name);
    }

    public boolean isTraceContent() {
        return traceContent.getAsBoolean();
    }
}

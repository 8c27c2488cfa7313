package dev.triageai.instrumentation.trace;

import dev.triageai.semconv.trace.SemanticConventions;
import dev.triageai.semconv.trace.SemanticConventions.HierarchySpanKind;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import lombok.Getter;

/**
 * A span marking a structural step of an agent pipeline: a {@link Workflow}, {@link Task}, {@link Agent}
 * or {@link ToolSpan}. Tasks, agents and tools started beneath a workflow carry its name.
 */
public abstract class HierarchySpan {

    private static final ContextKey<String> WORKFLOW_NAME = ContextKey.named("triage-workflow-name");

    private final Span span;
    private final Context context;

    @Getter
    private final String name;

    @Getter
    private final HierarchySpanKind kind;

    private boolean ended;

    protected HierarchySpan(Span span, Context context, String name, HierarchySpanKind kind) {
        this.span = span;
        this.context = context;
        this.name = name;
        this.kind = kind;
    }

    /**
     * The name of the workflow {@code context} descends from, or {@code null} outside any workflow.
     */
    public static String workflowName(Context context) {
        return context != null ? context.get(WORKFLOW_NAME) : null;
    }

    /**
     * Starts a child span of {@code parent} tagged with {@code kind}, its entity name and the inherited workflow name.
     */
    static SpanBuilder spanBuilder(Tracer tracer, Context parent, String name, HierarchySpanKind kind) {
        SpanBuilder builder = tracer.spanBuilder(name)
                .setParent(parent)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(SemanticConventions.TRACELOOP_SPAN_KIND, kind.getValue())
                .setAttribute(SemanticConventions.TRACELOOP_ENTITY_NAME, name);

        String workflowName = workflowName(parent);
        if (workflowName != null) {
            builder.setAttribute(SemanticConventions.TRACELOOP_WORKFLOW_NAME, workflowName);
        }
        return builder;
    }

    /**
     * {@code parent}, or the current context when {@code null}.
     */
    static Context parentOrCurrent(Context parent) {
        return parent != null ? parent : Context.current();
    }

    static Context withWorkflowName(Context context, String workflowName) {
        return context.with(WORKFLOW_NAME, workflowName);
    }

    /**
     * Ends the span. Further calls do nothing.
     */
    public void end() {
        if (ended) {
            return;
        }
        ended = true;
        span.end();
    }

    /**
     * The context to start nested spans from.
     */
    public Context getContext() {
        return context;
    }

    public Span getSpan() {
        return span;
    }

    public boolean isEnded() {
        return ended;
    }
}

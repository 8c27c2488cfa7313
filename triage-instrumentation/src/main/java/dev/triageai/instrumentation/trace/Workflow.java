package dev.triageai.instrumentation.trace;

import dev.triageai.semconv.trace.SemanticConventions;
import dev.triageai.semconv.trace.SemanticConventions.HierarchySpanKind;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

/**
 * The top-level grouping of a multi-step pipeline. Its name is inherited by every task, agent and tool
 * started from {@link #getContext()}.
 */
public final class Workflow extends HierarchySpan {

    private Workflow(Span span, Context context, String name) {
        super(span, context, name, HierarchySpanKind.WORKFLOW);
    }

    public static Workflow start(Tracer tracer, Context parent, String name) {
        parent = parentOrCurrent(parent);
        Span span = spanBuilder(tracer, parent, name, HierarchySpanKind.WORKFLOW)
                .setAttribute(SemanticConventions.TRACELOOP_WORKFLOW_NAME, name)
                .startSpan();
        return new Workflow(span, withWorkflowName(parent.with(span), name), name);
    }
}

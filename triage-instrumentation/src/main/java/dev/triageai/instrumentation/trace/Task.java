package dev.triageai.instrumentation.trace;

import dev.triageai.semconv.trace.SemanticConventions.HierarchySpanKind;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

/**
 * A discrete step within a workflow.
 */
public final class Task extends HierarchySpan {

    private Task(Span span, Context context, String name) {
        super(span, context, name, HierarchySpanKind.TASK);
    }

    public static Task start(Tracer tracer, Context parent, String name) {
        parent = parentOrCurrent(parent);
        Span span = spanBuilder(tracer, parent, name, HierarchySpanKind.TASK).startSpan();
        return new Task(span, parent.with(span), name);
    }
}

package dev.triageai.instrumentation.trace;

import dev.triageai.semconv.trace.SemanticConventions.HierarchySpanKind;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

/**
 * The execution of a tool or function by an agent. Not to be confused with the tool definitions and
 * tool calls recorded on LLM spans.
 */
public final class ToolSpan extends HierarchySpan {

    private ToolSpan(Span span, Context context, String name) {
        super(span, context, name, HierarchySpanKind.TOOL);
    }

    public static ToolSpan start(Tracer tracer, Context parent, String name) {
        parent = parentOrCurrent(parent);
        Span span = spanBuilder(tracer, parent, name, HierarchySpanKind.TOOL).startSpan();
        return new ToolSpan(span, parent.with(span), name);
    }
}

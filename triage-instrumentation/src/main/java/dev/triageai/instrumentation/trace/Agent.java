package dev.triageai.instrumentation.trace;

import dev.triageai.semconv.trace.SemanticConventions;
import dev.triageai.semconv.trace.SemanticConventions.HierarchySpanKind;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

/**
 * An autonomous entity that makes model calls and uses tools.
 */
public final class Agent extends HierarchySpan {

    private Agent(Span span, Context context, String name) {
        super(span, context, name, HierarchySpanKind.AGENT);
    }

    public static Agent start(Tracer tracer, Context parent, String name) {
        parent = parentOrCurrent(parent);
        Span span = spanBuilder(tracer, parent, name, HierarchySpanKind.AGENT)
                .setAttribute(SemanticConventions.LLM_AGENT_NAME, name)
                .startSpan();
        return new Agent(span, parent.with(span), name);
    }
}

package dev.triageai.instrumentation.context;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;

/**
 * Copies the {@link AnnotationContext} of the parent context onto every span as it starts,
 * whichever library started it. Stateless.
 */
public class TriageSpanProcessor implements SpanProcessor {

    @Override
    public void onStart(Context parentContext, ReadWriteSpan span) {
        Attributes attributes = AttributeProjector.project(AnnotationContext.fromContext(parentContext));
        if (!attributes.isEmpty()) {
            span.setAllAttributes(attributes);
        }
    }

    @Override
    public boolean isStartRequired() {
        return true;
    }

    @Override
    public void onEnd(ReadableSpan span) {}

    @Override
    public boolean isEndRequired() {
        return false;
    }
}

package dev.triageai.instrumentation.trace.config;

import static org.junit.jupiter.api.Assertions.*;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentMaskingSpanTest {

    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;
    private Tracer tracer;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        tracer = tracerProvider.get("test");
    }

    @AfterEach
    void tearDown() {
        tracerProvider.shutdown();
    }

    @Test
    void testContentDroppedWhenContentHidden() {
        Span span = new ContentMaskingSpan(tracer.spanBuilder("llm").startSpan(), false);

        span.setAttribute("gen_ai.prompt.0.content", "secret");
        span.setAttribute("gen_ai.completion.0.content", "answer");
        span.setAttribute("gen_ai.request.model", "gpt-4o");
        span.setAttribute("gen_ai.request.tools.0.name", "search");
        span.setAttribute("gen_ai.usage.input_tokens", 5L);
        span.end();

        Attributes attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
        assertNull(attributes.get(AttributeKey.stringKey("gen_ai.prompt.0.content")));
        assertNull(attributes.get(AttributeKey.stringKey("gen_ai.completion.0.content")));
        assertEquals("gpt-4o", attributes.get(AttributeKey.stringKey("gen_ai.request.model")));
        assertNull(attributes.get(AttributeKey.stringKey("gen_ai.request.tools.0.name")));
        assertEquals(5L, attributes.get(AttributeKey.longKey("gen_ai.usage.input_tokens")));
    }

    @Test
    void testMessagesKeptWhenContentTraced() {
        ContentMaskingSpan span = new ContentMaskingSpan(tracer.spanBuilder("llm").startSpan(), true);

        span.setAllAttributes(Attributes.of(
                AttributeKey.stringKey("gen_ai.prompt.0.content"), "hello",
                AttributeKey.longKey("gen_ai.usage.total_tokens"), 9L));
        span.end();

        assertTrue(span.isTraceContent());
        Attributes attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
        assertEquals("hello", attributes.get(AttributeKey.stringKey("gen_ai.prompt.0.content")));
        assertEquals(9L, attributes.get(AttributeKey.longKey("gen_ai.usage.total_tokens")));
    }

    @Test
    void testDelegatesIdentityAndLifecycle() {
        Span delegate = tracer.spanBuilder("llm").startSpan();
        Span span = new ContentMaskingSpan(delegate, false);

        assertEquals(delegate.getSpanContext(), span.getSpanContext());
        assertTrue(span.isRecording());

        span.updateName("renamed");
        span.end();

        assertFalse(span.isRecording());
        SpanData data = spanExporter.getFinishedSpanItems().get(0);
        assertEquals("renamed", data.getName());
    }

    @Test
    void testRejectsNullDelegate() {
        assertThrows(NullPointerException.class, () -> new ContentMaskingSpan(null, true));
    }
}

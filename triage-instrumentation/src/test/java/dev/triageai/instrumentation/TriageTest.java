package dev.triageai.instrumentation;

import static org.junit.jupiter.api.Assertions.*;

import dev.triageai.instrumentation.context.Annotations;
import dev.triageai.instrumentation.llm.CompletionResponse;
import dev.triageai.instrumentation.llm.LLMCallSpan;
import dev.triageai.instrumentation.llm.PromptRequest;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TriageTest {

    private final Map<String, String> env = new HashMap<>();
    private final ConfigResolver resolver = new ConfigResolver(env::get);

    private static TriageOptions.TriageOptionsBuilder localOptions() {
        return TriageOptions.builder().apiKey("test-key").endpoint("http://localhost:4318");
    }

    @AfterEach
    void tearDown() {
        Triage.shutdown(Duration.ofSeconds(1));
        GlobalOpenTelemetry.resetForTest();
        Triage.resetGlobalRegistration();
    }

    private static Span startThirdPartySpan() {
        return GlobalOpenTelemetry.getTracer("third-party")
                .spanBuilder("http")
                .setParent(Annotations.withUser(Context.root(), "u1"))
                .startSpan();
    }

    private static void assertRecordedWithAnnotations(Span span) {
        assertTrue(span.isRecording());
        ReadableSpan readable = assertInstanceOf(ReadableSpan.class, span);
        assertEquals("u1", readable.getAttribute(AttributeKey.stringKey("triage.user.id")));
    }

    @Test
    void testInitActivatesPipeline() {
        ShutdownHandle handle = Triage.init(localOptions().appName("support-bot").build(), resolver);

        assertNotSame(ShutdownHandle.NOOP, handle);
        assertTrue(Triage.isInitialized());
        assertNotNull(Triage.activeTracerProvider());
        assertEquals("support-bot", Triage.activeConfig().getAppName());
        assertEquals("http://localhost:4318/v1/traces", Triage.activeConfig().getTracesEndpoint());
    }

    @Test
    void testSecondInitIsIgnored() {
        Triage.init(localOptions().environment("production").build(), resolver);
        SdkTracerProvider provider = Triage.activeTracerProvider();

        ShutdownHandle second = Triage.init(localOptions().environment("staging").build(), resolver);

        assertSame(ShutdownHandle.NOOP, second);
        assertSame(provider, Triage.activeTracerProvider());
        assertEquals("production", Triage.activeConfig().getEnvironment());

        second.close();
        assertTrue(Triage.isInitialized());
    }

    @Test
    void testShutdownIsIdempotent() {
        Triage.init(localOptions().build(), resolver);

        CompletableResultCode first = Triage.shutdown(Duration.ofSeconds(5));
        CompletableResultCode second = Triage.shutdown(Duration.ofSeconds(5));

        assertTrue(first.isSuccess());
        assertTrue(second.isSuccess());
        assertFalse(Triage.isInitialized());
        assertNull(Triage.activeTracerProvider());
    }

    @Test
    void testShutdownWithoutInitSucceeds() {
        assertTrue(Triage.shutdown(Duration.ofSeconds(1)).isSuccess());
    }

    @Test
    void testHandleShutsDownItsOwnPipelineOnly() {
        ShutdownHandle first = Triage.init(localOptions().build(), resolver);
        first.close();
        assertFalse(Triage.isInitialized());

        Triage.init(localOptions().build(), resolver);
        first.close();

        assertTrue(Triage.isInitialized());
    }

    @Test
    void testMissingApiKeyFailsAndStaysUninitialized() {
        assertThrows(ConfigurationException.class, () -> Triage.init(TriageOptions.none(), resolver));

        assertFalse(Triage.isInitialized());
    }

    @Test
    void testApiKeyFromEnvironment() {
        env.put(ConfigResolver.ENV_API_KEY, "env-key");
        env.put(ConfigResolver.ENV_ENDPOINT, "http://localhost:4318");

        Triage.init(TriageOptions.none(), resolver);

        assertEquals("env-key", Triage.activeConfig().getApiKey());
    }

    @Test
    void testDisabledReturnsInertHandle() {
        ShutdownHandle handle = Triage.init(localOptions().enabled(false).build(), resolver);

        assertSame(ShutdownHandle.NOOP, handle);
        assertFalse(Triage.isInitialized());
        assertNull(Triage.activeTracerProvider());
    }

    @Test
    void testInvalidEndpointFails() {
        TriageOptions options = localOptions().endpoint("ftp://collector.local").build();

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> Triage.init(options, resolver));

        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertFalse(Triage.isInitialized());
    }

    @Test
    void testContentVisibilityFollowsActiveConfig() {
        assertTrue(Triage.shouldTraceContent());

        Triage.init(localOptions().traceContent(false).build(), resolver);
        assertFalse(Triage.shouldTraceContent());
        assertFalse(Triage.tracer().isTraceContent());

        Triage.shutdown(Duration.ofSeconds(5));
        assertTrue(Triage.shouldTraceContent());
    }

    @Test
    void testTracerWorksWithoutInit() {
        LLMCallSpan call = Triage.tracer()
                .logPrompt(Context.root(), PromptRequest.builder().vendor("openai").model("gpt-4o").build());
        call.logCompletion(CompletionResponse.builder().model("gpt-4o").build());

        assertTrue(call.isClosed());
        assertFalse(call.getSpan().isRecording());
    }

    @Test
    void testTracerRecordsThroughActivePipeline() {
        Triage.init(localOptions().build(), resolver);

        LLMCallSpan call = Triage.tracer()
                .logPrompt(Context.root(), PromptRequest.builder().vendor("openai").model("gpt-4o").build());

        assertTrue(call.getSpan().isRecording());
        call.end();
    }

    @Test
    void testGlobalTracerFollowsReinitialization() {
        Triage.init(localOptions().build(), resolver);
        Triage.shutdown(Duration.ofSeconds(5));

        assertFalse(startThirdPartySpan().isRecording());

        Triage.init(localOptions().build(), resolver);

        assertRecordedWithAnnotations(startThirdPartySpan());
    }

    @Test
    void testTracerBeforeInitDoesNotBlockGlobalRegistration() {
        TriageTracer early = Triage.tracer();
        assertFalse(early.spanBuilder("before").startSpan().isRecording());

        Triage.init(localOptions().build(), resolver);

        assertRecordedWithAnnotations(startThirdPartySpan());
        assertTrue(early.spanBuilder("after").startSpan().isRecording());
    }
}

package dev.triageai.instrumentation;

import static io.opentelemetry.api.common.AttributeKey.stringKey;

import dev.triageai.instrumentation.context.TriageSpanProcessor;
import dev.triageai.semconv.trace.SemanticResourceAttributes;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.TracerProvider;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the Triage SDK. {@link #init(TriageOptions)} wires one tracing pipeline per process:
 * a {@link TriageSpanProcessor} that stamps request annotations on every span, followed by a batching
 * OTLP/HTTP exporter pointed at the Triage backend. {@link #shutdown(Duration)} flushes and releases it.
 *
 * <p>Annotation and LLM logging calls are safe without {@code init}; their spans are simply not exported.
 */
public final class Triage {

    private static final Logger log = LoggerFactory.getLogger(Triage.class);

    public static final String SDK_NAME = "triage-sdk-java";
    public static final String SDK_VERSION = "0.1.0";

    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private static final Object lock = new Object();

    // registered globally once, pointed at the active pipeline by init and back at a no-op by shutdown
    private static final DelegatingTracerProvider delegatingTracerProvider = new DelegatingTracerProvider();

    private static final OpenTelemetry openTelemetry = new OpenTelemetry() {
        private final ContextPropagators propagators =
                ContextPropagators.create(W3CTraceContextPropagator.getInstance());

        @Override
        public TracerProvider getTracerProvider() {
            return delegatingTracerProvider;
        }

        @Override
        public ContextPropagators getPropagators() {
            return propagators;
        }
    };

    // guarded by lock
    private static boolean initialized;
    private static boolean globalRegistered;
    private static SdkTracerProvider tracerProvider;
    private static TriageConfig activeConfig;

    private Triage() {}

    /**
     * Initializes the SDK from the environment and defaults.
     *
     * @throws ConfigurationException if no API key is configured
     */
    public static ShutdownHandle init() {
        return init(TriageOptions.none());
    }

    /**
     * Initializes the SDK. A second call while initialized logs a warning and returns an inert handle.
     *
     * @throws ConfigurationException if no API key is configured or the exporter cannot be created
     */
    public static ShutdownHandle init(TriageOptions options) {
        return init(options, new ConfigResolver());
    }

    static ShutdownHandle init(TriageOptions options, ConfigResolver resolver) {
        SdkTracerProvider provider;
        synchronized (lock) {
            if (initialized) {
                log.warn("Triage.init() called more than once, ignoring");
                return ShutdownHandle.NOOP;
            }

            TriageConfig config = resolver.resolve(options);
            if (!config.isEnabled()) {
                log.info("Triage SDK disabled via config, skipping initialization");
                return ShutdownHandle.NOOP;
            }

            provider = createTracerProvider(config);
            registerGlobal();
            delegatingTracerProvider.setDelegate(provider);

            tracerProvider = provider;
            activeConfig = config;
            initialized = true;

            log.info(
                    "Triage SDK initialized for app {} in environment {}, exporting to {}",
                    config.getAppName(),
                    config.getEnvironment(),
                    config.getEndpoint());
        }

        return () -> {
            CompletableResultCode result = shutdown(provider, DEFAULT_SHUTDOWN_TIMEOUT);
            if (!result.isSuccess()) {
                log.error("Triage SDK did not shut down cleanly within {}", DEFAULT_SHUTDOWN_TIMEOUT);
            }
        };
    }

    /**
     * Flushes pending spans and releases the pipeline, waiting at most {@code timeout}.
     * Does nothing when the SDK is not initialized.
     */
    public static CompletableResultCode shutdown(Duration timeout) {
        return shutdown(null, timeout);
    }

    // a handle only shuts down the pipeline it was created with
    private static CompletableResultCode shutdown(SdkTracerProvider expected, Duration timeout) {
        SdkTracerProvider provider;
        synchronized (lock) {
            if (!initialized || tracerProvider == null) {
                return CompletableResultCode.ofSuccess();
            }
            if (expected != null && expected != tracerProvider) {
                return CompletableResultCode.ofSuccess();
            }
            provider = tracerProvider;
            delegatingTracerProvider.setDelegate(TracerProvider.noop());
            tracerProvider = null;
            activeConfig = null;
            initialized = false;
        }

        log.info("Shutting down Triage SDK");
        return provider.shutdown().join(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public static boolean isInitialized() {
        synchronized (lock) {
            return initialized;
        }
    }

    /**
     * Whether prompt and completion content is recorded. True when the SDK is not initialized.
     */
    public static boolean shouldTraceContent() {
        synchronized (lock) {
            return activeConfig == null || activeConfig.isTraceContent();
        }
    }

    /**
     * A tracer for LLM call and workflow spans. It records through the active pipeline, including one
     * initialized after the tracer was obtained, and is a no-op while the SDK is not initialized.
     */
    public static TriageTracer tracer() {
        return new TriageTracer(delegatingTracerProvider.get(SDK_NAME, SDK_VERSION));
    }

    static SdkTracerProvider activeTracerProvider() {
        synchronized (lock) {
            return tracerProvider;
        }
    }

    static TriageConfig activeConfig() {
        synchronized (lock) {
            return activeConfig;
        }
    }

    // lets tests register again after GlobalOpenTelemetry.resetForTest()
    static void resetGlobalRegistration() {
        synchronized (lock) {
            globalRegistered = false;
        }
    }

    private static SdkTracerProvider createTracerProvider(TriageConfig config) {
        OtlpHttpSpanExporter exporter;
        try {
            exporter = OtlpHttpSpanExporter.builder()
                    .setEndpoint(config.getTracesEndpoint())
                    .addHeader("Authorization", "Bearer " + config.getApiKey())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Failed to create OTLP exporter for " + config.getEndpoint(), e);
        }

        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(
                        stringKey(SemanticResourceAttributes.SEMRESATTRS_SERVICE_NAME), config.getAppName(),
                        stringKey(SemanticResourceAttributes.SEMRESATTRS_SDK_NAME), SDK_NAME,
                        stringKey(SemanticResourceAttributes.SEMRESATTRS_SDK_VERSION), SDK_VERSION,
                        stringKey(SemanticResourceAttributes.SEMRESATTRS_ENVIRONMENT), config.getEnvironment())));

        return SdkTracerProvider.builder()
                .addSpanProcessor(new TriageSpanProcessor())
                .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
                .setResource(resource)
                .build();
    }

    // makes the pipeline visible to every OpenTelemetry-instrumented library in the process
    private static void registerGlobal() {
        if (globalRegistered) {
            return;
        }
        try {
            GlobalOpenTelemetry.set(openTelemetry);
            globalRegistered = true;
        } catch (IllegalStateException e) {
            log.warn("A global OpenTelemetry instance is already registered, Triage spans are only recorded "
                    + "through Triage.tracer()");
        }
    }
}

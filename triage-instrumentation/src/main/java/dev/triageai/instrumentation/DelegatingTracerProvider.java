package dev.triageai.instrumentation;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerBuilder;
import io.opentelemetry.api.trace.TracerProvider;
import java.util.Objects;

/**
 * A {@link TracerProvider} that forwards to whichever pipeline is active. Tracers handed out by it
 * resolve the delegate on every span, so a tracer obtained before {@code init} or across a
 * shutdown and re-init always starts spans in the current pipeline.
 */
final class DelegatingTracerProvider implements TracerProvider {

    private volatile TracerProvider delegate = TracerProvider.noop();

    void setDelegate(TracerProvider delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    TracerProvider getDelegate() {
        return delegate;
    }

    @Override
    public Tracer get(String instrumentationScopeName) {
        return tracerBuilder(instrumentationScopeName).build();
    }

    @Override
    public Tracer get(String instrumentationScopeName, String instrumentationScopeVersion) {
        return tracerBuilder(instrumentationScopeName)
                .setInstrumentationVersion(instrumentationScopeVersion)
                .build();
    }

    @Override
    public TracerBuilder tracerBuilder(String instrumentationScopeName) {
        return new DelegatingTracerBuilder(instrumentationScopeName);
    }

    private class DelegatingTracerBuilder implements TracerBuilder {
        private final String name;
        private String version;
        private String schemaUrl;

        DelegatingTracerBuilder(String name) {
            this.name = name;
        }

        @Override
        public TracerBuilder setSchemaUrl(String schemaUrl) {
            this.schemaUrl = schemaUrl;
            return this;
        }

        @Override
        public TracerBuilder setInstrumentationVersion(String instrumentationScopeVersion) {
            this.version = instrumentationScopeVersion;
            return this;
        }

        @Override
        public Tracer build() {
            return new DelegatingTracer(name, version, schemaUrl);
        }
    }

    private class DelegatingTracer implements Tracer {
        private final String name;
        private final String version;
        private final String schemaUrl;

        DelegatingTracer(String name, String version, String schemaUrl) {
            this.name = name;
            this.version = version;
            this.schemaUrl = schemaUrl;
        }

        @Override
        public SpanBuilder spanBuilder(String spanName) {
            return currentTracer().spanBuilder(spanName);
        }

        // the SDK caches tracers per scope, so this lookup is cheap
        private Tracer currentTracer() {
            TracerBuilder builder = delegate.tracerBuilder(name);
            if (version != null) {
                builder.setInstrumentationVersion(version);
            }
            if (schemaUrl != null) {
                builder.setSchemaUrl(schemaUrl);
            }
            return builder.build();
        }
    }
}

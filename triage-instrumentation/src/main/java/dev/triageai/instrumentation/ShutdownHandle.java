package dev.triageai.instrumentation;

/**
 * Returned by {@link Triage#init(TriageOptions)}. Closing it flushes pending spans and releases the
 * tracing pipeline; it never throws.
 *
 * <pre>{@code
 * try (ShutdownHandle triage = Triage.init(TriageOptions.builder().apiKey("tsk_...").build())) {
 *     ...
 * }
 * }</pre>
 */
@FunctionalInterface
public interface ShutdownHandle extends AutoCloseable {

    ShutdownHandle NOOP = () -> {};

    @Override
    void close();
}

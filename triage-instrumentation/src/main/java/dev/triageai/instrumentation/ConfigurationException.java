package dev.triageai.instrumentation;

/**
 * Thrown by {@link Triage#init(TriageOptions)} when the SDK cannot be configured.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

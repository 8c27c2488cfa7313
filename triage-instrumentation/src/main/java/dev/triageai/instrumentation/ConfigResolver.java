package dev.triageai.instrumentation;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves a {@link TriageConfig} from three layers, lowest precedence first:
 * built-in defaults, environment variables, explicit {@link TriageOptions}.
 */
public class ConfigResolver {

    public static final String ENV_API_KEY = "TRIAGE_API_KEY";
    public static final String ENV_ENDPOINT = "TRIAGE_ENDPOINT";
    public static final String ENV_APP_NAME = "TRIAGE_APP_NAME";
    public static final String ENV_ENVIRONMENT = "TRIAGE_ENVIRONMENT";
    public static final String ENV_ENABLED = "TRIAGE_ENABLED";
    public static final String ENV_TRACE_CONTENT = "TRIAGE_TRACE_CONTENT";

    public static final String DEFAULT_ENDPOINT = "https://api.triageai.dev";
    public static final String DEFAULT_ENVIRONMENT = "development";
    public static final String UNKNOWN_APP_NAME = "unknown";

    static final String OTLP_TRACES_PATH = "/v1/traces";

    private final Function<String, String> environment;

    public ConfigResolver() {
        this(System::getenv);
    }

    public ConfigResolver(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * Merges defaults, environment and {@code overrides} into one validated configuration.
     *
     * @throws ConfigurationException if no API key is set by any layer
     */
    public TriageConfig resolve(TriageOptions overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");

        String apiKey = firstNonEmpty(getenv(ENV_API_KEY), null);
        String endpoint = firstNonEmpty(getenv(ENV_ENDPOINT), DEFAULT_ENDPOINT);
        String appName = firstNonEmpty(getenv(ENV_APP_NAME), defaultAppName());
        String env = firstNonEmpty(getenv(ENV_ENVIRONMENT), DEFAULT_ENVIRONMENT);
        boolean enabled = envBoolean(ENV_ENABLED, true);
        boolean traceContent = envBoolean(ENV_TRACE_CONTENT, true);

        if (overrides.getApiKey() != null) {
            apiKey = overrides.getApiKey();
        }
        if (overrides.getEndpoint() != null) {
            endpoint = overrides.getEndpoint();
        }
        if (overrides.getAppName() != null) {
            appName = overrides.getAppName();
        }
        if (overrides.getEnvironment() != null) {
            env = overrides.getEnvironment();
        }
        if (overrides.getEnabled() != null) {
            enabled = overrides.getEnabled();
        }
        if (overrides.getTraceContent() != null) {
            traceContent = overrides.getTraceContent();
        }

        if (apiKey == null || apiKey.isEmpty()) {
            throw new ConfigurationException(String.format(
                    "API key is required. Set TriageOptions.apiKey or the %s environment variable", ENV_API_KEY));
        }

        return TriageConfig.builder()
                .apiKey(apiKey)
                .endpoint(endpoint)
                .appName(appName)
                .environment(env)
                .enabled(enabled)
                .traceContent(traceContent)
                .build();
    }

    private String getenv(String name) {
        return environment.apply(name);
    }

    // true, 1 and yes (any case) are true, every other non-empty value is false
    private boolean envBoolean(String name, boolean current) {
        String value = getenv(name);
        if (value == null || value.isEmpty()) {
            return current;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return true;
            default:
                return false;
        }
    }

    private static String firstNonEmpty(String value, String fallback) {
        return value != null && !value.isEmpty() ? value : fallback;
    }

    /**
     * The basename of the program invocation: the main class or jar the JVM was launched with.
     */
    static String defaultAppName() {
        String command = System.getProperty("sun.java.command");
        if (command == null || command.isBlank()) {
            return UNKNOWN_APP_NAME;
        }
        String program = command.trim().split("\\s+")[0];
        try {
            Path fileName = Paths.get(program).getFileName();
            return fileName != null ? fileName.toString() : UNKNOWN_APP_NAME;
        } catch (InvalidPathException e) {
            return program;
        }
    }
}

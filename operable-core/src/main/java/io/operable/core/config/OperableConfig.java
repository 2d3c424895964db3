package io.operable.core.config;

import io.operable.core.google.GoogleApiEndpoints;
import java.time.Duration;
import java.util.Map;

public record OperableConfig(
    String host,
    int port,
    Duration httpTimeout,
    Duration callTimeout,
    GoogleApiEndpoints endpoints,
    CredentialsConfig credentials
) {
    public static OperableConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static OperableConfig fromEnv(Map<String, String> env) {
        return new OperableConfig(
            env(env, "OPERABLE_MCP_HOST", "0.0.0.0"),
            intEnv(env, "OPERABLE_MCP_PORT", 8080),
            Duration.ofSeconds(intEnv(env, "OPERABLE_HTTP_TIMEOUT_SECONDS", 30)),
            Duration.ofSeconds(intEnv(env, "OPERABLE_CALL_TIMEOUT_SECONDS", 60)),
            new GoogleApiEndpoints(
                env(env, "OPERABLE_CONTAINER_BASE_URL", GoogleApiEndpoints.CONTAINER),
                env(env, "OPERABLE_LOGGING_BASE_URL", GoogleApiEndpoints.LOGGING),
                env(env, "OPERABLE_MONITORING_BASE_URL", GoogleApiEndpoints.MONITORING),
                env(env, "OPERABLE_ERROR_REPORTING_BASE_URL", GoogleApiEndpoints.ERROR_REPORTING)
            ),
            new CredentialsConfig(
                env(env, "GOOGLE_APPLICATION_CREDENTIALS", ""),
                env(env, "GOOGLE_CLIENT_ID", ""),
                env(env, "GOOGLE_CLIENT_SECRET", ""),
                env(env, "GOOGLE_REFRESH_TOKEN", ""),
                env(env, "OPERABLE_TOKEN_URL", CredentialsConfig.DEFAULT_TOKEN_URL)
            )
        );
    }

    public OperableConfig withListener(String newHost, int newPort) {
        return new OperableConfig(newHost, newPort, httpTimeout, callTimeout, endpoints, credentials);
    }

    private static String env(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intEnv(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}

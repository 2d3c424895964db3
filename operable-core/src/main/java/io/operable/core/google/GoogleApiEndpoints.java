package io.operable.core.google;

public record GoogleApiEndpoints(
    String container,
    String logging,
    String monitoring,
    String errorReporting
) {
    public static final String CONTAINER = "https://container.googleapis.com/v1";
    public static final String LOGGING = "https://logging.googleapis.com/v2";
    public static final String MONITORING = "https://monitoring.googleapis.com/v3";
    public static final String ERROR_REPORTING = "https://clouderrorreporting.googleapis.com/v1beta1";

    public static GoogleApiEndpoints defaults() {
        return new GoogleApiEndpoints(CONTAINER, LOGGING, MONITORING, ERROR_REPORTING);
    }

    // Points every API at one base URL, used against stub servers.
    public static GoogleApiEndpoints allAt(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return new GoogleApiEndpoints(base, base, base, base);
    }
}

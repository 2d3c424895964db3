package io.operable.core.config;

public record CredentialsConfig(
    String credentialsFile,
    String clientId,
    String clientSecret,
    String refreshToken,
    String tokenUrl
) {
    public static final String DEFAULT_TOKEN_URL = "https://oauth2.googleapis.com/token";

    public boolean hasCredentialsFile() {
        return credentialsFile != null && !credentialsFile.isBlank();
    }

    public boolean hasClientCredentials() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }
}

package io.operable.core.google.auth;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.auth.oauth2.UserCredentials;
import io.operable.core.config.CredentialsConfig;
import io.operable.core.google.TransportException;
import io.operable.core.google.TransportProvider;
import io.operable.core.tool.CancellationToken;
import io.operable.core.tool.ToolContext;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticated transport for Google Cloud APIs. Credentials are resolved once at startup through the Google auth
 * library, which also caches the access token. Each call waits for a token only as long as its own deadline and
 * cancellation allow; a refresh that is abandoned keeps running in the background and fills the cache.
 */
public final class GoogleAuthTransport implements TransportProvider {
    private static final Logger LOG = LoggerFactory.getLogger(GoogleAuthTransport.class);

    public static final List<String> READ_ONLY_SCOPES = List.of(
        "https://www.googleapis.com/auth/cloud-platform.read-only",
        "https://www.googleapis.com/auth/logging.read",
        "https://www.googleapis.com/auth/monitoring.read",
        "https://www.googleapis.com/auth/compute.readonly",
        "https://www.googleapis.com/auth/container.readonly"
    );

    private final GoogleCredentials credentials;
    private final OkHttpClient baseClient;
    private final String description;
    private final ExecutorService refresher = Executors.newCachedThreadPool(new RefreshThreadFactory());

    public GoogleAuthTransport(GoogleCredentials credentials, OkHttpClient baseClient, String description) {
        this.credentials = credentials;
        this.baseClient = baseClient;
        this.description = description;
    }

    /**
     * Resolves credentials from configuration.
     *
     * @throws IllegalStateException when no credential input is configured or the configured one is unusable
     */
    public static GoogleAuthTransport fromConfig(CredentialsConfig config, OkHttpClient baseClient) {
        if (config.hasCredentialsFile()) {
            return fromFile(Path.of(config.credentialsFile()), config.tokenUrl(), baseClient);
        }
        if (config.hasClientCredentials()) {
            if (config.refreshToken() == null || config.refreshToken().isBlank()) {
                throw new IllegalStateException(
                    "GOOGLE_REFRESH_TOKEN must be set when authenticating with GOOGLE_CLIENT_ID and GOOGLE_CLIENT_SECRET"
                );
            }
            UserCredentials user = UserCredentials.newBuilder()
                .setClientId(config.clientId())
                .setClientSecret(config.clientSecret())
                .setRefreshToken(config.refreshToken())
                .setTokenServerUri(URI.create(config.tokenUrl()))
                .build();
            return new GoogleAuthTransport(user, baseClient, "OAuth client " + config.clientId());
        }
        throw new IllegalStateException(
            "either GOOGLE_CLIENT_ID and GOOGLE_CLIENT_SECRET or GOOGLE_APPLICATION_CREDENTIALS environment variables must be set"
        );
    }

    private static GoogleAuthTransport fromFile(Path file, String tokenUrl, OkHttpClient baseClient) {
        GoogleCredentials loaded;
        try (InputStream in = Files.newInputStream(file)) {
            loaded = GoogleCredentials.fromStream(in);
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Cannot load credentials file " + file + ": " + e.getMessage(), e);
        }

        boolean customTokenUrl = !CredentialsConfig.DEFAULT_TOKEN_URL.equals(tokenUrl);
        if (loaded instanceof ServiceAccountCredentials) {
            ServiceAccountCredentials serviceAccount = (ServiceAccountCredentials) loaded;
            if (customTokenUrl) {
                serviceAccount = serviceAccount.toBuilder().setTokenServerUri(URI.create(tokenUrl)).build();
            }
            return new GoogleAuthTransport(
                serviceAccount.createScoped(READ_ONLY_SCOPES),
                baseClient,
                "service account " + serviceAccount.getClientEmail()
            );
        }
        if (loaded instanceof UserCredentials) {
            UserCredentials user = (UserCredentials) loaded;
            if (customTokenUrl) {
                user = user.toBuilder().setTokenServerUri(URI.create(tokenUrl)).build();
            }
            return new GoogleAuthTransport(user, baseClient, "authorized user from " + file);
        }
        return new GoogleAuthTransport(
            loaded.createScoped(READ_ONLY_SCOPES),
            baseClient,
            loaded.getClass().getSimpleName() + " from " + file
        );
    }

    public String description() {
        return description;
    }

    @Override
    public OkHttpClient client(ToolContext context) throws TransportException {
        String token = accessToken(context);
        return baseClient.newBuilder()
            .addInterceptor(chain -> chain.proceed(
                chain.request().newBuilder().header("Authorization", "Bearer " + token).build()
            ))
            .build();
    }

    String accessToken(ToolContext context) throws TransportException {
        if (context.isCancelled()) {
            throw new TransportException("Token request cancelled");
        }
        CompletableFuture<String> refresh = CompletableFuture.supplyAsync(this::refreshIfExpired, refresher);
        try (CancellationToken.Registration registration = context.cancellation().onCancel(() -> refresh.cancel(true))) {
            Optional<Duration> remaining = context.remaining();
            if (remaining.isPresent()) {
                return refresh.get(remaining.get().toMillis() + 1, TimeUnit.MILLISECONDS);
            }
            return refresh.get();
        } catch (CancellationException e) {
            throw new TransportException("Token request cancelled", e);
        } catch (TimeoutException e) {
            refresh.cancel(true);
            throw new TransportException("Token request timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for an access token", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof UncheckedIOException ? e.getCause().getCause() : e.getCause();
            throw new TransportException("Error getting authenticated client: " + cause.getMessage(), cause);
        }
    }

    private String refreshIfExpired() {
        try {
            credentials.refreshIfExpired();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        AccessToken token = credentials.getAccessToken();
        if (token == null) {
            throw new UncheckedIOException(new IOException("token endpoint returned no access token"));
        }
        LOG.debug("Access token for {} valid until {}", description, token.getExpirationTime());
        return token.getTokenValue();
    }

    private static final class RefreshThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "operable-token-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

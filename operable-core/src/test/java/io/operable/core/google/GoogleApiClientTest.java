package io.operable.core.google;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.google.model.ContainerModel.ClustersResponse;
import io.operable.core.tool.CancellationToken;
import io.operable.core.tool.ToolContext;
import io.operable.core.tool.ToolExecutionException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

class GoogleApiClientTest {

    @Test
    void decodesSuccessfulResponsesIgnoringUnknownFields() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{\"clusters\":[{\"name\":\"prod\",\"autopilot\":{}}]}"));
            server.start();
            GoogleApiClient api = client(server);

            HttpUrl url = api.url(api.endpoints().container(), "projects", "demo", "locations", "-", "clusters").build();
            ClustersResponse response = api.get(ToolContext.background(), "Container API", url, ClustersResponse.class);

            assertThat(response.clusters()).extracting(c -> c.name()).containsExactly("prod");
            assertThat(server.takeRequest().getPath()).isEqualTo("/projects/demo/locations/-/clusters");
        }
    }

    @Test
    void pathSegmentsAreEncodedIndividually() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{}"));
            server.start();
            GoogleApiClient api = client(server);

            HttpUrl url = api.url(api.endpoints().container(), "projects", "demo/../other").build();
            api.get(ToolContext.background(), "Container API", url, ClustersResponse.class);

            assertThat(server.takeRequest().getPath()).isEqualTo("/projects/demo%2F..%2Fother");
        }
    }

    @Test
    void postsJsonBody() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody(""));
            server.start();
            GoogleApiClient api = client(server);

            HttpUrl url = api.url(api.endpoints().logging(), "entries:list").build();
            api.post(ToolContext.background(), "Logging API", url, Map.of("filter", "severity>=ERROR"), ClustersResponse.class);

            RecordedRequest request = server.takeRequest();
            assertThat(request.getMethod()).isEqualTo("POST");
            assertThat(request.getPath()).isEqualTo("/entries:list");
            assertThat(request.getBody().readUtf8()).isEqualTo("{\"filter\":\"severity>=ERROR\"}");
        }
    }

    @Test
    void nonSuccessStatusCarriesStatusCode() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(404).setStatus("HTTP/1.1 404 Not Found"));
            server.start();
            GoogleApiClient api = client(server);

            HttpUrl url = api.url(api.endpoints().container(), "projects", "demo").build();

            assertThatThrownBy(() -> api.get(ToolContext.background(), "Container API", url, ClustersResponse.class))
                .isInstanceOf(RemoteApiException.class)
                .hasMessage("Error from Container API: 404 Not Found")
                .satisfies(e -> assertThat(((RemoteApiException) e).statusCode()).isEqualTo(404));
        }
    }

    @Test
    void undecodablePayloadIsReported() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("<html>"));
            server.start();
            GoogleApiClient api = client(server);

            HttpUrl url = api.url(api.endpoints().container(), "projects", "demo").build();

            assertThatThrownBy(() -> api.get(ToolContext.background(), "Container API", url, ClustersResponse.class))
                .isInstanceOf(RemoteApiException.class)
                .hasMessageStartingWith("Error parsing response from Container API");
        }
    }

    @Test
    void cancellationAbortsInFlightRequest() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{}").setHeadersDelay(5, TimeUnit.SECONDS));
            server.start();
            GoogleApiClient api = client(server);
            CancellationToken token = new CancellationToken();
            ToolContext context = ToolContext.withTimeout(token, Duration.ofSeconds(30));

            Thread canceller = new Thread(() -> {
                try {
                    Thread.sleep(200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                token.cancel();
            });
            canceller.start();

            HttpUrl url = api.url(api.endpoints().container(), "projects", "demo").build();
            assertThatThrownBy(() -> api.get(context, "Container API", url, ClustersResponse.class))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Request to Container API was cancelled");
            canceller.join();
        }
    }

    @Test
    void expiredDeadlineAbortsInFlightRequest() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{}").setHeadersDelay(3, TimeUnit.SECONDS));
            server.start();
            GoogleApiClient api = client(server);
            ToolContext context = ToolContext.withTimeout(new CancellationToken(), Duration.ofMillis(300));
            HttpUrl url = api.url(api.endpoints().container(), "projects", "demo").build();

            long started = System.nanoTime();
            assertThatThrownBy(() -> api.get(context, "Container API", url, ClustersResponse.class))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Request to Container API timed out");

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(1500));
        }
    }

    @Test
    void transportFailureSurfacesWithoutRequest() {
        GoogleApiClient api = new GoogleApiClient(
            context -> {
                throw new TransportException("Error getting authenticated client: token endpoint returned 401");
            },
            new ObjectMapper(),
            GoogleApiEndpoints.defaults()
        );
        HttpUrl url = api.url(api.endpoints().container(), "projects", "demo").build();

        assertThatThrownBy(() -> api.get(ToolContext.background(), "Container API", url, ClustersResponse.class))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("401");
    }

    static GoogleApiClient client(MockWebServer server) {
        return new GoogleApiClient(context -> new OkHttpClient(), new ObjectMapper(), GoogleApiEndpoints.allAt(server.url("/").toString()));
    }
}

package io.operable.core.google;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.tool.CancellationToken;
import io.operable.core.tool.ToolContext;
import io.operable.core.tool.ToolExecutionException;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Performs single JSON round trips against Google Cloud REST APIs through the authenticated transport. No retries:
 * a failed request surfaces immediately as a {@link ToolExecutionException}.
 */
public final class GoogleApiClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final TransportProvider transports;
    private final ObjectMapper mapper;
    private final GoogleApiEndpoints endpoints;

    public GoogleApiClient(TransportProvider transports, ObjectMapper mapper, GoogleApiEndpoints endpoints) {
        this.transports = transports;
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.endpoints = endpoints;
    }

    public GoogleApiEndpoints endpoints() {
        return endpoints;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    // Each segment is percent-encoded on its own, so caller-supplied ids cannot add path levels.
    public HttpUrl.Builder url(String baseUrl, String... segments) {
        HttpUrl.Builder builder = HttpUrl.get(baseUrl).newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    public <T> T get(ToolContext context, String apiName, HttpUrl url, Class<T> type) throws ToolExecutionException {
        Request request = new Request.Builder().url(url).get().build();
        return execute(context, apiName, request, type);
    }

    public <T> T post(ToolContext context, String apiName, HttpUrl url, Object body, Class<T> type)
        throws ToolExecutionException {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException("Error marshaling request body for " + apiName + ": " + e.getOriginalMessage(), e);
        }
        Request request = new Request.Builder()
            .url(url)
            .post(RequestBody.create(json, JSON))
            .header("Content-Type", "application/json")
            .build();
        return execute(context, apiName, request, type);
    }

    private <T> T execute(ToolContext context, String apiName, Request request, Class<T> type)
        throws ToolExecutionException {
        OkHttpClient client = transports.client(context);
        Call call = client.newCall(request);
        context.remaining().ifPresent(remaining ->
            call.timeout().timeout(Math.max(1, remaining.toMillis()), TimeUnit.MILLISECONDS)
        );

        try (CancellationToken.Registration registration = context.cancellation().onCancel(call::cancel);
             Response response = call.execute()) {
            if (!response.isSuccessful()) {
                throw new RemoteApiException("Error from " + apiName + ": " + status(response), response.code());
            }
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            try {
                return mapper.readValue(raw.isBlank() ? "{}" : raw, type);
            } catch (JsonProcessingException e) {
                throw new RemoteApiException("Error parsing response from " + apiName + ": " + e.getOriginalMessage(), e);
            }
        } catch (IOException e) {
            if (context.isCancelled()) {
                throw new ToolExecutionException("Request to " + apiName + " was cancelled", e);
            }
            if (context.isExpired()) {
                throw new ToolExecutionException("Request to " + apiName + " timed out", e);
            }
            throw new RemoteApiException("Error making request to " + apiName + ": " + e.getMessage(), e);
        }
    }

    private String status(Response response) {
        return (response.code() + " " + response.message()).trim();
    }
}

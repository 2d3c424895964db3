package io.operable.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class McpHttpServerTest {
    private static final MediaType JSON = MediaType.get("application/json");

    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient client = new OkHttpClient();
    private McpHttpServer server;

    @BeforeEach
    void setUp() {
        server = new McpHttpServer("127.0.0.1", 0, TestTools.protocol(mapper), mapper);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void healthAndToolListing() throws Exception {
        try (Response health = client.newCall(get("/healthz")).execute()) {
            assertThat(health.code()).isEqualTo(200);
            assertThat(mapper.readTree(health.body().string()).path("status").asText()).isEqualTo("ok");
        }
        try (Response tools = client.newCall(get("/mcp/tools")).execute()) {
            JsonNode body = mapper.readTree(tools.body().string());
            assertThat(body.path("tools")).hasSize(2);
            assertThat(body.at("/tools/0/name").asText()).isEqualTo("echo");
        }
    }

    @Test
    void jsonRpcOverPost() throws Exception {
        try (Response response = client.newCall(post("/mcp",
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\",\"params\":{\"name\":\"echo\",\"arguments\":{\"text\":\"hi\"}}}"))
            .execute()) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(mapper.readTree(response.body().string()).at("/result/content/0/text").asText()).isEqualTo("hi");
        }
        try (Response notification = client.newCall(post("/mcp",
            "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}")).execute()) {
            assertThat(notification.code()).isEqualTo(202);
        }
    }

    @Test
    void directCall() throws Exception {
        try (Response ok = client.newCall(post("/mcp/call", "{\"name\":\"echo\",\"arguments\":{\"text\":\"yo\"}}")).execute()) {
            JsonNode body = mapper.readTree(ok.body().string());
            assertThat(ok.code()).isEqualTo(200);
            assertThat(body.path("isError").asBoolean()).isFalse();
            assertThat(body.at("/content/0/text").asText()).isEqualTo("yo");
        }
        try (Response invalid = client.newCall(post("/mcp/call", "{\"name\":\"echo\",\"arguments\":{}}")).execute()) {
            assertThat(invalid.code()).isEqualTo(200);
            assertThat(mapper.readTree(invalid.body().string()).path("isError").asBoolean()).isTrue();
        }
    }

    @Test
    void directCallRejections() throws Exception {
        try (Response unknown = client.newCall(post("/mcp/call", "{\"name\":\"nope\"}")).execute()) {
            assertThat(unknown.code()).isEqualTo(404);
            assertThat(mapper.readTree(unknown.body().string()).path("error").asText()).isEqualTo("Unknown tool: nope");
        }
        try (Response missing = client.newCall(post("/mcp/call", "{}")).execute()) {
            assertThat(missing.code()).isEqualTo(400);
        }
        try (Response garbage = client.newCall(post("/mcp/call", "{oops")).execute()) {
            assertThat(garbage.code()).isEqualTo(400);
        }
        try (Response notFound = client.newCall(get("/nowhere")).execute()) {
            assertThat(notFound.code()).isEqualTo(404);
        }
    }

    private Request get(String path) {
        return new Request.Builder().url("http://127.0.0.1:" + server.port() + path).get().build();
    }

    private Request post(String path, String body) {
        return new Request.Builder().url("http://127.0.0.1:" + server.port() + path).post(RequestBody.create(body, JSON)).build();
    }
}

package io.operable.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class StdioMcpServerTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final StdioMcpServer server =
        new StdioMcpServer(TestTools.protocol(mapper), mapper, 4, Duration.ofSeconds(10));

    @Test
    void answersEachRequestOnItsOwnLine() throws Exception {
        List<JsonNode> replies = run(String.join("\n",
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}",
            "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
            "",
            "not json",
            "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"echo\",\"arguments\":{\"text\":\"hi\"}}}"
        ) + "\n");

        assertThat(replies).hasSize(3);
        assertThat(replies).anySatisfy(reply -> assertThat(reply.at("/result/serverInfo/name").asText()).isEqualTo("operable"));
        assertThat(replies).anySatisfy(reply -> assertThat(reply.at("/error/code").asInt()).isEqualTo(JsonRpc.PARSE_ERROR));
        assertThat(replies).anySatisfy(reply -> assertThat(reply.at("/result/content/0/text").asText()).isEqualTo("hi"));
    }

    @Test
    void slowCallDoesNotBlockLaterRequests() throws Exception {
        PipedOutputStream input = new PipedOutputStream();
        PipedInputStream serverIn = new PipedInputStream(input);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        CompletableFuture<Void> serving = CompletableFuture.runAsync(() -> serve(serverIn, output));

        input.write(line("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\",\"params\":{\"name\":\"block\"}}"));
        input.write(line("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"echo\",\"arguments\":{\"text\":\"fast\"}}}"));
        input.flush();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!output.toString(StandardCharsets.UTF_8).contains("fast") && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(output.toString(StandardCharsets.UTF_8)).contains("\"fast\"").doesNotContain("late reply");
        assertThat(server.inFlightCount()).isEqualTo(1);

        input.write(line("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/cancelled\",\"params\":{\"requestId\":1,\"reason\":\"user\"}}"));
        input.close();
        serving.get(5, TimeUnit.SECONDS);

        assertThat(output.toString(StandardCharsets.UTF_8)).doesNotContain("late reply");
        assertThat(server.inFlightCount()).isZero();
    }

    @Test
    void cancellingUnknownRequestIsIgnored() throws Exception {
        List<JsonNode> replies = run(
            "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/cancelled\",\"params\":{\"requestId\":99}}\n"
                + "{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"ping\"}\n");

        assertThat(replies).hasSize(1);
        assertThat(replies.get(0).path("id").asText()).isEqualTo("p");
    }

    private List<JsonNode> run(String input) throws Exception {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        server.serve(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), output);
        List<JsonNode> replies = new ArrayList<>();
        for (String line : output.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) {
                replies.add(mapper.readTree(line));
            }
        }
        return replies;
    }

    private void serve(PipedInputStream in, ByteArrayOutputStream out) {
        try {
            server.serve(in, out);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static byte[] line(String json) {
        return (json + "\n").getBytes(StandardCharsets.UTF_8);
    }
}

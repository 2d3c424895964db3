package io.operable.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.tool.CallResult;
import io.operable.core.tool.CancellationToken;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpHttpServer {
    private static final Logger LOG = LoggerFactory.getLogger(McpHttpServer.class);

    private final Undertow undertow;
    private final McpProtocolHandler protocol;
    private final ObjectMapper mapper;

    public McpHttpServer(String host, int port, McpProtocolHandler protocol, ObjectMapper mapper) {
        this.protocol = protocol;
        this.mapper = mapper;
        this.undertow = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(new BlockingHandler(this::route))
            .build();
    }

    public void start() {
        undertow.start();
        LOG.info("MCP HTTP server listening on port {}", port());
    }

    public void stop() {
        undertow.stop();
    }

    // Actual bound port; differs from the configured one when that was 0.
    public int port() {
        return ((InetSocketAddress) undertow.getListenerInfo().get(0).getAddress()).getPort();
    }

    private void route(HttpServerExchange exchange) throws IOException {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();

        if (method.equals("GET") && path.equals("/healthz")) {
            writeJson(exchange, StatusCodes.OK, Map.of("status", "ok"));
            return;
        }

        if (method.equals("GET") && path.equals("/mcp/tools")) {
            writeJson(exchange, StatusCodes.OK, Map.of("tools", protocol.toolsJson()));
            return;
        }

        if (method.equals("POST") && path.equals("/mcp")) {
            Optional<String> response = protocol.handleText(readBody(exchange));
            if (response.isPresent()) {
                exchange.getResponseSender().send(response.get());
            } else {
                exchange.setStatusCode(StatusCodes.ACCEPTED);
                exchange.endExchange();
            }
            return;
        }

        if (method.equals("POST") && path.equals("/mcp/call")) {
            directCall(exchange);
            return;
        }

        writeJson(exchange, StatusCodes.NOT_FOUND, Map.of("error", "Not found"));
    }

    private void directCall(HttpServerExchange exchange) throws IOException {
        JsonNode request;
        try {
            request = mapper.readTree(readBody(exchange));
        } catch (JsonProcessingException e) {
            writeJson(exchange, StatusCodes.BAD_REQUEST, Map.of("error", "Invalid JSON: " + e.getOriginalMessage()));
            return;
        }
        String name = request == null ? "" : request.path("name").asText("");
        if (name.isBlank()) {
            writeJson(exchange, StatusCodes.BAD_REQUEST, Map.of("error", "Missing tool name"));
            return;
        }
        if (!protocol.hasTool(name)) {
            writeJson(exchange, StatusCodes.NOT_FOUND, Map.of("error", "Unknown tool: " + name));
            return;
        }
        JsonNode arguments = request.get("arguments");
        if (arguments != null && !arguments.isNull() && !arguments.isObject()) {
            writeJson(exchange, StatusCodes.BAD_REQUEST, Map.of("error", "Tool arguments must be an object"));
            return;
        }
        CallResult result = protocol.call(name, arguments, new CancellationToken());
        writeJson(exchange, StatusCodes.OK, protocol.callResultJson(result));
    }

    private String readBody(HttpServerExchange exchange) throws IOException {
        try (InputStream in = exchange.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void writeJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        exchange.setStatusCode(status);
        exchange.getResponseSender().send(mapper.writeValueAsString(payload));
    }
}

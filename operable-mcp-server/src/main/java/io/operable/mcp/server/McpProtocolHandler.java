package io.operable.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.operable.core.tool.ArgumentValue;
import io.operable.core.tool.CallResult;
import io.operable.core.tool.CancellationToken;
import io.operable.core.tool.ContentBlock;
import io.operable.core.tool.ToolContext;
import io.operable.core.tool.ToolDefinition;
import io.operable.core.tool.ToolDispatcher;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps MCP JSON-RPC messages onto the {@link ToolDispatcher}. Transport-agnostic: the stdio and HTTP servers both
 * feed decoded messages through {@link #handle(JsonNode, CancellationToken)}.
 */
public final class McpProtocolHandler {
    private static final Logger LOG = LoggerFactory.getLogger(McpProtocolHandler.class);
    static final String PROTOCOL_VERSION = "2024-11-05";
    static final Set<String> SUPPORTED_PROTOCOL_VERSIONS = Set.of(PROTOCOL_VERSION, "2025-03-26");

    private final ToolDispatcher dispatcher;
    private final ObjectMapper mapper;
    private final JsonRpc rpc;
    private final String serverName;
    private final String serverVersion;
    private final Duration callTimeout;

    public McpProtocolHandler(
        ToolDispatcher dispatcher,
        ObjectMapper mapper,
        String serverName,
        String serverVersion,
        Duration callTimeout
    ) {
        this.dispatcher = dispatcher;
        this.mapper = mapper;
        this.rpc = new JsonRpc(mapper);
        this.serverName = serverName;
        this.serverVersion = serverVersion;
        this.callTimeout = callTimeout;
    }

    public JsonRpc rpc() {
        return rpc;
    }

    // Empty when the input is a notification or a response, which get no reply.
    public Optional<String> handleText(String raw) {
        JsonNode message;
        try {
            message = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            LOG.debug("Unparseable message: {}", e.getOriginalMessage());
            return Optional.of(rpc.error(null, JsonRpc.PARSE_ERROR, "Parse error: " + e.getOriginalMessage()).toString());
        }
        return handle(message, new CancellationToken()).map(JsonNode::toString);
    }

    public Optional<JsonNode> handle(JsonNode message, CancellationToken cancellation) {
        if (message == null || !message.isObject()) {
            return Optional.of(rpc.error(null, JsonRpc.INVALID_REQUEST, "Invalid request"));
        }
        JsonNode id = message.get("id");
        JsonNode methodNode = message.get("method");
        if (methodNode == null || !methodNode.isTextual()) {
            if (message.has("result") || message.has("error")) {
                return Optional.empty();
            }
            return Optional.of(rpc.error(id, JsonRpc.INVALID_REQUEST, "Invalid request: missing method"));
        }
        String method = methodNode.asText();
        JsonNode params = message.path("params");

        if (id == null || id.isNull()) {
            LOG.debug("Notification {}", method);
            return Optional.empty();
        }

        try {
            return Optional.of(switch (method) {
                case "initialize" -> rpc.response(id, initializeResult(params));
                case "ping" -> rpc.response(id, mapper.createObjectNode());
                case "tools/list" -> rpc.response(id, toolsListResult());
                case "tools/call" -> callTool(id, params, cancellation);
                default -> rpc.error(id, JsonRpc.METHOD_NOT_FOUND, "Method not found: " + method);
            });
        } catch (RuntimeException e) {
            LOG.error("Failed to handle {}", method, e);
            return Optional.of(rpc.error(id, JsonRpc.INTERNAL_ERROR, "Internal error: " + e.getMessage()));
        }
    }

    public boolean hasTool(String name) {
        return dispatcher.registry().lookup(name).isPresent();
    }

    // Runs one call under the configured deadline. Argument conversion failures become an error result.
    public CallResult call(String name, JsonNode arguments, CancellationToken cancellation) {
        Map<String, ArgumentValue> values;
        try {
            Map<String, Object> raw = arguments == null || arguments.isNull()
                ? Map.of()
                : mapper.convertValue(arguments, new TypeReference<Map<String, Object>>() {
                });
            values = ArgumentValue.fromJson(raw);
        } catch (IllegalArgumentException e) {
            return CallResult.error(e.getMessage());
        }
        return dispatcher.invoke(name, values, ToolContext.withTimeout(cancellation, callTimeout));
    }

    public ArrayNode toolsJson() {
        ArrayNode tools = mapper.createArrayNode();
        for (ToolDefinition definition : dispatcher.registry().all()) {
            ObjectNode tool = tools.addObject();
            tool.put("name", definition.name());
            tool.put("description", definition.description());
            tool.set("inputSchema", mapper.valueToTree(definition.inputSchema()));
        }
        return tools;
    }

    public ObjectNode callResultJson(CallResult result) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode content = node.putArray("content");
        for (ContentBlock block : result.content()) {
            content.addObject().put("type", block.type()).put("text", block.text());
        }
        node.put("isError", result.isError());
        return node;
    }

    private ObjectNode callTool(JsonNode id, JsonNode params, CancellationToken cancellation) {
        JsonNode nameNode = params.get("name");
        if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
            return rpc.error(id, JsonRpc.INVALID_PARAMS, "Missing tool name");
        }
        String name = nameNode.asText();
        if (!hasTool(name)) {
            return rpc.error(id, JsonRpc.INVALID_PARAMS, "Unknown tool: " + name);
        }
        JsonNode arguments = params.get("arguments");
        if (arguments != null && !arguments.isNull() && !arguments.isObject()) {
            return rpc.error(id, JsonRpc.INVALID_PARAMS, "Tool arguments must be an object");
        }
        return rpc.response(id, callResultJson(call(name, arguments, cancellation)));
    }

    private ObjectNode initializeResult(JsonNode params) {
        ObjectNode result = mapper.createObjectNode();
        // Echo the client's version when it is one we speak, otherwise offer ours.
        String requested = params.path("protocolVersion").asText("");
        result.put("protocolVersion", SUPPORTED_PROTOCOL_VERSIONS.contains(requested) ? requested : PROTOCOL_VERSION);
        result.putObject("capabilities").putObject("tools").put("listChanged", false);
        result.putObject("serverInfo").put("name", serverName).put("version", serverVersion);
        return result;
    }

    private ObjectNode toolsListResult() {
        ObjectNode result = mapper.createObjectNode();
        result.set("tools", toolsJson());
        return result;
    }
}

package io.operable.mcp.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON-RPC 2.0 envelopes. Request ids are echoed back as the exact JSON node received, so numeric and string ids
 * both round-trip.
 */
public final class JsonRpc {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    private final ObjectMapper mapper;

    public JsonRpc(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode response(JsonNode id, JsonNode result) {
        ObjectNode root = envelope(id);
        root.set("result", result);
        return root;
    }

    public ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode root = envelope(id);
        ObjectNode error = root.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return root;
    }

    private ObjectNode envelope(JsonNode id) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.set("id", id == null ? NullNode.getInstance() : id);
        return root;
    }
}

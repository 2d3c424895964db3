package io.operable.core.tool;

import java.util.Map;
import java.util.Objects;

public record ToolDefinition(
    String name,
    String description,
    ParameterSchema schema,
    ToolHandler handler
) {
    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        description = description == null ? "" : description;
    }

    public Map<String, Object> inputSchema() {
        return schema.toJsonSchema();
    }
}

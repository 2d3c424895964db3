package io.operable.core.tool;

import java.util.Map;
import java.util.Set;

public final class ToolArguments {
    private final Map<String, ArgumentValue> values;
    private final Set<String> supplied;

    ToolArguments(Map<String, ArgumentValue> values, Set<String> supplied) {
        this.values = Map.copyOf(values);
        this.supplied = Set.copyOf(supplied);
    }

    public String string(String name) {
        return require(name, ArgumentValue.StringValue.class).value();
    }

    public double number(String name) {
        return require(name, ArgumentValue.NumberValue.class).value();
    }

    public int integer(String name) {
        return (int) number(name);
    }

    public boolean bool(String name) {
        return require(name, ArgumentValue.BooleanValue.class).value();
    }

    // True when the caller supplied a usable value rather than relying on the default.
    public boolean has(String name) {
        return supplied.contains(name);
    }

    private <T extends ArgumentValue> T require(String name, Class<T> type) {
        ArgumentValue value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Argument '" + name + "' is not declared in the tool schema");
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Argument '" + name + "' is a " + value.kind().jsonType());
        }
        return type.cast(value);
    }

    @Override
    public String toString() {
        return "ToolArguments" + values;
    }
}

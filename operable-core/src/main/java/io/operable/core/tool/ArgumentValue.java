package io.operable.core.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single tool argument as supplied by the caller: a string, a 64-bit floating point number or a boolean.
 * Integer and decimal literals both become {@link NumberValue}.
 */
public interface ArgumentValue {

    ParameterKind kind();

    static ArgumentValue of(String value) {
        return new StringValue(value);
    }

    static ArgumentValue of(double value) {
        return new NumberValue(value);
    }

    static ArgumentValue of(boolean value) {
        return new BooleanValue(value);
    }

    static ArgumentValue fromJson(String name, Object raw) {
        if (raw instanceof String text) {
            return of(text);
        }
        if (raw instanceof Number number) {
            return of(number.doubleValue());
        }
        if (raw instanceof Boolean flag) {
            return of(flag.booleanValue());
        }
        String type = raw instanceof Map<?, ?> ? "object" : raw instanceof List<?> ? "array" : raw.getClass().getSimpleName();
        throw new IllegalArgumentException(name + " has unsupported value type " + type);
    }

    /**
     * Converts a decoded JSON argument object. Null values are treated as absent.
     *
     * @throws IllegalArgumentException naming the first argument that is not a string, number or boolean
     */
    static Map<String, ArgumentValue> fromJson(Map<String, Object> raw) {
        Map<String, ArgumentValue> values = new LinkedHashMap<>();
        if (raw == null) {
            return values;
        }
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (entry.getValue() != null) {
                values.put(entry.getKey(), fromJson(entry.getKey(), entry.getValue()));
            }
        }
        return values;
    }

    record StringValue(String value) implements ArgumentValue {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public ParameterKind kind() {
            return ParameterKind.STRING;
        }
    }

    record NumberValue(double value) implements ArgumentValue {
        @Override
        public ParameterKind kind() {
            return ParameterKind.NUMBER;
        }
    }

    record BooleanValue(boolean value) implements ArgumentValue {
        @Override
        public ParameterKind kind() {
            return ParameterKind.BOOLEAN;
        }
    }
}

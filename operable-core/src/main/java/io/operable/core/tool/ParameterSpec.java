package io.operable.core.tool;

import java.util.Objects;

public record ParameterSpec(
    String name,
    ParameterKind kind,
    boolean required,
    String description,
    ArgumentValue defaultValue
) {
    public ParameterSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        description = description == null ? "" : description;
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("Required parameter " + name + " cannot declare a default");
        }
        if (defaultValue != null && defaultValue.kind() != kind) {
            throw new IllegalArgumentException("Default for " + name + " must be a " + kind.jsonType());
        }
    }

    public static ParameterSpec requiredString(String name, String description) {
        return new ParameterSpec(name, ParameterKind.STRING, true, description, null);
    }

    public static ParameterSpec optionalString(String name, String description) {
        return new ParameterSpec(name, ParameterKind.STRING, false, description, ArgumentValue.of(""));
    }

    public static ParameterSpec optionalNumber(String name, String description, double defaultValue) {
        return new ParameterSpec(name, ParameterKind.NUMBER, false, description, ArgumentValue.of(defaultValue));
    }

    public static ParameterSpec optionalBoolean(String name, String description, boolean defaultValue) {
        return new ParameterSpec(name, ParameterKind.BOOLEAN, false, description, ArgumentValue.of(defaultValue));
    }
}

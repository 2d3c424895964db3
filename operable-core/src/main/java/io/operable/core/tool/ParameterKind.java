package io.operable.core.tool;

public enum ParameterKind {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean");

    private final String jsonType;

    ParameterKind(String jsonType) {
        this.jsonType = jsonType;
    }

    public String jsonType() {
        return jsonType;
    }
}

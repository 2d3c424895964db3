package io.operable.core.tool;

public final class ArgumentValidationException extends Exception {
    private final String field;

    public ArgumentValidationException(String field, String reason) {
        super(field + " " + reason);
        this.field = field;
    }

    public String field() {
        return field;
    }
}

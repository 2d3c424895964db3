package io.operable.core.tool;

public final class ToolRegistrationException extends RuntimeException {

    public ToolRegistrationException(String message) {
        super(message);
    }

    public ToolRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.operable.core.google;

import io.operable.core.tool.ToolExecutionException;

public final class RemoteApiException extends ToolExecutionException {
    private final int statusCode;

    public RemoteApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    // -1 when no HTTP response was received.
    public int statusCode() {
        return statusCode;
    }
}

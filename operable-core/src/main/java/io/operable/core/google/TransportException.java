package io.operable.core.google;

import io.operable.core.tool.ToolExecutionException;

// The authenticated transport could not be produced, e.g. the token exchange failed.
public final class TransportException extends ToolExecutionException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.operable.core.google;

import io.operable.core.tool.ToolContext;
import okhttp3.OkHttpClient;

@FunctionalInterface
public interface TransportProvider {
    OkHttpClient client(ToolContext context) throws TransportException;
}

package io.operable.cli;

import io.operable.core.config.OperableConfig;

@FunctionalInterface
public interface ServerRunner {
    // Blocks until the server stops; returns the process exit code.
    int run(ServeMode mode, OperableConfig config) throws Exception;
}

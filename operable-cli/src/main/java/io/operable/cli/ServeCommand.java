package io.operable.cli;

import io.operable.core.config.OperableConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Serve the diagnostic tools over MCP (stdio or HTTP)")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--mode"}, description = "Transport: ${COMPLETION-CANDIDATES}", defaultValue = "STDIO")
    ServeMode mode;

    @Option(names = {"--host"}, description = "HTTP listen host (overrides OPERABLE_MCP_HOST)")
    String host;

    @Option(names = {"--port"}, description = "HTTP listen port (overrides OPERABLE_MCP_PORT)")
    Integer port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OperableConfig config = context.config().withListener(
            host == null || host.isBlank() ? context.config().host() : host,
            port == null ? context.config().port() : port
        );
        try {
            return context.serverRunner().run(mode, config);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            context.err().println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}

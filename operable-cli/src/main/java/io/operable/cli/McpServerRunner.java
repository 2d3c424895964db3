package io.operable.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.config.OperableConfig;
import io.operable.core.tool.ToolDispatcher;
import io.operable.mcp.server.McpHttpServer;
import io.operable.mcp.server.McpProtocolHandler;
import io.operable.mcp.server.StdioMcpServer;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class McpServerRunner implements ServerRunner {
    private static final Logger LOG = LoggerFactory.getLogger(McpServerRunner.class);
    private static final int STDIO_WORKERS = 8;

    private final ToolDispatcher dispatcher;
    private final ObjectMapper mapper;

    McpServerRunner(ToolDispatcher dispatcher, ObjectMapper mapper) {
        this.dispatcher = dispatcher;
        this.mapper = mapper;
    }

    @Override
    public int run(ServeMode mode, OperableConfig config) throws Exception {
        McpProtocolHandler protocol = new McpProtocolHandler(
            dispatcher, mapper, OperableApplication.NAME, OperableApplication.VERSION, config.callTimeout()
        );
        switch (mode) {
            case STDIO -> {
                LOG.info("Serving {} tools over stdio", dispatcher.registry().size());
                new StdioMcpServer(protocol, mapper, STDIO_WORKERS, config.callTimeout()).serve(System.in, System.out);
                LOG.info("stdio input closed, shutting down");
            }
            case HTTP -> {
                McpHttpServer server = new McpHttpServer(config.host(), config.port(), protocol, mapper);
                CountDownLatch shutdown = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    server.stop();
                    shutdown.countDown();
                }));
                server.start();
                shutdown.await();
            }
        }
        return 0;
    }
}

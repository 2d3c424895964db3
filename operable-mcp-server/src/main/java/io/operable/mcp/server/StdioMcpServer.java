package io.operable.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.tool.CancellationToken;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Newline-delimited JSON-RPC over a pair of streams. Tool calls run on a worker pool so a slow call never blocks the
 * reader; {@code notifications/cancelled} cancels the matching in-flight call, whose reply is then dropped.
 */
public final class StdioMcpServer {
    private static final Logger LOG = LoggerFactory.getLogger(StdioMcpServer.class);

    private final McpProtocolHandler protocol;
    private final ObjectMapper mapper;
    private final int workerThreads;
    private final Duration drainTimeout;
    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    public StdioMcpServer(McpProtocolHandler protocol, ObjectMapper mapper, int workerThreads, Duration drainTimeout) {
        this.protocol = protocol;
        this.mapper = mapper;
        this.workerThreads = workerThreads;
        this.drainTimeout = drainTimeout;
    }

    // Returns once the input is exhausted and in-flight calls have finished or the drain timeout elapsed.
    public void serve(InputStream in, OutputStream out) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        ExecutorService workers = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    accept(line, writer, workers);
                }
            }
            LOG.info("Input closed, waiting for {} in-flight calls", inFlight.size());
        } finally {
            workers.shutdown();
            awaitDrain(workers);
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private void accept(String line, Writer writer, ExecutorService workers) {
        JsonNode message;
        try {
            message = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            LOG.debug("Unparseable line: {}", e.getOriginalMessage());
            write(writer, protocol.rpc().error(null, JsonRpc.PARSE_ERROR, "Parse error: " + e.getOriginalMessage()));
            return;
        }

        String method = message.path("method").asText("");
        JsonNode id = message.get("id");
        if ("notifications/cancelled".equals(method)) {
            cancel(message.path("params").get("requestId"), message.path("params").path("reason").asText(""));
            return;
        }
        if (!"tools/call".equals(method) || id == null || id.isNull()) {
            protocol.handle(message, new CancellationToken()).ifPresent(response -> write(writer, response));
            return;
        }

        String key = id.toString();
        CancellationToken token = new CancellationToken();
        inFlight.put(key, token);
        workers.execute(() -> {
            try {
                Optional<JsonNode> response = protocol.handle(message, token);
                if (token.isCancelled()) {
                    LOG.debug("Dropping response for cancelled request {}", key);
                } else {
                    response.ifPresent(node -> write(writer, node));
                }
            } finally {
                inFlight.remove(key, token);
            }
        });
    }

    private void cancel(JsonNode requestId, String reason) {
        if (requestId == null || requestId.isNull()) {
            return;
        }
        CancellationToken token = inFlight.get(requestId.toString());
        if (token == null) {
            LOG.debug("Cancellation for unknown or finished request {}", requestId);
            return;
        }
        LOG.info("Cancelling request {} {}", requestId, reason);
        token.cancel();
    }

    private void write(Writer writer, JsonNode message) {
        synchronized (writer) {
            try {
                writer.write(message.toString());
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                LOG.error("Failed to write response: {}", e.getMessage());
            }
        }
    }

    private void awaitDrain(ExecutorService workers) {
        try {
            if (!workers.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Cancelling {} calls still running after {}", inFlight.size(), drainTimeout);
                inFlight.values().forEach(CancellationToken::cancel);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "operable-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

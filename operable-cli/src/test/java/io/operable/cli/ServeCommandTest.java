package io.operable.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.config.OperableConfig;
import io.operable.core.tool.ToolDispatcher;
import io.operable.core.tool.ToolRegistry;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ServeCommandTest {
    private final AtomicReference<ServeMode> servedMode = new AtomicReference<>();
    private final AtomicReference<OperableConfig> servedConfig = new AtomicReference<>();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void defaultsToStdioWithEnvironmentListener() {
        int exitCode = commandLine((mode, config) -> record(mode, config)).execute("serve");

        assertThat(exitCode).isZero();
        assertThat(servedMode).hasValue(ServeMode.STDIO);
        assertThat(servedConfig.get().host()).isEqualTo("127.0.0.2");
        assertThat(servedConfig.get().port()).isEqualTo(9090);
    }

    @Test
    void flagsOverrideListenerAndModeIsCaseInsensitive() {
        int exitCode = commandLine((mode, config) -> record(mode, config))
            .execute("serve", "--mode", "http", "--host", "localhost", "--port", "0");

        assertThat(exitCode).isZero();
        assertThat(servedMode).hasValue(ServeMode.HTTP);
        assertThat(servedConfig.get().host()).isEqualTo("localhost");
        assertThat(servedConfig.get().port()).isZero();
    }

    @Test
    void runnerFailureIsReported() {
        int exitCode = commandLine((mode, config) -> {
            throw new IllegalStateException("address in use");
        }).execute("serve", "--mode", "HTTP");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Serve command failed: address in use");
    }

    private int record(ServeMode mode, OperableConfig config) {
        servedMode.set(mode);
        servedConfig.set(config);
        return 0;
    }

    private CommandLine commandLine(ServerRunner runner) {
        OperableConfig config = OperableConfig.fromEnv(Map.of("OPERABLE_MCP_HOST", "127.0.0.2", "OPERABLE_MCP_PORT", "9090"));
        CliContext context = new CliContext(
            config,
            new ToolDispatcher(ToolRegistry.builder().build()),
            new ObjectMapper(),
            runner,
            new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)
        );
        return OperableApplication.commandLine(context);
    }
}

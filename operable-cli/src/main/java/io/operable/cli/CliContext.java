package io.operable.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.config.OperableConfig;
import io.operable.core.tool.ToolDispatcher;
import java.io.PrintStream;

public record CliContext(
    OperableConfig config,
    ToolDispatcher dispatcher,
    ObjectMapper mapper,
    ServerRunner serverRunner,
    PrintStream out,
    PrintStream err
) {
    public CliContext(OperableConfig config, ToolDispatcher dispatcher, ObjectMapper mapper, ServerRunner serverRunner) {
        this(config, dispatcher, mapper, serverRunner, System.out, System.err);
    }
}

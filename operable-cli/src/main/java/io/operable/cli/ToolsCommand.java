package io.operable.cli;

import io.operable.core.tool.ParameterSpec;
import io.operable.core.tool.ToolDefinition;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "tools", description = "List the registered tools")
public final class ToolsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--verbose", "-v"}, description = "Show parameters for each tool")
    boolean verbose;

    public ToolsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        for (ToolDefinition tool : context.dispatcher().registry().all()) {
            context.out().println(tool.name() + " - " + tool.description());
            if (verbose) {
                for (ParameterSpec parameter : tool.schema().parameters()) {
                    context.out().println("    " + parameter.name() + " (" + parameter.kind().jsonType()
                        + (parameter.required() ? ", required" : "") + ") " + parameter.description());
                }
            }
        }
        return 0;
    }
}

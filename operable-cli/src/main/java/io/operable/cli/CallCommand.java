package io.operable.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.operable.core.tool.ArgumentValue;
import io.operable.core.tool.CallResult;
import io.operable.core.tool.CancellationToken;
import io.operable.core.tool.ToolContext;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "call", description = "Invoke one tool and print its report")
public final class CallCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Tool name")
    String toolName;

    @Option(names = {"--arguments", "-a"}, description = "Tool arguments as a JSON object", defaultValue = "{}")
    String arguments;

    public CallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Map<String, ArgumentValue> values;
        try {
            Map<String, Object> raw = context.mapper().readValue(arguments, new TypeReference<Map<String, Object>>() {
            });
            values = ArgumentValue.fromJson(raw);
        } catch (JsonProcessingException e) {
            context.err().println("Invalid --arguments JSON: " + e.getOriginalMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            context.err().println(e.getMessage());
            return 2;
        }

        CallResult result = context.dispatcher().invoke(
            toolName,
            values,
            ToolContext.withTimeout(new CancellationToken(), context.config().callTimeout())
        );
        if (result.isError()) {
            context.err().println(result.text());
            return 1;
        }
        context.out().println(result.text());
        return 0;
    }
}

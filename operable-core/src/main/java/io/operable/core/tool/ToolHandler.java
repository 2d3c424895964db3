package io.operable.core.tool;

@FunctionalInterface
public interface ToolHandler {
    CallResult handle(ToolContext context, ToolArguments arguments) throws ToolExecutionException;
}

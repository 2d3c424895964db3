package io.operable.core.tool;

import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up, validates and runs tool calls. Every failure that happens while serving a call is returned as an
 * error {@link CallResult}; nothing thrown by a handler escapes {@link #invoke}.
 */
public final class ToolDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry registry;

    public ToolDispatcher(ToolRegistry registry) {
        this.registry = registry;
    }

    public ToolRegistry registry() {
        return registry;
    }

    public CallResult invoke(String toolName, Map<String, ArgumentValue> arguments) {
        return invoke(toolName, arguments, ToolContext.background());
    }

    public CallResult invoke(String toolName, Map<String, ArgumentValue> arguments, ToolContext context) {
        Optional<ToolDefinition> definition = registry.lookup(toolName);
        if (definition.isEmpty()) {
            LOG.warn("No tool registered with name {}", toolName);
            return CallResult.error("Unknown tool: " + toolName);
        }
        ToolDefinition tool = definition.get();

        ToolArguments validated;
        try {
            validated = ParameterValidator.validate(tool.schema(), arguments);
        } catch (ArgumentValidationException e) {
            LOG.debug("Rejected call to {}: {}", toolName, e.getMessage());
            return CallResult.error(e.getMessage());
        }

        if (context.isCancelled()) {
            return cancelled(toolName);
        }

        LOG.debug("Dispatching tool call: name={}, args={}", toolName, validated);
        try {
            CallResult result = tool.handler().handle(context, validated);
            return result == null ? CallResult.error("Tool " + toolName + " returned no result") : result;
        } catch (ToolExecutionException e) {
            if (context.isCancelled()) {
                return cancelled(toolName);
            }
            if (context.isExpired()) {
                LOG.warn("Tool {} exceeded its deadline: {}", toolName, e.getMessage());
                return CallResult.error("Tool call timed out: " + toolName);
            }
            LOG.warn("Tool {} failed: {}", toolName, e.getMessage());
            return CallResult.error(e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Tool {} failed unexpectedly", toolName, e);
            return CallResult.error("Unexpected error in " + toolName + ": " + e.getMessage());
        }
    }

    private CallResult cancelled(String toolName) {
        LOG.info("Tool call cancelled: {}", toolName);
        return CallResult.error("Tool call cancelled: " + toolName);
    }
}

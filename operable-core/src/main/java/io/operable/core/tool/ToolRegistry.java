package io.operable.core.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable mapping from tool name to {@link ToolDefinition}, populated once through a {@link Builder} at startup.
 * Lookups need no locking because the map is never modified after {@link Builder#build()}.
 */
public final class ToolRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolDefinition> tools;

    private ToolRegistry(Map<String, ToolDefinition> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ToolRegistry of(List<? extends ToolGroup> groups) {
        return builder().registerGroups(groups).build();
    }

    public Optional<ToolDefinition> lookup(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    // Registration order.
    public List<ToolDefinition> all() {
        return List.copyOf(tools.values());
    }

    public int size() {
        return tools.size();
    }

    public static final class Builder {
        private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        public Builder register(ToolDefinition definition) {
            ensureOpen();
            if (tools.putIfAbsent(definition.name(), definition) != null) {
                throw new ToolRegistrationException("Tool already registered: " + definition.name());
            }
            return this;
        }

        /**
         * Registers every group independently. A group either registers all of its tools or none of them. Failures
         * carry the area name and are thrown together once every group has been attempted.
         */
        public Builder registerGroups(List<? extends ToolGroup> groups) {
            ensureOpen();
            List<ToolRegistrationException> failures = new ArrayList<>();
            for (ToolGroup group : groups) {
                try {
                    List<ToolDefinition> definitions = group.tools();
                    registerArea(definitions);
                    LOG.info("Registered {} tools for area {}", definitions.size(), group.area());
                } catch (Exception e) {
                    LOG.error("Error registering {} tools: {}", group.area(), e.getMessage());
                    failures.add(new ToolRegistrationException("Error registering " + group.area() + " tools: " + e.getMessage(), e));
                }
            }

            if (failures.size() == 1) {
                throw failures.get(0);
            }
            if (!failures.isEmpty()) {
                ToolRegistrationException combined = new ToolRegistrationException(
                    failures.size() + " capability areas failed to register; first: " + failures.get(0).getMessage(),
                    failures.get(0)
                );
                failures.subList(1, failures.size()).forEach(combined::addSuppressed);
                throw combined;
            }
            return this;
        }

        public ToolRegistry build() {
            ensureOpen();
            built = true;
            return new ToolRegistry(tools);
        }

        private void registerArea(List<ToolDefinition> definitions) {
            Map<String, ToolDefinition> staged = new LinkedHashMap<>();
            for (ToolDefinition definition : definitions) {
                if (tools.containsKey(definition.name()) || staged.putIfAbsent(definition.name(), definition) != null) {
                    throw new ToolRegistrationException("Tool already registered: " + definition.name());
                }
            }
            tools.putAll(staged);
        }

        private void ensureOpen() {
            if (built) {
                throw new IllegalStateException("Registry already built");
            }
        }
    }
}

package io.operable.core.tool.impl;

import io.operable.core.google.GoogleApiClient;
import io.operable.core.tool.ToolGroup;
import io.operable.core.tool.ToolRegistry;
import java.util.List;

public final class DiagnosticToolGroups {

    private DiagnosticToolGroups() {
    }

    // Registration order: issues, logs, clusters, metrics, docs.
    public static List<ToolGroup> all(GoogleApiClient api) {
        return List.of(
            new IssuesTools(api),
            new LoggingTools(api),
            new KubernetesTools(api),
            new MonitoringTools(api),
            new DocumentationTools(api.mapper())
        );
    }

    public static ToolRegistry registry(GoogleApiClient api) {
        return ToolRegistry.of(all(api));
    }
}

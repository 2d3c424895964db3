package io.operable.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.operable.core.google.GoogleApiClient;
import io.operable.core.google.GoogleApiEndpoints;
import io.operable.core.tool.ToolDefinition;
import io.operable.core.tool.ToolRegistry;
import java.util.Map;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

class DiagnosticToolGroupsTest {

    @Test
    void registersAllToolsInGroupOrder() {
        GoogleApiClient api = new GoogleApiClient(
            context -> new OkHttpClient(),
            new ObjectMapper(),
            GoogleApiEndpoints.allAt("http://localhost:1/")
        );

        ToolRegistry registry = DiagnosticToolGroups.registry(api);

        assertThat(registry.all()).extracting(ToolDefinition::name).containsExactly(
            "list_active_issues", "get_issue_details",
            "query_logs", "get_pod_logs",
            "list_clusters", "get_cluster_info", "list_node_pools",
            "query_metrics", "list_alerts",
            "search_gcp_docs", "search_k8s_docs", "get_error_docs"
        );
    }

    @Test
    @SuppressWarnings("unchecked")
    void schemasDeclareRequiredParameters() {
        GoogleApiClient api = new GoogleApiClient(
            context -> new OkHttpClient(),
            new ObjectMapper(),
            GoogleApiEndpoints.allAt("http://localhost:1/")
        );

        Map<String, Object> schema = DiagnosticToolGroups.registry(api).lookup("get_pod_logs").orElseThrow().inputSchema();

        assertThat(schema).containsEntry("type", "object");
        assertThat((Iterable<String>) schema.get("required"))
            .containsExactlyInAnyOrder("project_id", "location", "cluster_name", "namespace", "pod_name");
    }
}

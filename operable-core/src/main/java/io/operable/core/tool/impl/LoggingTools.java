package io.operable.core.tool.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.operable.core.google.GoogleApiClient;
import io.operable.core.google.model.LoggingModel.EntriesResponse;
import io.operable.core.google.model.LoggingModel.LogEntry;
import io.operable.core.render.MarkdownReport;
import io.operable.core.render.Timestamps;
import io.operable.core.tool.CallResult;
import io.operable.core.tool.ParameterSchema;
import io.operable.core.tool.ParameterSpec;
import io.operable.core.tool.ToolArguments;
import io.operable.core.tool.ToolContext;
import io.operable.core.tool.ToolDefinition;
import io.operable.core.tool.ToolExecutionException;
import io.operable.core.tool.ToolGroup;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingTools implements ToolGroup {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingTools.class);
    private static final String API = "Logging API";

    private final GoogleApiClient api;

    public LoggingTools(GoogleApiClient api) {
        this.api = api;
    }

    @Override
    public String area() {
        return "logs";
    }

    @Override
    public List<ToolDefinition> tools() {
        return List.of(
            new ToolDefinition(
                "query_logs",
                "Queries logs from GCP Cloud Logging",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.requiredString("filter", "The filter expression for the logs query"),
                    ParameterSpec.optionalNumber("time_range_hours", "Time range for logs in hours (default: 1)", 1),
                    ParameterSpec.optionalNumber("max_results", "Maximum number of results to return (default: 50)", 50)
                ),
                this::queryLogs
            ),
            new ToolDefinition(
                "get_pod_logs",
                "Gets logs for a specific Kubernetes pod",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.requiredString("location", "The GKE cluster location"),
                    ParameterSpec.requiredString("cluster_name", "The GKE cluster name"),
                    ParameterSpec.requiredString("namespace", "The Kubernetes namespace"),
                    ParameterSpec.requiredString("pod_name", "The name of the pod"),
                    ParameterSpec.optionalString("container_name",
                        "The name of the container (if not provided, logs from all containers will be returned)"),
                    ParameterSpec.optionalNumber("time_range_hours", "Time range for logs in hours (default: 1)", 1),
                    ParameterSpec.optionalNumber("max_results", "Maximum number of results to return (default: 100)", 100)
                ),
                this::getPodLogs
            )
        );
    }

    CallResult queryLogs(ToolContext context, ToolArguments args) throws ToolExecutionException {
        String filter = args.string("filter");
        if (!filter.contains("timestamp")) {
            TimeWindow window = TimeWindow.lastHours(context.clock(), args.number("time_range_hours"));
            filter = filter + " AND " + window.loggingClause();
        }
        EntriesResponse response = listEntries(context, args.string("project_id"), filter, args.integer("max_results"));

        List<LogEntry> entries = response.entries();
        if (entries.isEmpty()) {
            return CallResult.text("No logs found matching the filter criteria.");
        }

        MarkdownReport report = new MarkdownReport()
            .paragraph("Found " + entries.size() + " log entries matching the filter criteria:");
        for (int i = 0; i < entries.size(); i++) {
            LogEntry entry = entries.get(i);
            report.heading(3, "Log Entry " + (i + 1))
                .field("Timestamp", Timestamps.format(entry.timestamp()))
                .field("Severity", entry.severity())
                .field("Log Name", entry.logName())
                .field("Resource Type", entry.resource().type())
                .fieldMap("Resource Labels", entry.resource().labels())
                .fieldMap("Labels", entry.labels())
                .line("- **Payload**:");
            if (entry.textPayload() != null && !entry.textPayload().isEmpty()) {
                report.codeBlock("", entry.textPayload());
            } else if (entry.jsonPayload() != null) {
                report.codeBlock("json", prettyJson(entry.jsonPayload()));
            } else {
                report.line("No payload");
            }
        }
        if (response.hasMore()) {
            report.paragraph("Note: There are more log entries available. "
                + "Refine your filter or increase max_results to see more.");
        }
        return CallResult.text(report.render());
    }

    CallResult getPodLogs(ToolContext context, ToolArguments args) throws ToolExecutionException {
        String namespace = args.string("namespace");
        String podName = args.string("pod_name");
        String containerName = args.string("container_name");
        double hours = args.number("time_range_hours");

        StringBuilder filter = new StringBuilder("resource.type=\"k8s_container\"")
            .append(" AND resource.labels.project_id=\"").append(args.string("project_id")).append('"')
            .append(" AND resource.labels.location=\"").append(args.string("location")).append('"')
            .append(" AND resource.labels.cluster_name=\"").append(args.string("cluster_name")).append('"')
            .append(" AND resource.labels.namespace_name=\"").append(namespace).append('"')
            .append(" AND resource.labels.pod_name=\"").append(podName).append('"');
        if (!containerName.isEmpty()) {
            filter.append(" AND resource.labels.container_name=\"").append(containerName).append('"');
        }
        filter.append(" AND ").append(TimeWindow.lastHours(context.clock(), hours).loggingClause());

        EntriesResponse response = listEntries(context, args.string("project_id"), filter.toString(),
            args.integer("max_results"));
        List<LogEntry> entries = response.entries();
        if (entries.isEmpty()) {
            return CallResult.text("No logs found for pod " + podName + " in namespace " + namespace + ".");
        }

        // One container: the prefix is redundant. All containers: tag each line with its source.
        boolean singleContainer = !containerName.isEmpty();
        if (!singleContainer) {
            containerName = entries.get(0).resource().labels().getOrDefault("container_name", "");
        }
        String title = "Logs for pod " + podName
            + (containerName.isEmpty() ? "" : ", container " + containerName)
            + " in namespace " + namespace;

        StringBuilder transcript = new StringBuilder();
        // The API returns newest first; the transcript reads oldest first.
        for (int i = entries.size() - 1; i >= 0; i--) {
            LogEntry entry = entries.get(i);
            transcript.append('[').append(Timestamps.format(entry.timestamp())).append("] ");
            if (!singleContainer) {
                transcript.append('[').append(entry.resource().labels().getOrDefault("container_name", "")).append("] ");
            }
            transcript.append(logLine(entry));
            if (i > 0) {
                transcript.append('\n');
            }
        }

        MarkdownReport report = new MarkdownReport()
            .heading(2, title)
            .paragraph(String.format(Locale.ROOT, "Found %d log entries in the last %.1f hours:", entries.size(), hours))
            .codeBlock("", transcript.toString());
        if (response.hasMore()) {
            report.paragraph("Note: There are more log entries available. "
                + "Increase time_range_hours or max_results to see more.");
        }
        return CallResult.text(report.render());
    }

    private EntriesResponse listEntries(ToolContext context, String projectId, String filter, int pageSize)
        throws ToolExecutionException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("resourceNames", List.of("projects/" + projectId));
        body.put("filter", filter);
        body.put("orderBy", "timestamp desc");
        body.put("pageSize", pageSize);
        HttpUrl url = api.url(api.endpoints().logging(), "entries:list").build();
        LOG.debug("Listing log entries for project {} with filter {}", projectId, filter);
        return api.post(context, API, url, body, EntriesResponse.class);
    }

    private String logLine(LogEntry entry) {
        if (entry.textPayload() != null && !entry.textPayload().isEmpty()) {
            return entry.textPayload();
        }
        if (entry.jsonPayload() == null) {
            return "";
        }
        Object message = entry.jsonPayload().get("message");
        if (message != null) {
            return String.valueOf(message);
        }
        try {
            return api.mapper().writeValueAsString(entry.jsonPayload());
        } catch (JsonProcessingException e) {
            LOG.warn("Could not serialize JSON payload of {}: {}", entry.logName(), e.getOriginalMessage());
            return "[complex json payload]";
        }
    }

    private String prettyJson(Map<String, Object> payload) {
        try {
            return api.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            LOG.warn("Could not format JSON payload: {}", e.getOriginalMessage());
            return "Error formatting JSON payload";
        }
    }
}

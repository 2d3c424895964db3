package io.operable.core.tool.impl;

import io.operable.core.google.GoogleApiClient;
import io.operable.core.google.model.MonitoringModel.AlertPoliciesResponse;
import io.operable.core.google.model.MonitoringModel.AlertPolicy;
import io.operable.core.google.model.MonitoringModel.Condition;
import io.operable.core.google.model.MonitoringModel.Incident;
import io.operable.core.google.model.MonitoringModel.IncidentsResponse;
import io.operable.core.google.model.MonitoringModel.Point;
import io.operable.core.google.model.MonitoringModel.TimeSeries;
import io.operable.core.google.model.MonitoringModel.TimeSeriesResponse;
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
import java.util.AbstractMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;

public final class MonitoringTools implements ToolGroup {
    private static final String API = "Monitoring API";

    private static final List<String> RECOMMENDED_ACTIONS = List.of(
        "Check the affected resources for any recent changes or deployments",
        "Review logs around the time the alert was triggered",
        "Check for related alerts that might indicate a broader issue",
        "Verify resource utilization and performance metrics",
        "Consider scaling resources if the alert is related to resource constraints"
    );

    private final GoogleApiClient api;

    public MonitoringTools(GoogleApiClient api) {
        this.api = api;
    }

    @Override
    public String area() {
        return "metrics";
    }

    @Override
    public List<ToolDefinition> tools() {
        return List.of(
            new ToolDefinition(
                "query_metrics",
                "Queries metrics from GCP Cloud Monitoring",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.requiredString("metric_type",
                        "The metric type to query (e.g., kubernetes.io/container/cpu/utilization)"),
                    ParameterSpec.optionalString("filter", "Additional filter for the metrics query"),
                    ParameterSpec.optionalNumber("time_range_hours", "Time range for metrics in hours (default: 1)", 1),
                    ParameterSpec.optionalNumber("alignment_period_seconds",
                        "Alignment period in seconds (default: 300)", 300)
                ),
                this::queryMetrics
            ),
            new ToolDefinition(
                "list_alerts",
                "Lists active alerts from GCP Cloud Monitoring",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.optionalString("filter", "Additional filter for the alerts query")
                ),
                this::listAlerts
            )
        );
    }

    CallResult queryMetrics(ToolContext context, ToolArguments args) throws ToolExecutionException {
        String metricType = args.string("metric_type");
        String extraFilter = args.string("filter");
        String filter = "metric.type=\"" + metricType + "\"" + (extraFilter.isBlank() ? "" : " AND " + extraFilter);
        TimeWindow window = TimeWindow.lastHours(context.clock(), args.number("time_range_hours"));

        HttpUrl url = api.url(api.endpoints().monitoring(), "projects", args.string("project_id"), "timeSeries")
            .addQueryParameter("filter", filter)
            .addQueryParameter("interval.startTime", window.startText())
            .addQueryParameter("interval.endTime", window.endText())
            .addQueryParameter("aggregation.alignmentPeriod", (long) args.number("alignment_period_seconds") + "s")
            .addQueryParameter("aggregation.perSeriesAligner", "ALIGN_MEAN")
            .build();
        TimeSeriesResponse response = api.get(context, API, url, TimeSeriesResponse.class);

        List<TimeSeries> series = response.timeSeries();
        if (series.isEmpty()) {
            return CallResult.text("No metrics data found for metric type " + metricType + " in the specified time range.");
        }

        MarkdownReport report = new MarkdownReport().heading(1, "Metrics Data for " + metricType);
        for (int i = 0; i < series.size(); i++) {
            TimeSeries ts = series.get(i);
            report.heading(2, "Time Series " + (i + 1))
                .heading(3, "Labels")
                .optionalField("resource.type", ts.resource().type());
            ts.resource().labels().forEach((key, value) -> report.field("resource.labels." + key, value));
            ts.metric().labels().forEach((key, value) -> report.field("metric.labels." + key, value));

            report.heading(3, "Data Points");
            if (ts.points().isEmpty()) {
                report.paragraph("No data points available.");
                continue;
            }
            List<Map.Entry<String, String>> rows = ts.points().stream()
                .map(MonitoringTools::row)
                .toList();
            report.table("Time", "Value", rows);
        }
        return CallResult.text(report.render());
    }

    CallResult listAlerts(ToolContext context, ToolArguments args) throws ToolExecutionException {
        String projectId = args.string("project_id");
        String filter = args.string("filter");

        HttpUrl.Builder policiesUrl = api.url(api.endpoints().monitoring(), "projects", projectId, "alertPolicies");
        if (!filter.isBlank()) {
            policiesUrl.addQueryParameter("filter", filter);
        }
        AlertPoliciesResponse policies = api.get(context, API, policiesUrl.build(), AlertPoliciesResponse.class);
        HttpUrl incidentsUrl = api.url(api.endpoints().monitoring(), "projects", projectId, "incidents").build();
        IncidentsResponse incidents = api.get(context, API + " for incidents", incidentsUrl, IncidentsResponse.class);

        List<Incident> open = incidents.incidents().stream().filter(Incident::isOpen).toList();
        if (open.isEmpty()) {
            return CallResult.text("No active alerts found.");
        }

        Map<String, AlertPolicy> policiesByName = new HashMap<>();
        for (AlertPolicy policy : policies.alertPolicies()) {
            policiesByName.put(policy.name(), policy);
        }

        MarkdownReport report = new MarkdownReport()
            .heading(1, "Active Alerts in Project " + projectId)
            .paragraph("Found " + open.size() + " active alerts:");
        for (int i = 0; i < open.size(); i++) {
            Incident incident = open.get(i);
            AlertPolicy policy = policiesByName.get(incident.policyName());
            report.heading(2, (i + 1) + ". Alert: " + incident.resourceDisplayName())
                .field("Policy", policy == null || policy.displayName() == null ? "Unknown Policy" : policy.displayName())
                .field("Condition", conditionName(policy, incident.conditionName()))
                .field("Severity", incident.severity())
                .field("Started", Timestamps.format(incident.startTime()))
                .optionalField("Summary", incident.summary());
            if (policy != null && policy.documentation() != null
                && policy.documentation().content() != null && !policy.documentation().content().isBlank()) {
                report.heading(3, "Documentation").paragraph(policy.documentation().content());
            }
        }
        report.heading(2, "Recommended Actions").numbered(RECOMMENDED_ACTIONS);
        return CallResult.text(report.render());
    }

    private static String conditionName(AlertPolicy policy, String conditionName) {
        if (policy != null) {
            for (Condition condition : policy.conditions()) {
                if (condition.name() != null && condition.name().equals(conditionName) && condition.displayName() != null) {
                    return condition.displayName();
                }
            }
        }
        return "Unknown Condition";
    }

    private static Map.Entry<String, String> row(Point point) {
        String time = point.interval() == null ? "" : Timestamps.format(point.interval().endTime());
        String value = point.value() == null ? "N/A" : point.value().display();
        return new AbstractMap.SimpleImmutableEntry<>(time, value);
    }
}

package io.operable.core.tool.impl;

import io.operable.core.google.GoogleApiClient;
import io.operable.core.google.model.ErrorReportingModel.ErrorContext;
import io.operable.core.google.model.ErrorReportingModel.ErrorEvent;
import io.operable.core.google.model.ErrorReportingModel.ErrorGroupStats;
import io.operable.core.google.model.ErrorReportingModel.EventsResponse;
import io.operable.core.google.model.ErrorReportingModel.GroupStatsResponse;
import io.operable.core.google.model.ErrorReportingModel.HttpRequestContext;
import io.operable.core.google.model.ErrorReportingModel.ServiceContext;
import io.operable.core.google.model.ErrorReportingModel.SourceLocation;
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
import java.util.List;
import okhttp3.HttpUrl;

/**
 * Error Reporting tools: active error groups and the recent events of one group.
 */
public final class IssuesTools implements ToolGroup {
    private static final String API = "Error Reporting API";

    private static final List<String> POTENTIAL_CAUSES = List.of(
        "Check the error messages and stack traces for clues about the root cause.",
        "Look for patterns in the affected services and versions.",
        "Check recent deployments or changes to affected services.",
        "Examine logs around the time of the errors for related issues.",
        "Consider temporary mitigations like rolling back to a previous version if errors persist."
    );

    private final GoogleApiClient api;

    public IssuesTools(GoogleApiClient api) {
        this.api = api;
    }

    @Override
    public String area() {
        return "issues";
    }

    @Override
    public List<ToolDefinition> tools() {
        return List.of(
            new ToolDefinition(
                "list_active_issues",
                "Lists active issues from GCP Error Reporting",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.optionalNumber("time_range_hours", "Time range for issues in hours (default: 24)", 24),
                    ParameterSpec.optionalNumber("max_results", "Maximum number of results to return (default: 10)", 10)
                ),
                this::listActiveIssues
            ),
            new ToolDefinition(
                "get_issue_details",
                "Gets detailed information about a specific error group",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.requiredString("error_group_id", "The ID of the error group")
                ),
                this::getIssueDetails
            )
        );
    }

    CallResult listActiveIssues(ToolContext context, ToolArguments args) throws ToolExecutionException {
        String projectId = args.string("project_id");
        HttpUrl url = api.url(api.endpoints().errorReporting(), "projects", projectId, "groupStats")
            .addQueryParameter("timeRange.period", period(args.number("time_range_hours")))
            .addQueryParameter("pageSize", Integer.toString(args.integer("max_results")))
            .addQueryParameter("alignment", "ALIGNMENT_EQUAL_ROUNDED")
            .build();
        GroupStatsResponse response = api.get(context, API, url, GroupStatsResponse.class);

        List<ErrorGroupStats> stats = response.errorGroupStats();
        if (stats.isEmpty()) {
            return CallResult.text("No active issues found in the specified time range.");
        }

        MarkdownReport report = new MarkdownReport()
            .paragraph("Found " + stats.size() + " active issues in project " + projectId + ":");
        for (int i = 0; i < stats.size(); i++) {
            ErrorGroupStats stat = stats.get(i);
            report.heading(3, (i + 1) + ". Error Group: " + stat.groupId())
                .field("Count", stat.count() + " occurrences");
            if (stat.firstSeenTime() != null) {
                report.field("First seen", Timestamps.format(stat.firstSeenTime()));
            }
            if (stat.lastSeenTime() != null) {
                report.field("Last seen", Timestamps.format(stat.lastSeenTime()));
            }
            report.fieldList("Affected services", stat.affectedServices().stream().map(IssuesTools::service).toList());
        }
        report.paragraph("To get more details about a specific error group, use the get_issue_details tool.");
        return CallResult.text(report.render());
    }

    CallResult getIssueDetails(ToolContext context, ToolArguments args) throws ToolExecutionException {
        String projectId = args.string("project_id");
        String groupId = args.string("error_group_id");
        HttpUrl url = api.url(api.endpoints().errorReporting(), "projects", projectId, "events")
            .addQueryParameter("groupId", groupId)
            .addQueryParameter("pageSize", "10")
            .build();
        EventsResponse response = api.get(context, API, url, EventsResponse.class);

        MarkdownReport report = new MarkdownReport()
            .heading(2, "Error Group: " + groupId)
            .heading(3, "Recent Error Events");
        List<ErrorEvent> events = response.errorEvents();
        if (events.isEmpty()) {
            report.paragraph("No recent error events found.");
        }
        for (int i = 0; i < events.size(); i++) {
            renderEvent(report, i + 1, events.get(i));
        }
        report.heading(3, "Potential Causes and Solutions").numbered(POTENTIAL_CAUSES);
        return CallResult.text(report.render());
    }

    private static void renderEvent(MarkdownReport report, int number, ErrorEvent event) {
        report.heading(4, "Event " + number);
        if (event.eventTime() != null) {
            report.field("Time", Timestamps.format(event.eventTime()));
        }
        if (event.serviceContext() != null) {
            report.field("Service", service(event.serviceContext()));
        }
        ErrorContext context = event.context();
        if (context != null && context.reportLocation() != null) {
            SourceLocation location = context.reportLocation();
            report.field("Location", nullToEmpty(location.filePath()) + ":"
                + (location.lineNumber() == null ? 0 : location.lineNumber())
                + " in " + nullToEmpty(location.functionName()));
        }
        if (context != null && context.httpRequest() != null) {
            HttpRequestContext request = context.httpRequest();
            report.field("Request", nullToEmpty(request.method()) + " " + nullToEmpty(request.url()));
            if (request.remoteIp() != null && !request.remoteIp().isBlank()) {
                report.subBullet("IP: " + request.remoteIp());
            }
            if (request.userAgent() != null && !request.userAgent().isBlank()) {
                report.subBullet("User-Agent: " + request.userAgent());
            }
            if (request.referrer() != null && !request.referrer().isBlank()) {
                report.subBullet("Referrer: " + request.referrer());
            }
        }
        if (event.message() != null && !event.message().isBlank()) {
            report.line("- **Error Message**:").codeBlock("", event.message());
        }
    }

    static String period(double hours) {
        if (hours <= 1) {
            return "PERIOD_1_HOUR";
        }
        if (hours <= 6) {
            return "PERIOD_6_HOURS";
        }
        if (hours <= 24) {
            return "PERIOD_1_DAY";
        }
        if (hours <= 168) {
            return "PERIOD_1_WEEK";
        }
        return "PERIOD_30_DAYS";
    }

    private static String service(ServiceContext service) {
        return nullToEmpty(service.service()) + " (version: " + nullToEmpty(service.version()) + ")";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

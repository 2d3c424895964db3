package io.operable.core.google.model;

import java.util.List;

// Cloud Error Reporting v1beta1 response shapes.
public final class ErrorReportingModel {

    private ErrorReportingModel() {
    }

    public record GroupStatsResponse(List<ErrorGroupStats> errorGroupStats, String nextPageToken) {
        public GroupStatsResponse {
            errorGroupStats = errorGroupStats == null ? List.of() : errorGroupStats;
        }
    }

    public record ErrorGroupStats(
        ErrorGroup group,
        long count,
        long affectedUsersCount,
        String firstSeenTime,
        String lastSeenTime,
        List<ServiceContext> affectedServices
    ) {
        public ErrorGroupStats {
            affectedServices = affectedServices == null ? List.of() : affectedServices;
        }

        // "projects/p/groups/abc" -> "abc"
        public String groupId() {
            if (group == null) {
                return "";
            }
            if (group.groupId() != null && !group.groupId().isBlank()) {
                return group.groupId();
            }
            String name = group.name() == null ? "" : group.name();
            return name.substring(name.lastIndexOf('/') + 1);
        }
    }

    public record ErrorGroup(String name, String groupId) {
    }

    public record ServiceContext(String service, String version) {
    }

    public record EventsResponse(List<ErrorEvent> errorEvents, String nextPageToken) {
        public EventsResponse {
            errorEvents = errorEvents == null ? List.of() : errorEvents;
        }
    }

    public record ErrorEvent(String eventTime, ServiceContext serviceContext, String message, ErrorContext context) {
    }

    public record ErrorContext(HttpRequestContext httpRequest, String user, SourceLocation reportLocation) {
    }

    public record HttpRequestContext(
        String method,
        String url,
        String userAgent,
        String referrer,
        Integer responseStatusCode,
        String remoteIp
    ) {
    }

    public record SourceLocation(String filePath, Integer lineNumber, String functionName) {
    }
}

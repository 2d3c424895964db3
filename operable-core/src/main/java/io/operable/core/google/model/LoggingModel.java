package io.operable.core.google.model;

import java.util.List;
import java.util.Map;

// Cloud Logging v2 entries:list response shapes.
public final class LoggingModel {

    private LoggingModel() {
    }

    public record EntriesResponse(List<LogEntry> entries, String nextPageToken) {
        public EntriesResponse {
            entries = entries == null ? List.of() : entries;
        }

        public boolean hasMore() {
            return nextPageToken != null && !nextPageToken.isBlank();
        }
    }

    public record LogEntry(
        String logName,
        MonitoredResource resource,
        String timestamp,
        String severity,
        String textPayload,
        Map<String, Object> jsonPayload,
        Map<String, String> labels
    ) {
        public LogEntry {
            resource = resource == null ? new MonitoredResource("", Map.of()) : resource;
            labels = labels == null ? Map.of() : labels;
        }
    }
}

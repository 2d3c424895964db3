package io.operable.core.google.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;

// Cloud Monitoring v3 response shapes.
public final class MonitoringModel {

    private MonitoringModel() {
    }

    public record TimeSeriesResponse(List<TimeSeries> timeSeries, String nextPageToken) {
        public TimeSeriesResponse {
            timeSeries = timeSeries == null ? List.of() : timeSeries;
        }
    }

    public record TimeSeries(
        Metric metric,
        MonitoredResource resource,
        String metricKind,
        String valueType,
        String unit,
        List<Point> points
    ) {
        public TimeSeries {
            metric = metric == null ? new Metric("", Map.of()) : metric;
            resource = resource == null ? new MonitoredResource("", Map.of()) : resource;
            points = points == null ? List.of() : points;
        }
    }

    public record Metric(String type, Map<String, String> labels) {
        public Metric {
            labels = labels == null ? Map.of() : labels;
        }
    }

    public record Point(TimeInterval interval, TypedValue value) {
    }

    public record TimeInterval(String startTime, String endTime) {
    }

    public record TypedValue(
        Double doubleValue,
        String int64Value,
        Boolean boolValue,
        String stringValue,
        Distribution distributionValue
    ) {
        public String display() {
            if (doubleValue != null) {
                return String.format(Locale.ROOT, "%.6f", doubleValue);
            }
            if (int64Value != null) {
                return int64Value;
            }
            if (stringValue != null) {
                return stringValue;
            }
            if (boolValue != null) {
                return boolValue.toString();
            }
            if (distributionValue != null) {
                return String.format(Locale.ROOT, "mean %.6f (count %s)", distributionValue.mean(), distributionValue.count());
            }
            return "N/A";
        }
    }

    public record Distribution(String count, double mean) {
    }

    public record AlertPoliciesResponse(List<AlertPolicy> alertPolicies, String nextPageToken) {
        public AlertPoliciesResponse {
            alertPolicies = alertPolicies == null ? List.of() : alertPolicies;
        }
    }

    public record AlertPolicy(
        String name,
        String displayName,
        Documentation documentation,
        List<Condition> conditions,
        Boolean enabled
    ) {
        public AlertPolicy {
            conditions = conditions == null ? List.of() : conditions;
        }
    }

    public record Documentation(String content, String mimeType) {
    }

    public record Condition(String name, String displayName) {
    }

    public record IncidentsResponse(List<Incident> incidents) {
        public IncidentsResponse {
            incidents = incidents == null ? List.of() : incidents;
        }
    }

    public record Incident(
        String name,
        String resourceName,
        String resourceDisplayName,
        String policyName,
        String conditionName,
        String startTime,
        String endTime,
        String state,
        String summary,
        String severity
    ) {
        public boolean isOpen() {
            return "OPEN".equals(state);
        }
    }
}

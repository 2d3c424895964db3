package io.operable.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.operable.core.tool.CallResult;
import java.util.Map;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MonitoringToolsTest {
    private ToolHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new ToolHarness(MonitoringTools::new);
    }

    @AfterEach
    void tearDown() throws Exception {
        harness.close();
    }

    @Test
    void queryMetricsRendersLabelsAndPointTable() throws Exception {
        harness.respond("""
            {
              "timeSeries": [
                {
                  "metric": {"type": "kubernetes.io/container/cpu/core_usage_time", "labels": {"state": "used"}},
                  "resource": {"type": "k8s_container", "labels": {"pod_name": "api-1"}},
                  "points": [
                    {"interval": {"endTime": "2024-05-01T12:00:00Z"}, "value": {"doubleValue": 0.25}},
                    {"interval": {"endTime": "2024-05-01T11:55:00Z"}, "value": {"int64Value": "7"}}
                  ]
                }
              ]
            }
            """);

        CallResult result = harness.call("query_metrics", Map.of(
            "project_id", "demo",
            "metric_type", "kubernetes.io/container/cpu/core_usage_time",
            "filter", "resource.labels.namespace_name=\"payments\""
        ));

        assertThat(result.text())
            .startsWith("# Metrics Data for kubernetes.io/container/cpu/core_usage_time")
            .contains("## Time Series 1")
            .contains("- **resource.labels.pod_name**: api-1")
            .contains("- **metric.labels.state**: used")
            .contains("| Time | Value |\n| ---- | ----- |\n| 2024-05-01 12:00:00 | 0.250000 |\n| 2024-05-01 11:55:00 | 7 |");

        HttpUrl url = harness.server.takeRequest().getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/projects/demo/timeSeries");
        assertThat(url.queryParameter("filter")).isEqualTo(
            "metric.type=\"kubernetes.io/container/cpu/core_usage_time\" AND resource.labels.namespace_name=\"payments\"");
        assertThat(url.queryParameter("interval.startTime")).isEqualTo("2024-05-01T11:00:00Z");
        assertThat(url.queryParameter("aggregation.alignmentPeriod")).isEqualTo("300s");
        assertThat(url.queryParameter("aggregation.perSeriesAligner")).isEqualTo("ALIGN_MEAN");
    }

    @Test
    void noSeriesMessageNamesMetric() {
        harness.respond("{}");

        CallResult result = harness.call("query_metrics", Map.of("project_id", "demo", "metric_type", "custom/x"));

        assertThat(result.text()).isEqualTo("No metrics data found for metric type custom/x in the specified time range.");
    }

    @Test
    void listAlertsJoinsOpenIncidentsWithPolicies() throws Exception {
        harness.respond("""
            {
              "alertPolicies": [
                {
                  "name": "projects/demo/alertPolicies/1",
                  "displayName": "High error rate",
                  "documentation": {"content": "Page the on-call."},
                  "conditions": [{"name": "projects/demo/alertPolicies/1/conditions/9", "displayName": "5xx > 5%"}]
                }
              ]
            }
            """);
        harness.respond("""
            {
              "incidents": [
                {"state": "CLOSED", "resourceDisplayName": "old"},
                {
                  "state": "OPEN",
                  "resourceDisplayName": "checkout",
                  "policyName": "projects/demo/alertPolicies/1",
                  "conditionName": "projects/demo/alertPolicies/1/conditions/9",
                  "severity": "CRITICAL",
                  "startTime": "2024-05-01T11:40:00Z"
                },
                {"state": "OPEN", "resourceDisplayName": "orphan", "policyName": "projects/demo/alertPolicies/404"}
              ]
            }
            """);

        String text = harness.call("list_alerts", Map.of("project_id", "demo")).text();

        assertThat(text)
            .startsWith("# Active Alerts in Project demo\n\nFound 2 active alerts:")
            .contains("## 1. Alert: checkout\n\n- **Policy**: High error rate\n- **Condition**: 5xx > 5%")
            .contains("- **Started**: 2024-05-01 11:40:00")
            .contains("### Documentation\n\nPage the on-call.")
            .contains("## 2. Alert: orphan\n\n- **Policy**: Unknown Policy\n- **Condition**: Unknown Condition")
            .doesNotContain("old")
            .contains("## Recommended Actions");
        assertThat(harness.server.takeRequest().getPath()).isEqualTo("/projects/demo/alertPolicies");
        assertThat(harness.server.takeRequest().getPath()).isEqualTo("/projects/demo/incidents");
    }

    @Test
    void noOpenIncidents() {
        harness.respond("{}");
        harness.respond("{\"incidents\":[{\"state\":\"CLOSED\"}]}");

        assertThat(harness.call("list_alerts", Map.of("project_id", "demo")).text()).isEqualTo("No active alerts found.");
    }
}

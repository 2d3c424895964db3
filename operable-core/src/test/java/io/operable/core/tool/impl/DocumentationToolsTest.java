package io.operable.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.operable.core.tool.CallResult;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DocumentationToolsTest {
    private ToolHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new ToolHarness(api -> new DocumentationTools(api.mapper()));
    }

    @AfterEach
    void tearDown() throws Exception {
        harness.close();
    }

    @Test
    void searchesGcpCatalogueCaseInsensitively() {
        CallResult result = harness.call("search_gcp_docs", Map.of("query", "KUBERNETES"));

        assertThat(result.isError()).isFalse();
        assertThat(result.text())
            .startsWith("# Google Cloud Documentation Search Results for \"KUBERNETES\"")
            .contains("## 1. Kubernetes Engine | Google Cloud")
            .contains("**URL**: [https://cloud.google.com/kubernetes-engine](https://cloud.google.com/kubernetes-engine)")
            .endsWith("For more results, visit the [Google Cloud documentation](https://cloud.google.com/docs).");
        assertThat(harness.server.getRequestCount()).isZero();
    }

    @Test
    void maxResultsLimitsMatches() {
        String text = harness.call("search_k8s_docs", Map.of("query", "debug", "max_results", 1)).text();

        assertThat(text).contains("## 1. ").doesNotContain("## 2. ");
    }

    @Test
    void noMatches() {
        assertThat(harness.call("search_k8s_docs", Map.of("query", "zzz")).text())
            .isEqualTo("No documentation found for query: zzz");
    }

    @Test
    void errorDocsByCodeThenByMessage() {
        assertThat(harness.call("get_error_docs", Map.of("error_code", " permission_denied ")).text())
            .startsWith("# Permission Denied Error")
            .contains("## Solution\n\n1. Check the IAM permissions")
            .contains("- [https://cloud.google.com/iam/docs/overview](https://cloud.google.com/iam/docs/overview)");

        assertThat(harness.call("get_error_docs", Map.of("error_code", "UNKNOWN", "error_message", "quota")).text())
            .startsWith("# Resource Exhausted Error");
    }

    @Test
    void errorDocsRequiresCodeOrMessage() {
        CallResult result = harness.call("get_error_docs", Map.of());

        assertThat(result.isError()).isTrue();
        assertThat(result.text()).isEqualTo("either error_code or error_message must be provided");
    }

    @Test
    void unknownErrorEchoesInputs() {
        String text = harness.call("get_error_docs", Map.of("error_code", "TEAPOT")).text();

        assertThat(text).startsWith("No documentation found for the specified error. Error code: TEAPOT\n\n");
    }
}

package io.operable.core.google.model;

import java.util.Map;

public record MonitoredResource(String type, Map<String, String> labels) {
    public MonitoredResource {
        labels = labels == null ? Map.of() : labels;
    }
}

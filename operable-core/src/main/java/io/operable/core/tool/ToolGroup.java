package io.operable.core.tool;

import java.util.List;

// A capability area registered as one unit, e.g. "logs" or "clusters".
public interface ToolGroup {
    String area();

    List<ToolDefinition> tools() throws Exception;
}

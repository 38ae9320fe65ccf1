package io.github.drompincen.bandwidth.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON entry point into the scheduling engine. Implementations are discovered through
 * {@link java.util.ServiceLoader} and receive Spring beans through single-argument setters.
 */
public interface PlanningTool {

    String name();

    String description();

    JsonNode inputSchema();

    ToolResult execute(JsonNode input, ProgressListener progress);
}

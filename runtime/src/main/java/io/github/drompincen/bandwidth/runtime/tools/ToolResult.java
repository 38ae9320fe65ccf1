package io.github.drompincen.bandwidth.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of a planning tool call. Warnings flag input the engine accepted but
 * could not make full use of; they never accompany a failure.
 */
public record ToolResult(
        boolean success,
        JsonNode output,
        String error,
        List<String> warnings
) {
    public ToolResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null, List.of());
    }

    public static ToolResult success(JsonNode output, List<String> warnings) {
        return new ToolResult(true, output, null, warnings);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

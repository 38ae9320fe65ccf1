package io.github.drompincen.bandwidth.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolDescriptor(
        String name,
        String description,
        JsonNode inputSchema
) {}

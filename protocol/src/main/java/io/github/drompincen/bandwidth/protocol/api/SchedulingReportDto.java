package io.github.drompincen.bandwidth.protocol.api;

import java.util.List;

public record SchedulingReportDto(
        String title,
        String description,
        List<String> suggestions
) {}

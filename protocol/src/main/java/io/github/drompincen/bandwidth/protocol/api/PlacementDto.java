package io.github.drompincen.bandwidth.protocol.api;

import java.time.LocalDate;

public record PlacementDto(
        String taskId,
        String title,
        double hours,
        int priority,
        int weekNumber,
        LocalDate startDate,
        LocalDate endDate
) {}

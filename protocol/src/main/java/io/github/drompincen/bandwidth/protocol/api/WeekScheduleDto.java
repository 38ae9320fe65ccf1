package io.github.drompincen.bandwidth.protocol.api;

import java.time.LocalDate;
import java.util.List;

public record WeekScheduleDto(
        int weekNumber,
        LocalDate weekStart,
        LocalDate weekEnd,
        double assignedHours,
        double availableHours,
        List<PlacementDto> tasks
) {}

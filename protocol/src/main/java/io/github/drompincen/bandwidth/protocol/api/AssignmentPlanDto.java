package io.github.drompincen.bandwidth.protocol.api;

import java.time.LocalDate;
import java.util.List;

public record AssignmentPlanDto(
        LocalDate referenceDate,
        int horizonWeeks,
        List<AssignmentDto> assignments,
        List<ResourceScheduleDto> schedules,
        AssignmentSummaryDto summary,
        List<UnplacedTaskDto> unplaced
) {}

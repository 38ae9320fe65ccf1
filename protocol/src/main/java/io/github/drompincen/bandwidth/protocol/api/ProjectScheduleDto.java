package io.github.drompincen.bandwidth.protocol.api;

import java.time.LocalDate;
import java.util.Map;

public record ProjectScheduleDto(
        LocalDate referenceDate,
        Map<String, TaskTimelineDto> timelines,
        Map<String, ResourceScheduleDto> resourceSchedules
) {}

package io.github.drompincen.bandwidth.protocol.api;

import java.util.List;

public record ResourceScheduleDto(
        String resourceId,
        String resourceName,
        String role,
        double weeklyCapacity,
        List<WeekScheduleDto> weeks
) {
    public WeekScheduleDto week(int weekNumber) {
        return weeks.get(weekNumber - 1);
    }
}

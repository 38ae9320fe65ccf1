package io.github.drompincen.bandwidth.protocol.api;

import java.time.LocalDate;
import java.util.List;

/**
 * Projected placement of one task. {@code blockedBy} and {@code dependentTasks} are
 * always empty because tasks are scheduled independently of each other.
 */
public record TaskTimelineDto(
        String taskId,
        LocalDate estimatedStartDate,
        LocalDate estimatedEndDate,
        Integer scheduledWeek,
        Integer endWeek,
        boolean scheduled,
        PlacementState state,
        double scheduledHours,
        double unscheduledHours,
        List<String> blockedBy,
        List<String> dependentTasks
) {
    public static TaskTimelineDto unscheduled(String taskId, double unscheduledHours) {
        return new TaskTimelineDto(taskId, null, null, null, null, false,
                PlacementState.UNSCHEDULED, 0, unscheduledHours, List.of(), List.of());
    }
}

package io.github.drompincen.bandwidth.protocol.api;

/**
 * A planner decision. {@code overflow} is kept for callers that still read it and is
 * always {@code false}: tasks that could not be placed are reported as
 * {@link UnplacedTaskDto} instead.
 */
public record AssignmentDto(
        String taskId,
        String resourceId,
        int scheduledWeek,
        String reason,
        boolean overflow
) {}

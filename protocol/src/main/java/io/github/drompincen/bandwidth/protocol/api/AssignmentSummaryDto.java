package io.github.drompincen.bandwidth.protocol.api;

public record AssignmentSummaryDto(
        int totalTasks,
        int immediateAssignments,
        int deferredAssignments,
        int overflowTasks
) {}

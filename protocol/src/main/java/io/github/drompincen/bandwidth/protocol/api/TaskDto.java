package io.github.drompincen.bandwidth.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Scheduling view of a task. {@code assignee} is the embedded resource a caller's
 * task tree carries alongside {@code assignedTo}; {@code requiredRole} is only read
 * by the assignment planner.
 */
public record TaskDto(
        String taskId,
        String title,
        String description,
        Double estimatedHours,
        int priority,
        TaskStatus status,
        String assignedTo,
        ResourceDto assignee,
        String parentTaskId,
        List<TaskDto> subtasks,
        String requiredRole
) {
    public enum TaskStatus {
        PENDING, IN_PROGRESS, COMPLETED, CANCELLED;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static TaskStatus fromValue(String value) {
            if (value == null || value.isBlank()) return PENDING;
            String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            for (TaskStatus status : values()) {
                if (status.name().equals(normalized)) return status;
            }
            throw new IllegalArgumentException("Unknown task status: " + value);
        }
    }

    public boolean hasEstimate() {
        return estimatedHours != null && estimatedHours > 0;
    }

    public List<TaskDto> subtasksOrEmpty() {
        return subtasks != null ? subtasks : List.of();
    }

    public TaskDto withRequiredRole(String role) {
        return new TaskDto(taskId, title, description, estimatedHours, priority, status,
                assignedTo, assignee, parentTaskId, subtasks, role);
    }
}

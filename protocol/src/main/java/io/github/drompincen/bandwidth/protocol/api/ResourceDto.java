package io.github.drompincen.bandwidth.protocol.api;

import java.util.List;

/**
 * A person work can be assigned to. {@code committedHours} is load carried in from
 * outside the plan and only applies to the first week of the horizon.
 */
public record ResourceDto(
        String resourceId,
        String name,
        String role,
        double weeklyCapacity,
        Double committedHours,
        List<String> skills
) {
    public static ResourceDto of(String resourceId, String name, String role, double weeklyCapacity) {
        return new ResourceDto(resourceId, name, role, weeklyCapacity, null, List.of());
    }

    public double committedHoursOrZero() {
        return committedHours != null ? committedHours : 0;
    }
}

package io.github.drompincen.bandwidth.runtime.schedule;

import io.github.drompincen.bandwidth.protocol.api.PlacementDto;
import io.github.drompincen.bandwidth.protocol.api.TaskDto;
import io.github.drompincen.bandwidth.protocol.api.WeekScheduleDto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One resource's capacity for one week. {@code availableHours} is tracked directly
 * and goes negative when committed hours exceed capacity.
 */
public class WeekBucket {

    private final int weekNumber;
    private final LocalDate weekStart;
    private final LocalDate weekEnd;
    private double assignedHours;
    private double availableHours;
    private final List<PlacementDto> placements = new ArrayList<>();

    WeekBucket(int weekNumber, LocalDate weekStart, LocalDate weekEnd, double assignedHours, double availableHours) {
        this.weekNumber = weekNumber;
        this.weekStart = weekStart;
        this.weekEnd = weekEnd;
        this.assignedHours = assignedHours;
        this.availableHours = availableHours;
    }

    public int getWeekNumber() { return weekNumber; }
    public LocalDate getWeekStart() { return weekStart; }
    public LocalDate getWeekEnd() { return weekEnd; }
    public double getAssignedHours() { return assignedHours; }
    public double getAvailableHours() { return availableHours; }
    public List<PlacementDto> getPlacements() { return List.copyOf(placements); }

    /** Hours that can still be placed, never negative. */
    public double spareHours() {
        return Math.max(0, availableHours);
    }

    public boolean fits(double hours) {
        return availableHours >= hours;
    }

    void place(TaskDto task, double hours) {
        assignedHours += hours;
        availableHours -= hours;
        placements.add(new PlacementDto(task.taskId(), task.title(), hours, task.priority(),
                weekNumber, weekStart, weekEnd));
    }

    WeekScheduleDto toDto(boolean clampAvailable) {
        double available = clampAvailable ? spareHours() : availableHours;
        return new WeekScheduleDto(weekNumber, weekStart, weekEnd, assignedHours, available, List.copyOf(placements));
    }
}

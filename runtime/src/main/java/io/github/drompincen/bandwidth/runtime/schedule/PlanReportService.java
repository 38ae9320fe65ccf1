package io.github.drompincen.bandwidth.runtime.schedule;

import io.github.drompincen.bandwidth.protocol.api.AssignmentPlanDto;
import io.github.drompincen.bandwidth.protocol.api.AssignmentSummaryDto;
import io.github.drompincen.bandwidth.protocol.api.PlannerSettings;
import io.github.drompincen.bandwidth.protocol.api.ResourceScheduleDto;
import io.github.drompincen.bandwidth.protocol.api.SchedulingReportDto;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class PlanReportService {

    private final PlannerSettings settings;

    public PlanReportService(PlannerSettings settings) {
        this.settings = settings;
    }

    public SchedulingReportDto summarize(AssignmentPlanDto plan) {
        AssignmentSummaryDto summary = plan.summary();
        String title;
        String description;
        List<String> suggestions = new ArrayList<>();

        if (summary.overflowTasks() > 0) {
            title = "Bandwidth Exceeded";
            description = summary.immediateAssignments() + " tasks can start this week, "
                    + summary.deferredAssignments() + " tasks scheduled for later weeks, "
                    + summary.overflowTasks() + " could not be placed within " + plan.horizonWeeks() + " weeks.";
            suggestions.add("Consider increasing team capacity");
            suggestions.add("Extend the planning horizon beyond " + plan.horizonWeeks() + " weeks");
            suggestions.add("Split large tasks into smaller chunks");
        } else {
            title = "Assignment Complete";
            description = "All " + summary.totalTasks() + " tasks successfully scheduled within current capacity.";
        }

        long nearCapacity = plan.schedules().stream().filter(this::isNearCapacity).count();
        if (nearCapacity > 0) {
            suggestions.add(nearCapacity + " team member(s) near capacity limit");
        }
        return new SchedulingReportDto(title, description, List.copyOf(suggestions));
    }

    private boolean isNearCapacity(ResourceScheduleDto schedule) {
        if (schedule.weeks().isEmpty()) return false;
        return schedule.week(1).assignedHours() > schedule.weeklyCapacity() * settings.nearCapacityRatio();
    }
}

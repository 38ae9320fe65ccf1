package io.github.drompincen.bandwidth.runtime.schedule;

import io.github.drompincen.bandwidth.protocol.api.AssignmentDto;
import io.github.drompincen.bandwidth.protocol.api.AssignmentPlanDto;
import io.github.drompincen.bandwidth.protocol.api.AssignmentSummaryDto;
import io.github.drompincen.bandwidth.protocol.api.PlannerSettings;
import io.github.drompincen.bandwidth.protocol.api.ResourceDto;
import io.github.drompincen.bandwidth.protocol.api.TaskDto;
import io.github.drompincen.bandwidth.protocol.api.UnplacedTaskDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;

/**
 * Decides who should pick up each unassigned task and in which week. Tasks are taken
 * in priority order; each one goes to the resource/week pair with the best score among
 * the earliest week per resource that can hold the whole task. The result is a plan
 * for review, nothing is applied.
 */
@Service
public class AssignmentPlanner {

    private static final Logger log = LoggerFactory.getLogger(AssignmentPlanner.class);

    private final PlannerSettings settings;
    private final RoleCompatibility roleCompatibility;

    public AssignmentPlanner(PlannerSettings settings) {
        this.settings = settings;
        this.roleCompatibility = new RoleCompatibility(settings);
    }

    public AssignmentPlanDto plan(List<TaskDto> tasks, List<ResourceDto> resources) {
        return plan(tasks, resources, LocalDate.now());
    }

    public AssignmentPlanDto plan(List<TaskDto> tasks, List<ResourceDto> resources, LocalDate referenceDate) {
        Objects.requireNonNull(tasks, "tasks");
        Objects.requireNonNull(resources, "resources");
        Objects.requireNonNull(referenceDate, "referenceDate");
        int horizon = settings.planningHorizonWeeks();
        log.info("Planning {} tasks across {} resources over {} weeks", tasks.size(), resources.size(), horizon);

        List<WeeklyLedger> ledgers = new ArrayList<>(resources.size());
        for (ResourceDto resource : resources) {
            ledgers.add(WeeklyLedger.initialize(resource, horizon, referenceDate));
        }

        List<TaskDto> ordered = new ArrayList<>(tasks);
        ordered.sort(TimelineProjector.BY_PRIORITY_DESC);

        List<AssignmentDto> assignments = new ArrayList<>();
        List<UnplacedTaskDto> unplaced = new ArrayList<>();
        int immediate = 0;
        int deferred = 0;
        int overflow = 0;

        for (TaskDto task : ordered) {
            if (!task.hasEstimate()) {
                log.warn("Task '{}' has no estimated hours, skipping", task.title());
                unplaced.add(new UnplacedTaskDto(task.taskId(), task.title(), List.of("No estimated hours")));
                overflow++;
                continue;
            }

            List<String> rejections = new ArrayList<>();
            Candidate best = findBest(task, ledgers, rejections);
            if (best == null) {
                log.warn("Could not assign task '{}' ({}): {}", task.title(),
                        ScheduleFormats.formatHours(task.estimatedHours()), rejections);
                unplaced.add(new UnplacedTaskDto(task.taskId(), task.title(), List.copyOf(rejections)));
                overflow++;
                continue;
            }

            best.ledger().week(best.weekNumber()).place(task, task.estimatedHours());
            assignments.add(new AssignmentDto(task.taskId(), best.ledger().resource().resourceId(),
                    best.weekNumber(), reason(task, best.weekNumber()), false));
            if (best.weekNumber() == 1) {
                immediate++;
            } else {
                deferred++;
            }
            log.debug("Assigned '{}' to {} (week {})", task.title(), best.ledger().resource().name(), best.weekNumber());
        }

        AssignmentSummaryDto summary = new AssignmentSummaryDto(tasks.size(), immediate, deferred, overflow);
        log.info("Assignment completed: {} immediate, {} deferred, {} overflow", immediate, deferred, overflow);
        return new AssignmentPlanDto(referenceDate, horizon, List.copyOf(assignments),
                ledgers.stream().map(l -> l.snapshot(false)).toList(), summary, List.copyOf(unplaced));
    }

    private Candidate findBest(TaskDto task, List<WeeklyLedger> ledgers, List<String> rejections) {
        double hours = task.estimatedHours();
        Candidate best = null;
        for (WeeklyLedger ledger : ledgers) {
            ResourceDto resource = ledger.resource();
            if (!roleCompatibility.isCompatible(task.requiredRole(), resource.role())) {
                rejections.add(resource.name() + ": role '" + resource.role()
                        + "' does not match required role '" + task.requiredRole() + "'");
                continue;
            }
            OptionalInt week = ledger.firstWeekFitting(hours);
            if (week.isEmpty()) {
                rejections.add(resource.name() + ": no week in the next " + ledger.horizonWeeks()
                        + " weeks has " + ScheduleFormats.formatHours(hours) + " free");
                continue;
            }
            double score = score(task, ledger, week.getAsInt());
            // strictly greater: ties stay with the resource evaluated first
            if (best == null || score > best.score()) {
                best = new Candidate(ledger, week.getAsInt(), score);
            }
        }
        return best;
    }

    double score(TaskDto task, WeeklyLedger ledger, int weekNumber) {
        double score = task.priority();
        score += (ledger.horizonWeeks() - weekNumber) * 10;
        score += (1 - ledger.utilization(weekNumber)) * 20;
        if (isHighPriority(task) && weekNumber == 1) {
            score += 50;
        }
        return score;
    }

    private String reason(TaskDto task, int weekNumber) {
        if (weekNumber == 1) {
            return isHighPriority(task) ? "High priority task scheduled immediately" : "Available capacity this week";
        }
        return "Week " + weekNumber + " - scheduled based on capacity and priority";
    }

    private boolean isHighPriority(TaskDto task) {
        return task.priority() >= settings.highPriorityThreshold();
    }

    private record Candidate(WeeklyLedger ledger, int weekNumber, double score) {}
}

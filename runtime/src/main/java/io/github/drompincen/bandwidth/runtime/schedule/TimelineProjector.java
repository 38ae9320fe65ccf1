package io.github.drompincen.bandwidth.runtime.schedule;

import io.github.drompincen.bandwidth.protocol.api.PlacementState;
import io.github.drompincen.bandwidth.protocol.api.PlannerSettings;
import io.github.drompincen.bandwidth.protocol.api.ProjectScheduleDto;
import io.github.drompincen.bandwidth.protocol.api.ResourceDto;
import io.github.drompincen.bandwidth.protocol.api.ResourceScheduleDto;
import io.github.drompincen.bandwidth.protocol.api.TaskDto;
import io.github.drompincen.bandwidth.protocol.api.TaskTimelineDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;

/**
 * Replays already-assigned tasks onto fresh weekly ledgers to estimate when each one
 * starts and ends. Tasks are filled greedily in priority order and may be split
 * across consecutive weeks. Nothing about who does a task is decided here.
 */
@Service
public class TimelineProjector {

    private static final Logger log = LoggerFactory.getLogger(TimelineProjector.class);

    static final Comparator<TaskDto> BY_PRIORITY_DESC =
            Comparator.comparingInt(TaskDto::priority).reversed();

    private final PlannerSettings settings;

    public TimelineProjector(PlannerSettings settings) {
        this.settings = settings;
    }

    public ProjectScheduleDto project(List<TaskDto> tasks) {
        return project(tasks, List.of(), LocalDate.now());
    }

    public ProjectScheduleDto project(List<TaskDto> tasks, LocalDate referenceDate) {
        return project(tasks, List.of(), referenceDate);
    }

    /**
     * @param tasks         task tree; subtasks are visited depth-first after their parent
     * @param resources     explicit resources, taking precedence over assignees embedded in tasks
     * @param referenceDate any day of the first week of the horizon
     */
    public ProjectScheduleDto project(List<TaskDto> tasks, List<ResourceDto> resources, LocalDate referenceDate) {
        Objects.requireNonNull(tasks, "tasks");
        Objects.requireNonNull(referenceDate, "referenceDate");
        int horizon = settings.projectionHorizonWeeks();

        List<TaskDto> flattened = flatten(tasks);
        Map<String, WeeklyLedger> ledgers = new LinkedHashMap<>();
        if (resources != null) {
            for (ResourceDto resource : resources) {
                ledgers.putIfAbsent(resource.resourceId(), WeeklyLedger.initialize(resource, horizon, referenceDate));
            }
        }
        for (TaskDto task : flattened) {
            if (task.assignedTo() == null || task.assignee() == null) continue;
            ledgers.computeIfAbsent(task.assignedTo(),
                    id -> WeeklyLedger.initialize(embeddedResource(id, task.assignee()), horizon, referenceDate));
        }

        Map<String, TaskTimelineDto> timelines = new LinkedHashMap<>();
        for (TaskDto task : flattened) {
            timelines.put(task.taskId(), TaskTimelineDto.unscheduled(task.taskId(), hoursOf(task)));
        }

        List<TaskDto> schedulable = new ArrayList<>();
        for (TaskDto task : flattened) {
            if (task.assignedTo() != null && task.hasEstimate() && task.status() != TaskDto.TaskStatus.COMPLETED) {
                schedulable.add(task);
            }
        }
        schedulable.sort(BY_PRIORITY_DESC);

        int fullyScheduled = 0;
        for (TaskDto task : schedulable) {
            WeeklyLedger ledger = ledgers.get(task.assignedTo());
            if (ledger == null) {
                log.debug("Task {} references unknown resource {}", task.taskId(), task.assignedTo());
                continue;
            }
            TaskTimelineDto timeline = fill(task, ledger);
            timelines.put(task.taskId(), timeline);
            if (timeline.scheduled()) fullyScheduled++;
        }

        Map<String, ResourceScheduleDto> schedules = new LinkedHashMap<>();
        ledgers.forEach((id, ledger) -> schedules.put(id, ledger.snapshot(true)));

        log.info("Projected {} tasks over {} weeks for {} resources: {} fully scheduled",
                schedulable.size(), horizon, ledgers.size(), fullyScheduled);
        return new ProjectScheduleDto(referenceDate,
                Collections.unmodifiableMap(timelines), Collections.unmodifiableMap(schedules));
    }

    private TaskTimelineDto fill(TaskDto task, WeeklyLedger ledger) {
        double required = task.estimatedHours();
        double remaining = required;
        WeekBucket first = null;
        WeekBucket last = null;

        for (WeekBucket week : ledger.weeks()) {
            if (remaining <= 0) break;
            double spare = week.spareHours();
            if (spare <= 0) continue;

            double hours = Math.min(remaining, spare);
            week.place(task, hours);
            remaining -= hours;
            if (first == null) first = week;
            last = week;
        }

        if (first == null) {
            log.debug("No spare capacity for task {} on resource {}", task.taskId(), task.assignedTo());
            return TaskTimelineDto.unscheduled(task.taskId(), required);
        }
        boolean complete = remaining == 0;
        return new TaskTimelineDto(task.taskId(), first.getWeekStart(), last.getWeekEnd(),
                first.getWeekNumber(), last.getWeekNumber(), complete,
                complete ? PlacementState.SCHEDULED : PlacementState.PARTIAL,
                required - remaining, remaining, List.of(), List.of());
    }

    static List<TaskDto> flatten(List<TaskDto> tasks) {
        List<TaskDto> flattened = new ArrayList<>();
        collect(tasks, flattened);
        return flattened;
    }

    private static void collect(List<TaskDto> tasks, List<TaskDto> into) {
        for (TaskDto task : tasks) {
            into.add(task);
            collect(task.subtasksOrEmpty(), into);
        }
    }

    /** Embedded assignees contribute identity and capacity only; committed hours come from explicit resources. */
    private static ResourceDto embeddedResource(String resourceId, ResourceDto assignee) {
        return ResourceDto.of(resourceId, assignee.name(), assignee.role(), assignee.weeklyCapacity());
    }

    private static double hoursOf(TaskDto task) {
        return task.estimatedHours() != null ? task.estimatedHours() : 0;
    }
}

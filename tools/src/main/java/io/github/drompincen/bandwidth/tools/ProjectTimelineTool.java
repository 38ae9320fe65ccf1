package io.github.drompincen.bandwidth.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.bandwidth.protocol.api.PlacementState;
import io.github.drompincen.bandwidth.protocol.api.ProjectScheduleDto;
import io.github.drompincen.bandwidth.protocol.api.ResourceDto;
import io.github.drompincen.bandwidth.protocol.api.TaskDto;
import io.github.drompincen.bandwidth.protocol.api.TaskTimelineDto;
import io.github.drompincen.bandwidth.runtime.schedule.ScheduleFormats;
import io.github.drompincen.bandwidth.runtime.schedule.TimelineProjector;
import io.github.drompincen.bandwidth.runtime.tools.PlanningTool;
import io.github.drompincen.bandwidth.runtime.tools.ProgressListener;
import io.github.drompincen.bandwidth.runtime.tools.ToolResult;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.drompincen.bandwidth.tools.SchedulingJson.MAPPER;

public class ProjectTimelineTool implements PlanningTool {

    private TimelineProjector timelineProjector;

    @Override public String name() { return "project_timeline"; }
    @Override public String description() { return "Project start and end dates for assigned tasks from each resource's weekly capacity."; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = SchedulingJson.baseSchema("tasks");
        ObjectNode taskProps = (ObjectNode) schema.path("properties").path("tasks").path("items").path("properties");
        taskProps.putObject("assignedTo").put("type", "string");
        taskProps.putObject("assignee").put("type", "object");
        taskProps.putObject("subtasks").put("type", "array");
        return schema;
    }

    public void setTimelineProjector(TimelineProjector timelineProjector) {
        this.timelineProjector = timelineProjector;
    }

    @Override
    public ToolResult execute(JsonNode input, ProgressListener progress) {
        if (timelineProjector == null) return ToolResult.failure("Timeline projector not available");
        if (input == null || !input.isObject()) return ToolResult.failure("input must be a JSON object");

        List<TaskDto> tasks;
        List<ResourceDto> resources;
        LocalDate referenceDate;
        try {
            tasks = SchedulingJson.readTasks(input);
            resources = SchedulingJson.readResources(input, false);
            referenceDate = SchedulingJson.readReferenceDate(input);
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }

        ProjectScheduleDto schedule = timelineProjector.project(tasks, resources, referenceDate);

        Map<PlacementState, Integer> counts = new EnumMap<>(PlacementState.class);
        ArrayNode timelinesArr = MAPPER.createArrayNode();
        for (TaskTimelineDto timeline : schedule.timelines().values()) {
            ObjectNode node = MAPPER.valueToTree(timeline);
            node.put("dateRange", ScheduleFormats.formatDateRange(
                    timeline.estimatedStartDate(), timeline.estimatedEndDate()));
            timelinesArr.add(node);
            counts.merge(timeline.state(), 1, Integer::sum);
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("referenceDate", referenceDate.toString());
        result.set("timelines", timelinesArr);
        result.set("resourceSchedules", MAPPER.valueToTree(schedule.resourceSchedules().values()));
        ObjectNode summary = result.putObject("summary");
        summary.put("total", schedule.timelines().size());
        summary.put("scheduled", counts.getOrDefault(PlacementState.SCHEDULED, 0));
        summary.put("partial", counts.getOrDefault(PlacementState.PARTIAL, 0));
        summary.put("unscheduled", counts.getOrDefault(PlacementState.UNSCHEDULED, 0));

        progress.progress(100, "Projected " + schedule.timelines().size() + " task timelines");
        List<String> warnings = new ArrayList<>();
        collectUnknownAssignees(tasks, schedule.resourceSchedules().keySet(), warnings);
        return ToolResult.success(result, warnings);
    }

    private static void collectUnknownAssignees(List<TaskDto> tasks, Set<String> known, List<String> warnings) {
        for (TaskDto task : tasks) {
            if (task.assignedTo() != null && !known.contains(task.assignedTo())) {
                warnings.add("Task " + task.taskId() + " is assigned to unknown resource '" + task.assignedTo() + "'");
            }
            collectUnknownAssignees(task.subtasksOrEmpty(), known, warnings);
        }
    }
}

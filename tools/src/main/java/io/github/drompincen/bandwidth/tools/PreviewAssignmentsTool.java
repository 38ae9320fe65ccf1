package io.github.drompincen.bandwidth.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.bandwidth.protocol.api.AssignmentDto;
import io.github.drompincen.bandwidth.protocol.api.AssignmentPlanDto;
import io.github.drompincen.bandwidth.protocol.api.ResourceDto;
import io.github.drompincen.bandwidth.protocol.api.SchedulingReportDto;
import io.github.drompincen.bandwidth.protocol.api.TaskDto;
import io.github.drompincen.bandwidth.runtime.schedule.AssignmentPlanner;
import io.github.drompincen.bandwidth.runtime.schedule.PlanReportService;
import io.github.drompincen.bandwidth.runtime.schedule.RequiredRoleInference;
import io.github.drompincen.bandwidth.runtime.schedule.ScheduleCalendar;
import io.github.drompincen.bandwidth.runtime.schedule.ScheduleFormats;
import io.github.drompincen.bandwidth.runtime.tools.PlanningTool;
import io.github.drompincen.bandwidth.runtime.tools.ProgressListener;
import io.github.drompincen.bandwidth.runtime.tools.ToolResult;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

import static io.github.drompincen.bandwidth.tools.SchedulingJson.MAPPER;

public class PreviewAssignmentsTool implements PlanningTool {

    private AssignmentPlanner assignmentPlanner;
    private PlanReportService planReportService;

    @Override public String name() { return "preview_assignments"; }
    @Override public String description() { return "Preview bandwidth-aware assignments of unassigned tasks to resources, week by week, without applying them."; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = SchedulingJson.baseSchema("tasks", "resources");
        ObjectNode props = (ObjectNode) schema.get("properties");
        ((ObjectNode) props.path("tasks").path("items").path("properties")).putObject("requiredRole").put("type", "string");
        props.putObject("inferRoles").put("type", "boolean").put("default", true)
                .put("description", "Infer a required role from title and description when a task has none");
        return schema;
    }

    public void setAssignmentPlanner(AssignmentPlanner assignmentPlanner) {
        this.assignmentPlanner = assignmentPlanner;
    }
    public void setPlanReportService(PlanReportService planReportService) {
        this.planReportService = planReportService;
    }

    @Override
    public ToolResult execute(JsonNode input, ProgressListener progress) {
        if (assignmentPlanner == null) return ToolResult.failure("Assignment planner not available");
        if (planReportService == null) return ToolResult.failure("Plan report service not available");
        if (input == null || !input.isObject()) return ToolResult.failure("input must be a JSON object");

        List<TaskDto> tasks;
        List<ResourceDto> resources;
        LocalDate referenceDate;
        try {
            tasks = SchedulingJson.readTasks(input);
            resources = SchedulingJson.readResources(input, true);
            referenceDate = SchedulingJson.readReferenceDate(input);
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }

        if (input.path("inferRoles").asBoolean(true)) {
            tasks = tasks.stream()
                    .map(t -> t.requiredRole() == null
                            ? t.withRequiredRole(RequiredRoleInference.infer(t.title(), t.description()))
                            : t)
                    .collect(Collectors.toList());
        }

        List<String> warnings = new ArrayList<>();
        if (resources.isEmpty() && !tasks.isEmpty()) {
            warnings.add("No resources supplied; all " + tasks.size() + " tasks overflow");
        }

        progress.progress(10, "Planning " + tasks.size() + " tasks across " + resources.size() + " resources");
        AssignmentPlanDto plan = assignmentPlanner.plan(tasks, resources, referenceDate);
        SchedulingReportDto report = planReportService.summarize(plan);

        Map<String, String> resourceNames = new HashMap<>();
        resources.forEach(r -> resourceNames.putIfAbsent(r.resourceId(), r.name()));
        Map<String, String> requiredRoles = new HashMap<>();
        tasks.forEach(t -> requiredRoles.putIfAbsent(t.taskId(), t.requiredRole()));

        ObjectNode result = MAPPER.createObjectNode();
        result.put("referenceDate", referenceDate.toString());
        result.put("horizonWeeks", plan.horizonWeeks());
        ArrayNode assignmentsArr = result.putArray("assignments");
        for (AssignmentDto assignment : plan.assignments()) {
            ObjectNode node = MAPPER.valueToTree(assignment);
            node.put("resourceName", resourceNames.get(assignment.resourceId()));
            node.put("requiredRole", requiredRoles.get(assignment.taskId()));
            node.put("weekRange", ScheduleFormats.formatDateRange(
                    ScheduleCalendar.weekStart(referenceDate, assignment.scheduledWeek()),
                    ScheduleCalendar.weekEnd(referenceDate, assignment.scheduledWeek())));
            assignmentsArr.add(node);
        }
        result.set("unplaced", MAPPER.valueToTree(plan.unplaced()));
        result.set("schedules", MAPPER.valueToTree(plan.schedules()));
        result.set("summary", MAPPER.valueToTree(plan.summary()));
        result.set("report", MAPPER.valueToTree(report));

        progress.progress(100, "Previewed " + plan.assignments().size() + " assignments, "
                + plan.summary().overflowTasks() + " overflow");
        return ToolResult.success(result, warnings);
    }
}

package io.github.drompincen.bandwidth.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.bandwidth.protocol.api.PlannerSettings;
import io.github.drompincen.bandwidth.runtime.schedule.AssignmentPlanner;
import io.github.drompincen.bandwidth.runtime.schedule.PlanReportService;
import io.github.drompincen.bandwidth.runtime.tools.ProgressListener;
import io.github.drompincen.bandwidth.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PreviewAssignmentsToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private ProgressListener progress;

    private PreviewAssignmentsTool tool;

    @BeforeEach
    void setUp() {
        PlannerSettings settings = PlannerSettings.defaults();
        tool = new PreviewAssignmentsTool();
        tool.setAssignmentPlanner(new AssignmentPlanner(settings));
        tool.setPlanReportService(new PlanReportService(settings));
    }

    @Test
    void toolMetadata() {
        assertThat(tool.name()).isEqualTo("preview_assignments");
        assertThat(tool.description()).isNotBlank();
        assertThat(tool.inputSchema().path("required").toString()).isEqualTo("[\"tasks\",\"resources\"]");
    }

    @Test
    void inputSchemaHasPlannerFields() throws Exception {
        String schema = MAPPER.writeValueAsString(tool.inputSchema());
        assertThat(schema).contains("requiredRole");
        assertThat(schema).contains("inferRoles");
        assertThat(schema).contains("weeklyCapacity");
        assertThat(schema).contains("referenceDate");
    }

    @Test
    void failsWithoutAssignmentPlanner() {
        PreviewAssignmentsTool bare = new PreviewAssignmentsTool();

        ToolResult result = bare.execute(input(), progress);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Assignment planner not available");
    }

    @Test
    void failsWithoutReportService() {
        PreviewAssignmentsTool partial = new PreviewAssignmentsTool();
        partial.setAssignmentPlanner(new AssignmentPlanner(PlannerSettings.defaults()));

        ToolResult result = partial.execute(input(), progress);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Plan report service not available");
    }

    @Test
    void assignsByInferredRole() {
        ToolResult result = tool.execute(input(), progress);

        assertThat(result.success()).isTrue();
        JsonNode output = result.output();
        assertThat(output.path("referenceDate").asText()).isEqualTo("2024-05-15");
        assertThat(output.path("horizonWeeks").asInt()).isEqualTo(12);

        JsonNode assignments = output.path("assignments");
        assertThat(assignments.size()).isEqualTo(2);
        JsonNode api = assignments.get(0);
        assertThat(api.path("taskId").asText()).isEqualTo("t1");
        assertThat(api.path("resourceId").asText()).isEqualTo("alice");
        assertThat(api.path("resourceName").asText()).isEqualTo("Alice");
        assertThat(api.path("requiredRole").asText()).isEqualTo("developer");
        assertThat(api.path("scheduledWeek").asInt()).isEqualTo(1);
        assertThat(api.path("weekRange").asText()).isEqualTo("May 13, 2024 - May 19, 2024");
        assertThat(api.path("reason").asText()).isEqualTo("High priority task scheduled immediately");
        assertThat(api.path("overflow").asBoolean()).isFalse();

        JsonNode mockup = assignments.get(1);
        assertThat(mockup.path("taskId").asText()).isEqualTo("t2");
        assertThat(mockup.path("resourceId").asText()).isEqualTo("uma");
        assertThat(mockup.path("requiredRole").asText()).isEqualTo("designer");

        assertThat(output.path("summary").path("immediateAssignments").asInt()).isEqualTo(2);
        assertThat(output.path("summary").path("overflowTasks").asInt()).isZero();
        assertThat(output.path("unplaced").size()).isZero();
        assertThat(output.path("report").path("title").asText()).isEqualTo("Assignment Complete");

        JsonNode aliceWeek1 = output.path("schedules").get(0).path("weeks").get(0);
        assertThat(aliceWeek1.path("weekStart").asText()).isEqualTo("2024-05-13");
        assertThat(aliceWeek1.path("assignedHours").asDouble()).isEqualTo(30.0);
        assertThat(aliceWeek1.path("tasks").get(0).path("taskId").asText()).isEqualTo("t1");

        assertThat(result.hasWarnings()).isFalse();
        verify(progress).progress(eq(10), anyString());
        verify(progress).progress(eq(100), anyString());
    }

    @Test
    void explicitRequiredRoleIsKeptAndCanOverflow() {
        ObjectNode input = input();
        ((ObjectNode) ((ArrayNode) input.get("tasks")).get(0)).put("requiredRole", "manager");

        ToolResult result = tool.execute(input, progress);

        assertThat(result.success()).isTrue();
        JsonNode output = result.output();
        assertThat(output.path("assignments").size()).isEqualTo(1);
        assertThat(output.path("unplaced").size()).isEqualTo(1);
        JsonNode unplaced = output.path("unplaced").get(0);
        assertThat(unplaced.path("taskId").asText()).isEqualTo("t1");
        assertThat(unplaced.path("reasons").get(0).asText())
                .isEqualTo("Alice: role 'Developer' does not match required role 'manager'");
        assertThat(output.path("report").path("title").asText()).isEqualTo("Bandwidth Exceeded");
    }

    @Test
    void inferenceCanBeSwitchedOff() {
        ObjectNode input = input();
        input.put("inferRoles", false);

        ToolResult result = tool.execute(input, progress);

        assertThat(result.success()).isTrue();
        JsonNode assignments = result.output().path("assignments");
        assertThat(assignments.size()).isEqualTo(2);
        assertThat(assignments.get(0).path("requiredRole").isNull()).isTrue();
        assertThat(assignments.get(1).path("requiredRole").isNull()).isTrue();
    }

    @Test
    void emptyResourceListOverflowsEverythingWithWarning() {
        ObjectNode input = input();
        input.putArray("resources");

        ToolResult result = tool.execute(input, progress);

        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).containsExactly("No resources supplied; all 2 tasks overflow");
        assertThat(result.output().path("assignments").size()).isZero();
        assertThat(result.output().path("summary").path("overflowTasks").asInt()).isEqualTo(2);
        assertThat(result.output().path("report").path("title").asText()).isEqualTo("Bandwidth Exceeded");
    }

    @Test
    void missingPriorityDefaultsToFifty() {
        ObjectNode input = input();
        ArrayNode tasks = input.putArray("tasks");
        tasks.addObject().put("taskId", "a").put("title", "Port importer").put("estimatedHours", 30);
        tasks.addObject().put("taskId", "b").put("title", "Port exporter").put("estimatedHours", 30).put("priority", 51);

        ToolResult result = tool.execute(input, progress);

        JsonNode assignments = result.output().path("assignments");
        assertThat(assignments.get(0).path("taskId").asText()).isEqualTo("b");
        assertThat(assignments.get(1).path("taskId").asText()).isEqualTo("a");
    }

    @Test
    void rejectsNonObjectInput() {
        ToolResult result = tool.execute(MAPPER.createArrayNode(), progress);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("input must be a JSON object");
    }

    @Test
    void rejectsMissingResources() {
        ObjectNode input = input();
        input.remove("resources");

        ToolResult result = tool.execute(input, progress);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'resources' must be an array");
        verifyNoInteractions(progress);
    }

    @Test
    void rejectsMissingTasks() {
        ObjectNode input = input();
        input.put("tasks", "t1");

        ToolResult result = tool.execute(input, progress);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'tasks' must be an array");
    }

    @Test
    void rejectsResourceWithoutId() {
        ObjectNode input = input();
        ((ObjectNode) ((ArrayNode) input.get("resources")).get(0)).remove("resourceId");

        ToolResult result = tool.execute(input, progress);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("every resource needs a 'resourceId'");
    }

    @Test
    void rejectsUnknownStatus() {
        ObjectNode input = input();
        ((ObjectNode) ((ArrayNode) input.get("tasks")).get(0)).put("status", "blocked");

        ToolResult result = tool.execute(input, progress);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("invalid task:").contains("blocked");
    }

    @Test
    void rejectsMalformedReferenceDate() {
        ObjectNode input = input();
        input.put("referenceDate", "15/05/2024");

        ToolResult result = tool.execute(input, progress);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'referenceDate' must be an ISO date (yyyy-MM-dd): 15/05/2024");
    }

    private static ObjectNode input() {
        ObjectNode input = MAPPER.createObjectNode();
        input.put("referenceDate", "2024-05-15");
        ArrayNode tasks = input.putArray("tasks");
        tasks.addObject().put("taskId", "t1").put("title", "Implement login API")
                .put("estimatedHours", 30).put("priority", 90).put("status", "pending");
        tasks.addObject().put("taskId", "t2").put("title", "Create landing page mockup")
                .put("estimatedHours", 10);
        ArrayNode resources = input.putArray("resources");
        resources.addObject().put("resourceId", "alice").put("name", "Alice")
                .put("role", "Developer").put("weeklyCapacity", 40);
        resources.addObject().put("resourceId", "uma").put("name", "Uma")
                .put("role", "UX Designer").put("weeklyCapacity", 20);
        return input;
    }
}

package io.github.drompincen.bandwidth.tools;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.bandwidth.protocol.api.ResourceDto;
import io.github.drompincen.bandwidth.protocol.api.TaskDto;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared JSON handling for the planning tools. Malformed input surfaces as
 * {@link IllegalArgumentException} with a message fit for {@code ToolResult.failure}.
 */
final class SchedulingJson {

    static final ObjectMapper MAPPER = createMapper();

    static final int DEFAULT_PRIORITY = 50;

    private SchedulingJson() {}

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    static List<TaskDto> readTasks(JsonNode input) {
        JsonNode tasks = input.path("tasks");
        if (!tasks.isArray()) throw new IllegalArgumentException("'tasks' must be an array");
        List<TaskDto> result = new ArrayList<>();
        for (JsonNode node : tasks) {
            result.add(convert(withDefaultPriority(node), TaskDto.class, "task"));
        }
        return result;
    }

    static List<ResourceDto> readResources(JsonNode input, boolean required) {
        JsonNode resources = input.path("resources");
        if (resources.isMissingNode() || resources.isNull()) {
            if (required) throw new IllegalArgumentException("'resources' must be an array");
            return List.of();
        }
        if (!resources.isArray()) throw new IllegalArgumentException("'resources' must be an array");
        List<ResourceDto> result = new ArrayList<>();
        for (JsonNode node : resources) {
            ResourceDto resource = convert(node, ResourceDto.class, "resource");
            if (resource.resourceId() == null || resource.resourceId().isBlank()) {
                throw new IllegalArgumentException("every resource needs a 'resourceId'");
            }
            result.add(resource);
        }
        return result;
    }

    static LocalDate readReferenceDate(JsonNode input) {
        String text = input.path("referenceDate").asText(null);
        if (text == null || text.isBlank()) return LocalDate.now();
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'referenceDate' must be an ISO date (yyyy-MM-dd): " + text);
        }
    }

    static ObjectNode baseSchema(String... requiredArrays) {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        ObjectNode tasks = props.putObject("tasks").put("type", "array");
        ObjectNode taskProps = tasks.putObject("items").put("type", "object").putObject("properties");
        taskProps.putObject("taskId").put("type", "string");
        taskProps.putObject("title").put("type", "string");
        taskProps.putObject("description").put("type", "string");
        taskProps.putObject("estimatedHours").put("type", "number");
        taskProps.putObject("priority").put("type", "integer").put("default", DEFAULT_PRIORITY);
        taskProps.putObject("status").put("type", "string")
                .putArray("enum").add("pending").add("in_progress").add("completed").add("cancelled");
        ObjectNode resources = props.putObject("resources").put("type", "array");
        ObjectNode resourceProps = resources.putObject("items").put("type", "object").putObject("properties");
        resourceProps.putObject("resourceId").put("type", "string");
        resourceProps.putObject("name").put("type", "string");
        resourceProps.putObject("role").put("type", "string");
        resourceProps.putObject("weeklyCapacity").put("type", "number");
        resourceProps.putObject("committedHours").put("type", "number");
        props.putObject("referenceDate").put("type", "string").put("format", "date");
        ArrayNode required = schema.putArray("required");
        for (String name : requiredArrays) required.add(name);
        return schema;
    }

    private static JsonNode withDefaultPriority(JsonNode node) {
        if (!(node instanceof ObjectNode object)) return node;
        ObjectNode copy = object.deepCopy();
        if (!copy.hasNonNull("priority")) copy.put("priority", DEFAULT_PRIORITY);
        JsonNode subtasks = copy.path("subtasks");
        if (subtasks.isArray()) {
            ArrayNode defaulted = copy.putArray("subtasks");
            for (JsonNode subtask : subtasks) defaulted.add(withDefaultPriority(subtask));
        }
        return copy;
    }

    private static <T> T convert(JsonNode node, Class<T> type, String label) {
        if (!node.isObject()) throw new IllegalArgumentException("every " + label + " must be an object");
        try {
            return MAPPER.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("invalid " + label + ": " + rootMessage(cause), e);
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null) root = root.getCause();
        return root.getMessage() != null ? root.getMessage() : t.getMessage();
    }
}

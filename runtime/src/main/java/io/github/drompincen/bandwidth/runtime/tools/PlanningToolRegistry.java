package io.github.drompincen.bandwidth.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.bandwidth.protocol.api.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class PlanningToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(PlanningToolRegistry.class);
    private final Map<String, PlanningTool> tools = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public PlanningToolRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadTools() {
        for (PlanningTool tool : ServiceLoader.load(PlanningTool.class)) {
            wire(tool);
            register(tool);
        }
        log.info("Loaded {} planning tools via SPI", tools.size());
    }

    public void register(PlanningTool tool) {
        PlanningTool previous = tools.put(tool.name(), tool);
        if (previous != null && previous != tool) {
            log.warn("Planning tool {} replaced {}", tool.name(), previous.getClass().getName());
        }
    }

    public Optional<PlanningTool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<PlanningTool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    /** Runs a tool by name; an unknown name is a failed result, not an exception. */
    public ToolResult execute(String name, JsonNode input, ProgressListener progress) {
        PlanningTool tool = tools.get(name);
        if (tool == null) return ToolResult.failure("Unknown planning tool: " + name);
        log.debug("Executing planning tool {}", name);
        return tool.execute(input, progress != null ? progress : ProgressListener.NONE);
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .sorted(Comparator.comparing(PlanningTool::name))
                .map(t -> new ToolDescriptor(t.name(), t.description(), t.inputSchema()))
                .toList();
    }

    /** Hands each single-argument {@code set*} method the matching bean, if the context has one. */
    void wire(PlanningTool tool) {
        for (Method method : tool.getClass().getMethods()) {
            if (!method.getName().startsWith("set") || method.getParameterCount() != 1) continue;
            Class<?> type = method.getParameterTypes()[0];
            try {
                method.invoke(tool, applicationContext.getBean(type));
            } catch (NoSuchBeanDefinitionException e) {
                log.debug("No bean of type {} for {}.{}", type.getSimpleName(),
                        tool.getClass().getSimpleName(), method.getName());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to wire " + type.getSimpleName() + " into "
                        + tool.getClass().getSimpleName(), e);
            }
        }
    }
}

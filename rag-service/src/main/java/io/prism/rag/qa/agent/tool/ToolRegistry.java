package io.prism.rag.qa.agent.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name to tool mapping, shared by every provider adapter.
 *
 * <p>Schemas are held once; {@link #declarations(ToolFormat)} renders them on demand in a
 * provider's shape.</p>
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry register(Tool tool) {
        Tool previous = tools.putIfAbsent(tool.name(), tool);
        if (previous != null) {
            throw new IllegalStateException("Tool already registered: " + tool.name());
        }
        log.info("Registered tool {}", tool.name());
        return this;
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public List<ToolSchema> schemas() {
        return tools.values().stream().map(Tool::schema).toList();
    }

    public <T> List<T> declarations(ToolFormat<T> format) {
        List<T> out = new ArrayList<>(tools.size());
        for (Tool tool : tools.values()) {
            out.add(format.render(tool.schema()));
        }
        return out;
    }

    /**
     * @throws ToolNotFoundException if no tool is registered under {@code name}
     */
    public ToolResult invoke(String name, Map<String, Object> arguments, ToolContext context) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool.execute(arguments != null ? arguments : Map.of(), context);
    }
}

package io.prism.rag.qa.agent.tool;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code {"type": "function", "function": {"name", "description", "parameters"}}}.
 */
public class OpenAiToolFormat implements ToolFormat<Map<String, Object>> {

    public static final OpenAiToolFormat INSTANCE = new OpenAiToolFormat();

    @Override
    public Map<String, Object> render(ToolSchema schema) {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", schema.name());
        function.put("description", schema.description());
        function.put("parameters", schema.parameters());

        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("type", "function");
        tool.put("function", function);
        return tool;
    }
}

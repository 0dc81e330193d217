package io.prism.rag.qa.agent.tool;

import java.util.Map;

public interface Tool {

    ToolSchema schema();

    ToolResult execute(Map<String, Object> arguments, ToolContext context);

    default String name() {
        return schema().name();
    }
}

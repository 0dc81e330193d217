package io.prism.rag.qa.agent.tool;

import java.util.List;
import java.util.Map;

/**
 * Terminates the loop with the given answer. The agent intercepts calls to it; executing it
 * directly just echoes the answer.
 */
public class FinishTool implements Tool {

    public static final String NAME = "finish";

    private static final ToolSchema SCHEMA = new ToolSchema(
            NAME,
            "Provide the final answer to the user. Call this once you have gathered enough information. "
                    + "Cite sources inline with [[citation:N]].",
            Map.of("answer", ToolSchema.stringParam("The complete final answer, with [[citation:N]] markers")),
            List.of("answer"));

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
        Object answer = arguments.get("answer");
        if (answer == null || answer.toString().isBlank()) {
            return ToolResult.failure("finish requires a non-empty 'answer'");
        }
        return ToolResult.success(answer.toString());
    }
}

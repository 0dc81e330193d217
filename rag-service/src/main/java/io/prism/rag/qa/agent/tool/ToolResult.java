package io.prism.rag.qa.agent.tool;

/**
 * Outcome of a tool call: either content for the model or a structured error.
 */
public sealed interface ToolResult permits ToolResult.Success, ToolResult.Failure {

    /** Text the agent records as the step's observation. */
    String observation();

    static ToolResult success(String content) {
        return new Success(content);
    }

    static ToolResult failure(String message) {
        return new Failure(message);
    }

    record Success(String content) implements ToolResult {
        @Override
        public String observation() {
            return content;
        }
    }

    record Failure(String message) implements ToolResult {
        @Override
        public String observation() {
            return "Error: " + message;
        }
    }
}

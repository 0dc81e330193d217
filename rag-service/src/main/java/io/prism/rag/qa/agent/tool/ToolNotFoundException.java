package io.prism.rag.qa.agent.tool;

public class ToolNotFoundException extends RuntimeException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("Tool '" + toolName + "' not found.");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}

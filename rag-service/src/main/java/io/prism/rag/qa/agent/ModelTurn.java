package io.prism.rag.qa.agent;

/**
 * What the model produced in one call: free text and at most one tool call.
 */
public record ModelTurn(String thought, ToolCall toolCall) {

    public static ModelTurn text(String thought) {
        return new ModelTurn(thought, null);
    }

    public boolean hasToolCall() {
        return toolCall != null;
    }
}

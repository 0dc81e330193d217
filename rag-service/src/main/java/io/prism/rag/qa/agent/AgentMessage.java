package io.prism.rag.qa.agent;

/**
 * Provider-neutral conversation entry. Provider adapters translate it to their wire shape.
 *
 * <ul>
 *   <li>{@code ASSISTANT} entries may carry the tool call the model issued</li>
 *   <li>{@code TOOL} entries carry the observation for {@code toolCall}</li>
 * </ul>
 */
public record AgentMessage(Role role, String content, ToolCall toolCall) {

    public enum Role { SYSTEM, USER, ASSISTANT, TOOL }

    public static AgentMessage system(String content) {
        return new AgentMessage(Role.SYSTEM, content, null);
    }

    public static AgentMessage user(String content) {
        return new AgentMessage(Role.USER, content, null);
    }

    public static AgentMessage assistant(String content) {
        return new AgentMessage(Role.ASSISTANT, content, null);
    }

    public static AgentMessage assistant(String content, ToolCall toolCall) {
        return new AgentMessage(Role.ASSISTANT, content, toolCall);
    }

    public static AgentMessage toolResult(ToolCall toolCall, String observation) {
        return new AgentMessage(Role.TOOL, observation, toolCall);
    }
}

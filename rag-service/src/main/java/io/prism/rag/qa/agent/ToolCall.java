package io.prism.rag.qa.agent;

import java.util.Map;

/**
 * A tool invocation requested by the model. {@code id} is the provider's call id, when it has
 * one.
 */
public record ToolCall(String id, String name, Map<String, Object> arguments) {

    public ToolCall {
        arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
    }
}

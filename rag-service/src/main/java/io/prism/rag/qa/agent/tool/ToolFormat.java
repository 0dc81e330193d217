package io.prism.rag.qa.agent.tool;

/**
 * Renders a {@link ToolSchema} into one provider's native tool declaration.
 */
@FunctionalInterface
public interface ToolFormat<T> {

    T render(ToolSchema schema);
}

package io.prism.rag.qa.agent.provider;

import io.prism.rag.qa.agent.AgentMessage;
import io.prism.rag.qa.agent.ModelTurn;
import io.prism.rag.qa.agent.tool.ToolSchema;

import java.util.List;

/**
 * The agent loop's only view of a language model. Implementations translate the neutral
 * history and tool schemas to their provider's function-calling wire format and back.
 */
public interface ChatProvider {

    /**
     * @param tools tools the model may call; empty to force a plain-text reply
     * @throws ProviderTransientException on rate limits, timeouts and server errors once retries are spent
     * @throws org.springframework.ai.retry.NonTransientAiException on errors a retry cannot fix
     */
    ModelTurn call(List<AgentMessage> history, List<ToolSchema> tools);

    String modelName();
}

package io.prism.rag.qa.agent;

/**
 * Receives events of a run as they happen. An exception thrown here aborts the run.
 */
@FunctionalInterface
public interface AgentEventListener {

    AgentEventListener NOOP = event -> {
    };

    void onEvent(AgentStreamEvent event);
}

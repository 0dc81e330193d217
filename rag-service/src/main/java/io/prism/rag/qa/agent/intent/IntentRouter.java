package io.prism.rag.qa.agent.intent;

/**
 * Classifies a query before the agent loop starts.
 */
public interface IntentRouter {

    IntentClassification classify(String query);
}

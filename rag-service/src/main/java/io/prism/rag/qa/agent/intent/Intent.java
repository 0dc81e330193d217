package io.prism.rag.qa.agent.intent;

public enum Intent {
    /** Greetings and identity questions answered without tools. */
    DIRECT_ANSWER,
    /** A single lookup in the user's documents. */
    DOCUMENT_QA,
    /** Needs current or public information. */
    WEB_SEARCH,
    /** Comparisons, aggregations and other multi-step questions. */
    COMPLEX_REASONING
}

package io.prism.rag.qa.agent.tool;

import io.prism.rag.qa.agent.CitationTracker;

/**
 * Per-run state handed to tools. The user id comes from the caller, never from model output.
 */
public record ToolContext(String userId, CitationTracker citations) {

    public static ToolContext forUser(String userId) {
        return new ToolContext(userId, new CitationTracker());
    }
}

package io.prism.rag.qa.agent.tool;

import java.util.List;

/**
 * Black-box web search backend.
 */
public interface WebSearchClient {

    List<WebSearchHit> search(String query, int maxResults);

    record WebSearchHit(String title, String url, String content) {
    }
}

package io.prism.rag.qa.agent.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prism.rag.qa.agent.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Searches the public web for current information.
 */
@Slf4j
public class WebSearchTool implements Tool {

    public static final String NAME = "web_search";

    private static final ToolSchema SCHEMA = new ToolSchema(
            NAME,
            "Search the web for recent or public information that is not in the user's documents.",
            Map.of(
                    "query", ToolSchema.stringParam("Search query"),
                    "max_results", ToolSchema.integerParam("Maximum number of results (default 5)")),
            List.of("query"));

    private final WebSearchClient client;
    private final ObjectMapper objectMapper;
    private final int defaultMaxResults;

    public WebSearchTool(WebSearchClient client, ObjectMapper objectMapper, int defaultMaxResults) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.defaultMaxResults = defaultMaxResults;
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
        String query = ToolArguments.string(arguments, "query");
        if (query == null) {
            return ToolResult.failure("web_search requires a 'query'");
        }
        int maxResults = ToolArguments.integer(arguments, "max_results", defaultMaxResults, 1, 10);

        List<WebSearchClient.WebSearchHit> hits;
        try {
            hits = client.search(query, maxResults);
        } catch (RestClientException e) {
            log.warn("web_search failed for query \"{}\": {}", query, e.getMessage());
            return ToolResult.failure("Web search failed: " + e.getMessage());
        }

        if (hits.isEmpty()) {
            return ToolResult.success("No web results found for \"" + query + "\".");
        }

        List<Map<String, Object>> items = new ArrayList<>(hits.size());
        for (WebSearchClient.WebSearchHit hit : hits) {
            String key = hit.url() != null ? hit.url() : hit.title();
            int citation = context.citations().cite(key, null, hit.title(),
                    DocumentSearchTool.snippet(hit.content()), hit.url(), Source.SourceType.WEB);

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("citation", citation);
            item.put("title", hit.title());
            item.put("url", hit.url());
            item.put("content", hit.content());
            items.add(item);
        }

        try {
            return ToolResult.success(objectMapper.writeValueAsString(items));
        } catch (JsonProcessingException e) {
            return ToolResult.failure("Cannot render web results: " + e.getOriginalMessage());
        }
    }
}

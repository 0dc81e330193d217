package io.prism.rag.qa.agent.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * {@link WebSearchClient} for a Tavily-compatible {@code POST /search} API.
 */
public class RestWebSearchClient implements WebSearchClient {

    private final RestClient restClient;
    private final String apiKey;

    public RestWebSearchClient(RestClient restClient, String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    @Override
    public List<WebSearchHit> search(String query, int maxResults) {
        SearchResponse response = restClient.post()
                .uri("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new SearchRequest(apiKey, query, maxResults))
                .retrieve()
                .body(SearchResponse.class);

        if (response == null || response.results() == null) {
            return List.of();
        }
        return response.results().stream()
                .map(r -> new WebSearchHit(r.title(), r.url(), r.content()))
                .toList();
    }

    record SearchRequest(@JsonProperty("api_key") String apiKey,
                         String query,
                         @JsonProperty("max_results") int maxResults) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<Result> results) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Result(String title, String url, String content) {
        }
    }
}

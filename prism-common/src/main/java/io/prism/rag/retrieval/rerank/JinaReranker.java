package io.prism.rag.retrieval.rerank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Remote cross-encoder reranker calling the Jina rerank API.
 */
@Slf4j
public class JinaReranker extends AbstractReranker {

    private final RestClient restClient;
    private final String apiKey;
    private final String model;

    public JinaReranker(RestClient restClient, String apiKey, String model) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public String name() {
        return "jina";
    }

    @Override
    protected List<RerankResult> doRerank(String query, List<String> documents, int topN) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new RerankException("Jina API key is not configured");
        }

        RerankResponse response;
        try {
            response = restClient.post()
                    .uri("/v1/rerank")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> h.setBearerAuth(apiKey))
                    .body(new RerankRequest(model, query, topN, documents, false))
                    .retrieve()
                    .body(RerankResponse.class);
        } catch (RestClientException e) {
            throw new RerankException("Jina rerank request failed: " + e.getMessage(), e);
        }

        if (response == null || response.results() == null) {
            throw new RerankException("Jina rerank returned no results");
        }

        List<RerankResult> results = new ArrayList<>(response.results().size());
        for (RerankResponse.Item item : response.results()) {
            if (item.index() < 0 || item.index() >= documents.size()) {
                throw new RerankException("Jina rerank returned out-of-range index " + item.index());
            }
            results.add(new RerankResult(item.index(), item.relevanceScore()));
        }
        return results;
    }

    record RerankRequest(String model,
                         String query,
                         @JsonProperty("top_n") int topN,
                         List<String> documents,
                         @JsonProperty("return_documents") boolean returnDocuments) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RerankResponse(List<Item> results) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Item(int index, @JsonProperty("relevance_score") double relevanceScore) {
        }
    }
}

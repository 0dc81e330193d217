package io.prism.rag.vector.chroma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Request and response bodies of the Chroma REST API.
 */
public final class ChromaModels {

    private ChromaModels() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreateCollection(String name,
                                   @JsonProperty("get_or_create") boolean getOrCreate,
                                   Map<String, Object> metadata) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Collection {
        private String id;
        private String name;
    }

    public record AddRequest(List<String> ids,
                             List<List<Double>> embeddings,
                             List<String> documents,
                             List<Map<String, Object>> metadatas) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QueryRequest(@JsonProperty("query_embeddings") List<List<Double>> queryEmbeddings,
                               @JsonProperty("n_results") int nResults,
                               Map<String, Object> where,
                               List<String> include) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryResult {
        private List<List<String>> ids;
        private List<List<String>> documents;
        private List<List<Map<String, Object>>> metadatas;
        private List<List<Double>> distances;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GetRequest(Map<String, Object> where, List<String> include) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GetResult {
        private List<String> ids;
    }
}

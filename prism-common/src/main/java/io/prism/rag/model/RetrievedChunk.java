package io.prism.rag.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Chunk as returned by the retrieval service to tools and API callers.
 *
 * <p>Vector-only results carry a {@code distance}; hybrid results carry the fused score and
 * {@code distance = 1 - fusedScore}. Reranking adds {@code rerankScore}.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrievedChunk {

    private String id;
    private String text;
    private Map<String, Object> metadata;
    private Double distance;

    @JsonProperty("vector_score")
    private Double vectorScore;

    @JsonProperty("bm25_score")
    private Double bm25Score;

    @JsonProperty("fused_score")
    private Double fusedScore;

    @JsonProperty("rerank_score")
    private Double rerankScore;

    public int chunkIndex() {
        return Chunk.chunkIndexOf(metadata);
    }

    public double distanceOrDefault() {
        return distance != null ? distance : 1.0d;
    }
}

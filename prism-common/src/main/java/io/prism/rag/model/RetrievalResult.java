package io.prism.rag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Transient result of a hybrid search: one chunk with its component and fused scores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResult {

    private String chunkId;
    private String text;
    private Map<String, Object> metadata;

    /** Vector similarity (higher is better), {@code null} when the chunk came only from BM25. */
    private Double vectorScore;

    /** Raw BM25 score, {@code null} when the chunk came only from the vector search. */
    private Double bm25Score;

    /** Reciprocal Rank Fusion score. */
    private double fusedScore;

    public int chunkIndex() {
        return Chunk.chunkIndexOf(metadata);
    }
}

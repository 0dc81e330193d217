package io.prism.rag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters of a single retrieval request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalQuery {

    private String query;

    private String userId;

    /** Scopes the search to one document; required for hybrid mode. */
    private String documentId;

    @Builder.Default
    private RetrievalMode mode = RetrievalMode.HYBRID;

    @Builder.Default
    private int topK = 10;

    @Builder.Default
    private boolean rerank = true;

    /** Number of chunks kept after reranking; falls back to the configured default. */
    private Integer rerankTopN;
}

package io.prism.rag.qa.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.prism.rag.model.RetrievalMode;
import io.prism.rag.model.RetrievalQuery;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request payload of {@code POST /api/retrieval/search}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalRequest {

    private String query;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("document_id")
    private String documentId;

    @Builder.Default
    private RetrievalMode mode = RetrievalMode.HYBRID;

    @Builder.Default
    @JsonProperty("top_k")
    private int topK = 10;

    @Builder.Default
    private boolean rerank = true;

    @JsonProperty("rerank_top_n")
    private Integer rerankTopN;

    public RetrievalQuery toQuery() {
        return RetrievalQuery.builder()
                .query(query)
                .userId(userId)
                .documentId(documentId)
                .mode(mode)
                .topK(topK)
                .rerank(rerank)
                .rerankTopN(rerankTopN)
                .build();
    }
}

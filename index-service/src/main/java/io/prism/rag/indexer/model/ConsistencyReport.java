package io.prism.rag.indexer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of one document's presence in both stores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyReport {

    @JsonProperty("document_id")
    private String documentId;

    @JsonProperty("vector_count")
    private int vectorCount;

    @JsonProperty("bm25_present")
    private boolean bm25Present;

    @JsonProperty("bm25_chunk_count")
    private int bm25ChunkCount;

    private boolean consistent;
}

package io.prism.rag.indexer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteResult {

    @JsonProperty("document_id")
    private String documentId;

    @JsonProperty("vectors_deleted")
    private int vectorsDeleted;

    @JsonProperty("bm25_deleted")
    private boolean bm25Deleted;
}

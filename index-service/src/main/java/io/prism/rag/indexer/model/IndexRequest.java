package io.prism.rag.indexer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An already chunked document to be written to the vector store and the BM25 store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexRequest {

    @JsonProperty("document_id")
    private String documentId;

    @JsonProperty("user_id")
    private String userId;

    @Builder.Default
    private List<ChunkPayload> chunks = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChunkPayload {

        private String text;

        /** Position in the document; defaults to the position in {@code chunks}. */
        private Integer index;

        /** {@code section_path}, {@code page_number}, {@code element_type} and similar. */
        private Map<String, Object> metadata;
    }
}

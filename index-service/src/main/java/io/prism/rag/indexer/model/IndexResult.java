package io.prism.rag.indexer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexResult {

    public enum Status { INDEXED, FAILED }

    @JsonProperty("document_id")
    private String documentId;

    private boolean succeeded;

    private Status status;

    /** Chunks that were skipped (blank text or no embedding). */
    @Builder.Default
    @JsonProperty("failed_chunk_ids")
    private List<String> failedChunkIds = new ArrayList<>();

    @JsonProperty("chunk_count")
    private int chunkCount;

    @JsonProperty("duration_ms")
    private long durationMs;

    private String error;
}

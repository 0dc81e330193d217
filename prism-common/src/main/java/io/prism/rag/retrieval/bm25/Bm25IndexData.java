package io.prism.rag.retrieval.bm25;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Persisted per-document BM25 artifact.
 *
 * <p>Maps are sorted so that serializing the same index twice yields identical bytes. The index
 * is rebuilt wholesale whenever its document is re-ingested.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Bm25IndexData {

    public static final int FORMAT_VERSION = 1;

    private String documentId;

    @Builder.Default
    private int version = FORMAT_VERSION;

    private Instant builtAt;

    private int chunkCount;

    private double averageChunkLength;

    /** Sorted distinct terms of the document. */
    @Builder.Default
    private List<String> vocabulary = new ArrayList<>();

    /** Term to number of chunks containing it. */
    @Builder.Default
    private SortedMap<String, Integer> documentFrequencies = new TreeMap<>();

    /** Term to ascending ordinals (positions in {@link #chunks}) of the chunks containing it. */
    @Builder.Default
    private SortedMap<String, List<Integer>> postings = new TreeMap<>();

    @Builder.Default
    private List<IndexedChunk> chunks = new ArrayList<>();

    public boolean isEmpty() {
        return chunks == null || chunks.isEmpty();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexedChunk {

        private String chunkId;
        private int chunkIndex;
        private String text;
        private Map<String, Object> metadata;

        /** Number of terms in the chunk. */
        private int length;

        @Builder.Default
        private SortedMap<String, Integer> termFrequencies = new TreeMap<>();
    }
}

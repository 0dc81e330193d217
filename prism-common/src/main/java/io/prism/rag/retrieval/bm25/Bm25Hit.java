package io.prism.rag.retrieval.bm25;

import java.util.Map;

/**
 * One scored chunk returned by {@link Bm25SearchEngine#search(String, int)}.
 */
public record Bm25Hit(String chunkId, int chunkIndex, String text, Map<String, Object> metadata, double score) {
}

package io.prism.rag.retrieval.rerank;

import io.prism.rag.model.RetrievedChunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-scores an already retrieved candidate set.
 */
public interface Reranker {

    /**
     * @param topN number of results wanted; clamped to {@code documents.size()}
     * @return results ordered best first, each pointing into {@code documents}
     */
    List<RerankResult> rerank(String query, List<String> documents, int topN);

    String name();

    /**
     * Reranks chunks by their text and records the relevance as {@code rerankScore}.
     */
    default List<RetrievedChunk> rerankChunks(String query, List<RetrievedChunk> chunks, int topN) {
        List<String> texts = chunks.stream()
                .map(c -> c.getText() != null ? c.getText() : "")
                .toList();
        List<RerankResult> ranked = rerank(query, texts, topN);
        List<RetrievedChunk> out = new ArrayList<>(ranked.size());
        for (RerankResult result : ranked) {
            out.add(chunks.get(result.index()).toBuilder()
                    .rerankScore(result.relevanceScore())
                    .build());
        }
        return out;
    }
}

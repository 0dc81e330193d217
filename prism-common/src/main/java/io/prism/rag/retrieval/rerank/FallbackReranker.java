package io.prism.rag.retrieval.rerank;

import io.prism.rag.model.RetrievedChunk;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Tries the primary reranker and falls back to the rule-based one on any exception. Failures
 * are logged, never propagated.
 */
@Slf4j
public class FallbackReranker implements Reranker {

    private final Reranker primary;
    private final RuleBasedReranker fallback;

    public FallbackReranker(Reranker primary, RuleBasedReranker fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public String name() {
        return primary.name() + "+fallback";
    }

    @Override
    public List<RerankResult> rerank(String query, List<String> documents, int topN) {
        try {
            return primary.rerank(query, documents, topN);
        } catch (Exception e) {
            log.warn("Reranker {} failed, using rule-based fallback: {}", primary.name(), e.getMessage());
            return fallback.rerank(query, documents, topN);
        }
    }

    @Override
    public List<RetrievedChunk> rerankChunks(String query, List<RetrievedChunk> chunks, int topN) {
        try {
            return primary.rerankChunks(query, chunks, topN);
        } catch (Exception e) {
            log.warn("Reranker {} failed on {} chunks, using rule-based fallback: {}",
                    primary.name(), chunks.size(), e.getMessage());
            return fallback.rerankChunks(query, chunks, topN);
        }
    }
}

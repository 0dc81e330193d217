package io.prism.rag.retrieval.rerank;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Clamps {@code topN}, short-circuits empty input and logs timing around {@link #doRerank}.
 */
@Slf4j
public abstract class AbstractReranker implements Reranker {

    @Override
    public final List<RerankResult> rerank(String query, List<String> documents, int topN) {
        if (documents == null || documents.isEmpty() || topN <= 0) {
            return List.of();
        }
        int clamped = Math.min(topN, documents.size());
        long start = System.currentTimeMillis();

        List<RerankResult> results = doRerank(query, documents, clamped);

        log.info("{} reranked {} documents to top {} in {}ms",
                name(), documents.size(), clamped, System.currentTimeMillis() - start);
        return results.size() > clamped ? results.subList(0, clamped) : results;
    }

    protected abstract List<RerankResult> doRerank(String query, List<String> documents, int topN);
}

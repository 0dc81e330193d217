package io.prism.rag.retrieval.rerank;

/**
 * A reranked position: {@code index} points into the list passed to the reranker.
 */
public record RerankResult(int index, double relevanceScore) {
}

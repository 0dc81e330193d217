package io.prism.rag.retrieval.rerank;

/**
 * Raised by a remote reranker. {@link FallbackReranker} catches it and never lets it reach
 * the caller.
 */
public class RerankException extends RuntimeException {

    public RerankException(String message) {
        super(message);
    }

    public RerankException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.prism.rag.retrieval;

/**
 * Embedding or store failure on the read path. Surfaced to the caller, never retried here,
 * and distinct from an empty result.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}

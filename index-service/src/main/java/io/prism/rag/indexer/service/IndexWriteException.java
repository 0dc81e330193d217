package io.prism.rag.indexer.service;

/**
 * A store rejected a write before anything for the document was changed.
 */
public class IndexWriteException extends RuntimeException {

    public IndexWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

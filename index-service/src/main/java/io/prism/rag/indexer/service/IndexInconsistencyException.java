package io.prism.rag.indexer.service;

/**
 * The vector store and the BM25 store disagree about a document and the manager could not
 * restore agreement. The document needs an external repair.
 */
public class IndexInconsistencyException extends RuntimeException {

    private final String documentId;

    public IndexInconsistencyException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}

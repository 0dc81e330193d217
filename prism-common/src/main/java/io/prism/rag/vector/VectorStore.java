package io.prism.rag.vector;

import java.util.List;

/**
 * Port to the dense vector index holding every user's chunks.
 */
public interface VectorStore {

    void add(List<VectorEntry> entries);

    /**
     * Nearest-neighbour search restricted to one user's chunks and, when {@code documentId} is
     * not {@code null}, to one document.
     */
    List<VectorMatch> query(List<Double> embedding, String userId, String documentId, int limit);

    void deleteByDocument(String documentId);

    int countByDocument(String documentId);
}

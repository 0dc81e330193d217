package io.prism.rag.retrieval.bm25;

import java.util.Optional;

/**
 * Durable store of per-document BM25 indexes.
 *
 * <p>Implementations must make {@link #save} atomic per document: a concurrent {@link #load}
 * observes either the previous complete index or the new one, never a mix.</p>
 */
public interface Bm25IndexStore {

    void save(String documentId, Bm25IndexData data);

    Optional<Bm25IndexData> load(String documentId);

    /**
     * Removes the index for the document.
     *
     * @return {@code true} if an index existed and was removed
     */
    boolean delete(String documentId);

    boolean exists(String documentId);
}

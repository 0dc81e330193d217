package io.prism.rag.retrieval.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.prism.rag.model.RetrievedChunk;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Caches vector-only retrieval results per scope and query for a fixed time-to-live.
 *
 * <p>Backed by Caffeine, so concurrent reads and writes are safe and each put replaces the
 * entry atomically.</p>
 */
public class ChunkCache {

    public static final String ALL_DOCUMENTS = "all_docs";

    private final Cache<String, List<RetrievedChunk>> cache;

    public ChunkCache(Duration ttl, long maxSize) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .build();
    }

    public Optional<List<RetrievedChunk>> get(String userId, String documentId, String query, int topK) {
        return Optional.ofNullable(cache.getIfPresent(key(userId, documentId, query, topK)));
    }

    public void put(String userId, String documentId, String query, int topK, List<RetrievedChunk> chunks) {
        cache.put(key(userId, documentId, query, topK), List.copyOf(chunks));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static String key(String userId, String documentId, String query, int topK) {
        return "chunks:" + (userId != null ? userId : "") + ':'
                + (documentId != null ? documentId : ALL_DOCUMENTS) + ':'
                + topK + ':' + query;
    }
}

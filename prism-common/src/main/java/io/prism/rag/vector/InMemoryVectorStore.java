package io.prism.rag.vector;

import io.prism.rag.model.Chunk;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vector store kept in process memory, using exact cosine distance.
 *
 * <p>Used for local runs and tests; production deployments point at Chroma.</p>
 */
@Slf4j
public class InMemoryVectorStore implements VectorStore {

    private final Map<String, VectorEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void add(List<VectorEntry> batch) {
        for (VectorEntry entry : batch) {
            entries.put(entry.id(), entry);
        }
        log.debug("Added {} vectors (total {})", batch.size(), entries.size());
    }

    @Override
    public List<VectorMatch> query(List<Double> embedding, String userId, String documentId, int limit) {
        if (embedding == null || embedding.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<VectorMatch> matches = new ArrayList<>();
        for (VectorEntry entry : entries.values()) {
            Map<String, Object> metadata = entry.metadata();
            if (userId != null && !Objects.equals(userId, metadata.get(Chunk.USER_ID))) {
                continue;
            }
            if (documentId != null && !Objects.equals(documentId, metadata.get(Chunk.DOCUMENT_ID))) {
                continue;
            }
            matches.add(new VectorMatch(entry.id(), entry.text(), metadata,
                    cosineDistance(embedding, entry.embedding())));
        }
        matches.sort(Comparator.comparingDouble(VectorMatch::distance)
                .thenComparingInt(VectorMatch::chunkIndex));
        return matches.size() > limit ? new ArrayList<>(matches.subList(0, limit)) : matches;
    }

    @Override
    public void deleteByDocument(String documentId) {
        entries.values().removeIf(entry -> Objects.equals(documentId, entry.metadata().get(Chunk.DOCUMENT_ID)));
    }

    @Override
    public int countByDocument(String documentId) {
        return (int) entries.values().stream()
                .filter(entry -> Objects.equals(documentId, entry.metadata().get(Chunk.DOCUMENT_ID)))
                .count();
    }

    static double cosineDistance(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException(
                    "Embedding dimension mismatch: query=" + a.size() + ", stored=" + b.size());
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0 || normB == 0) {
            return 1.0d;
        }
        return 1.0d - dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

package io.prism.rag.vector;

import io.prism.rag.model.Chunk;

import java.util.Map;

/**
 * A vector search hit. {@code distance} is cosine distance: lower is closer.
 */
public record VectorMatch(String id, String text, Map<String, Object> metadata, double distance) {

    public double similarity() {
        return 1.0d - distance;
    }

    public int chunkIndex() {
        return Chunk.chunkIndexOf(metadata);
    }
}

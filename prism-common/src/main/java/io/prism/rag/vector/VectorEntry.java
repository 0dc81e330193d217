package io.prism.rag.vector;

import java.util.List;
import java.util.Map;

/**
 * A chunk ready to be written to a vector store.
 */
public record VectorEntry(String id, String text, List<Double> embedding, Map<String, Object> metadata) {
}

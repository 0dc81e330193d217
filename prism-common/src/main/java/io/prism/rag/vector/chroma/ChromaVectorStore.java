package io.prism.rag.vector.chroma;

import io.prism.rag.model.Chunk;
import io.prism.rag.vector.VectorEntry;
import io.prism.rag.vector.VectorMatch;
import io.prism.rag.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link VectorStore} backed by a Chroma server collection.
 *
 * <p>The collection id is resolved lazily with get-or-create and cached. Metadata values are
 * flattened to the scalar types Chroma accepts.</p>
 */
@Slf4j
public class ChromaVectorStore implements VectorStore {

    private static final List<String> QUERY_INCLUDE = List.of("documents", "metadatas", "distances");

    private final ChromaCollectionApi api;
    private final String collectionName;

    private volatile String collectionId;

    public ChromaVectorStore(ChromaCollectionApi api, String collectionName) {
        this.api = api;
        this.collectionName = collectionName;
    }

    @Override
    public void add(List<VectorEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        List<String> ids = new ArrayList<>(entries.size());
        List<List<Double>> embeddings = new ArrayList<>(entries.size());
        List<String> documents = new ArrayList<>(entries.size());
        List<Map<String, Object>> metadatas = new ArrayList<>(entries.size());

        for (VectorEntry entry : entries) {
            ids.add(entry.id());
            embeddings.add(entry.embedding());
            documents.add(entry.text());
            metadatas.add(flatten(entry.metadata()));
        }

        api.add(collectionId(), new ChromaModels.AddRequest(ids, embeddings, documents, metadatas));
        log.debug("Added {} vectors to Chroma collection {}", entries.size(), collectionName);
    }

    @Override
    public List<VectorMatch> query(List<Double> embedding, String userId, String documentId, int limit) {
        if (embedding == null || embedding.isEmpty() || limit <= 0) {
            return List.of();
        }
        ChromaModels.QueryRequest request = new ChromaModels.QueryRequest(
                List.of(embedding), limit, buildWhere(userId, documentId), QUERY_INCLUDE);
        ChromaModels.QueryResult result = api.query(collectionId(), request);

        if (result == null || result.getIds() == null || result.getIds().isEmpty()) {
            return List.of();
        }

        List<String> ids = result.getIds().get(0);
        List<VectorMatch> matches = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            String text = firstRow(result.getDocuments()) != null ? firstRow(result.getDocuments()).get(i) : null;
            Map<String, Object> metadata = firstRow(result.getMetadatas()) != null
                    ? firstRow(result.getMetadatas()).get(i) : Map.of();
            double distance = firstRow(result.getDistances()) != null ? firstRow(result.getDistances()).get(i) : 1.0d;
            matches.add(new VectorMatch(ids.get(i), text, metadata != null ? metadata : Map.of(), distance));
        }
        return matches;
    }

    @Override
    public void deleteByDocument(String documentId) {
        api.delete(collectionId(), Map.of("where", Map.of(Chunk.DOCUMENT_ID, Map.of("$eq", documentId))));
        log.info("Deleted Chroma vectors for document {}", documentId);
    }

    @Override
    public int countByDocument(String documentId) {
        ChromaModels.GetResult result = api.get(collectionId(),
                new ChromaModels.GetRequest(Map.of(Chunk.DOCUMENT_ID, Map.of("$eq", documentId)), List.of()));
        return result == null || result.getIds() == null ? 0 : result.getIds().size();
    }

    static Map<String, Object> buildWhere(String userId, String documentId) {
        List<Map<String, Object>> conditions = new ArrayList<>();
        if (userId != null) {
            conditions.add(Map.of(Chunk.USER_ID, Map.of("$eq", userId)));
        }
        if (documentId != null) {
            conditions.add(Map.of(Chunk.DOCUMENT_ID, Map.of("$eq", documentId)));
        }
        if (conditions.isEmpty()) {
            return null;
        }
        return conditions.size() == 1 ? conditions.get(0) : Map.of("$and", conditions);
    }

    private String collectionId() {
        String id = collectionId;
        if (id != null) {
            return id;
        }
        synchronized (this) {
            if (collectionId == null) {
                try {
                    ChromaModels.Collection collection = api.getOrCreate(
                            new ChromaModels.CreateCollection(collectionName, true, Map.of("hnsw:space", "cosine")));
                    collectionId = collection.getId();
                    log.info("Resolved Chroma collection {} -> {}", collectionName, collectionId);
                } catch (HttpClientErrorException e) {
                    throw new IllegalStateException("Cannot resolve Chroma collection " + collectionName, e);
                }
            }
            return collectionId;
        }
    }

    private static Map<String, Object> flatten(Map<String, Object> metadata) {
        Map<String, Object> flat = new LinkedHashMap<>();
        if (metadata == null) {
            return flat;
        }
        metadata.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                flat.put(key, value);
            } else {
                flat.put(key, value.toString());
            }
        });
        return flat;
    }

    private static <T> List<T> firstRow(List<List<T>> rows) {
        return rows == null || rows.isEmpty() ? null : rows.get(0);
    }
}

package io.prism.rag.indexer.service;

import io.prism.rag.concurrent.DocumentLocks;
import io.prism.rag.indexer.model.ConsistencyReport;
import io.prism.rag.indexer.model.DeleteResult;
import io.prism.rag.indexer.model.IndexRequest;
import io.prism.rag.indexer.model.IndexResult;
import io.prism.rag.model.Chunk;
import io.prism.rag.retrieval.bm25.Bm25IndexBuilder;
import io.prism.rag.retrieval.bm25.Bm25IndexData;
import io.prism.rag.retrieval.bm25.Bm25IndexStore;
import io.prism.rag.service.EmbeddingService;
import io.prism.rag.service.InvalidRequestException;
import io.prism.rag.vector.VectorEntry;
import io.prism.rag.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns every write to the vector store and the BM25 store.
 *
 * <p>After any completed call a document is either present in both stores or absent from both.
 * Indexing order:
 * <ol>
 *   <li>Embed the chunks in batches</li>
 *   <li>Build the BM25 index in memory</li>
 *   <li>Clear whatever the document had in both stores</li>
 *   <li>Write the vectors; on failure remove the partial vectors</li>
 *   <li>Save the BM25 index; on failure remove the vectors</li>
 * </ol>
 *
 * <p>A re-index that fails while embedding or building leaves the previous content in place. One
 * that fails while writing to a store leaves the document absent from both.</p>
 *
 * <p>A failed rollback raises {@link IndexInconsistencyException}. Calls for the same document
 * are serialized; different documents proceed in parallel.</p>
 */
@Slf4j
@Service
public class IndexManager {

    private final VectorStore vectorStore;
    private final Bm25IndexStore bm25IndexStore;
    private final EmbeddingService embeddingService;
    private final Bm25IndexBuilder bm25IndexBuilder;
    private final Clock clock;

    private final DocumentLocks documentLocks = new DocumentLocks();

    @Autowired
    public IndexManager(VectorStore vectorStore, Bm25IndexStore bm25IndexStore, EmbeddingService embeddingService) {
        this(vectorStore, bm25IndexStore, embeddingService, Clock.systemUTC());
    }

    IndexManager(VectorStore vectorStore, Bm25IndexStore bm25IndexStore,
                 EmbeddingService embeddingService, Clock clock) {
        this.vectorStore = vectorStore;
        this.bm25IndexStore = bm25IndexStore;
        this.embeddingService = embeddingService;
        this.bm25IndexBuilder = new Bm25IndexBuilder(clock);
        this.clock = clock;
    }

    public IndexResult indexDocument(IndexRequest request) {
        validate(request);
        String documentId = request.getDocumentId();
        long start = System.currentTimeMillis();

        documentLocks.lock(documentId);
        try {
            List<String> failedChunkIds = new ArrayList<>();
            List<Chunk> chunks = toChunks(request, failedChunkIds);

            if (chunks.isEmpty()) {
                return failed(documentId, failedChunkIds, 0, start, "Document has no indexable chunks");
            }

            // 1) Embed
            List<List<Double>> embeddings;
            try {
                embeddings = embeddingService.embedBatch(chunks.stream().map(Chunk::getText).toList());
            } catch (RuntimeException e) {
                log.error("Embedding failed for document {}: {}", documentId, e.getMessage());
                return failed(documentId, failedChunkIds, 0, start, "Embedding failed: " + e.getMessage());
            }

            List<Chunk> embedded = new ArrayList<>(chunks.size());
            List<VectorEntry> entries = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                Chunk chunk = chunks.get(i);
                List<Double> vector = embeddings.get(i);
                if (vector == null || vector.isEmpty()) {
                    failedChunkIds.add(chunk.getId());
                    continue;
                }
                embedded.add(chunk);
                entries.add(new VectorEntry(chunk.getId(), chunk.getText(), vector, chunk.getMetadata()));
            }
            if (embedded.isEmpty()) {
                return failed(documentId, failedChunkIds, 0, start, "No chunk produced an embedding");
            }

            // 2) BM25 build
            Bm25IndexData index;
            try {
                index = bm25IndexBuilder.build(documentId, embedded);
            } catch (RuntimeException e) {
                log.error("BM25 build failed for document {}: {}", documentId, e.getMessage());
                return failed(documentId, failedChunkIds, 0, start, "BM25 index build failed: " + e.getMessage());
            }

            // Everything above runs before the previous content is touched.
            clear(documentId);

            // 3) Vectors
            try {
                for (int from = 0; from < entries.size(); from += EmbeddingService.BATCH_SIZE) {
                    vectorStore.add(entries.subList(from, Math.min(from + EmbeddingService.BATCH_SIZE, entries.size())));
                }
            } catch (RuntimeException e) {
                log.error("Vector write failed for document {}, rolling back: {}", documentId, e.getMessage());
                rollbackVectors(documentId, e);
                return failed(documentId, failedChunkIds, 0, start, "Vector store write failed: " + e.getMessage());
            }

            // 4) BM25 save
            try {
                bm25IndexStore.save(documentId, index);
            } catch (RuntimeException e) {
                log.error("BM25 save failed for document {}, rolling back vectors: {}", documentId, e.getMessage());
                rollbackVectors(documentId, e);
                return failed(documentId, failedChunkIds, 0, start, "BM25 index save failed: " + e.getMessage());
            }

            long duration = System.currentTimeMillis() - start;
            log.info("Indexed document {}: {} chunks ({} skipped) in {}ms",
                    documentId, embedded.size(), failedChunkIds.size(), duration);

            return IndexResult.builder()
                    .documentId(documentId)
                    .succeeded(true)
                    .status(IndexResult.Status.INDEXED)
                    .failedChunkIds(failedChunkIds)
                    .chunkCount(embedded.size())
                    .durationMs(duration)
                    .build();
        } finally {
            documentLocks.unlock(documentId);
        }
    }

    public DeleteResult deleteDocument(String documentId) {
        requireDocumentId(documentId);
        documentLocks.lock(documentId);
        try {
            int vectors = vectorStore.countByDocument(documentId);
            boolean bm25Deleted = clear(documentId);
            log.info("Deleted document {} ({} vectors, bm25={})", documentId, vectors, bm25Deleted);
            return DeleteResult.builder()
                    .documentId(documentId)
                    .vectorsDeleted(vectors)
                    .bm25Deleted(bm25Deleted)
                    .build();
        } finally {
            documentLocks.unlock(documentId);
        }
    }

    public ConsistencyReport checkConsistency(String documentId) {
        requireDocumentId(documentId);
        int vectorCount = vectorStore.countByDocument(documentId);
        Optional<Bm25IndexData> index = bm25IndexStore.load(documentId);
        int bm25Chunks = index.map(Bm25IndexData::getChunkCount).orElse(0);

        boolean consistent = index.isPresent()
                ? vectorCount == bm25Chunks
                : vectorCount == 0;

        if (!consistent) {
            log.warn("Document {} is inconsistent: {} vectors, bm25 present={} ({} chunks)",
                    documentId, vectorCount, index.isPresent(), bm25Chunks);
        }
        return ConsistencyReport.builder()
                .documentId(documentId)
                .vectorCount(vectorCount)
                .bm25Present(index.isPresent())
                .bm25ChunkCount(bm25Chunks)
                .consistent(consistent)
                .build();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Removes vectors first, then the BM25 index. A BM25 failure after the vectors are gone
     * leaves the pair split, which is reported as an inconsistency.
     */
    private boolean clear(String documentId) {
        try {
            vectorStore.deleteByDocument(documentId);
        } catch (RuntimeException e) {
            throw new IndexWriteException("Cannot clear vectors of document " + documentId, e);
        }
        try {
            return bm25IndexStore.delete(documentId);
        } catch (RuntimeException e) {
            log.error("BM25 delete failed for document {} after its vectors were removed", documentId, e);
            throw new IndexInconsistencyException(documentId,
                    "Vectors removed but BM25 index could not be deleted for document " + documentId, e);
        }
    }

    private void rollbackVectors(String documentId, RuntimeException cause) {
        try {
            vectorStore.deleteByDocument(documentId);
        } catch (RuntimeException rollbackFailure) {
            rollbackFailure.addSuppressed(cause);
            log.error("Rollback of vectors failed for document {}; stores are inconsistent", documentId, rollbackFailure);
            throw new IndexInconsistencyException(documentId,
                    "Rollback failed, vector store holds entries without a BM25 index for document " + documentId,
                    rollbackFailure);
        }
    }

    private List<Chunk> toChunks(IndexRequest request, List<String> failedChunkIds) {
        String documentId = request.getDocumentId();
        String createdAt = clock.instant().toString();
        Set<Integer> seen = new HashSet<>();
        List<Chunk> chunks = new ArrayList<>(request.getChunks().size());

        for (int position = 0; position < request.getChunks().size(); position++) {
            IndexRequest.ChunkPayload payload = request.getChunks().get(position);
            int index = payload.getIndex() != null ? payload.getIndex() : position;
            if (!seen.add(index)) {
                throw new InvalidRequestException("Duplicate chunk index " + index + " in document " + documentId);
            }
            if (payload.getText() == null || payload.getText().isBlank()) {
                failedChunkIds.add(Chunk.idFor(documentId, index));
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (payload.getMetadata() != null) {
                metadata.putAll(payload.getMetadata());
            }
            metadata.put(Chunk.USER_ID, request.getUserId());
            metadata.put(Chunk.CREATED_AT, createdAt);
            chunks.add(new Chunk(documentId, payload.getText(), index, metadata));
        }
        return chunks;
    }

    private static IndexResult failed(String documentId, List<String> failedChunkIds,
                                      int chunkCount, long start, String error) {
        return IndexResult.builder()
                .documentId(documentId)
                .succeeded(false)
                .status(IndexResult.Status.FAILED)
                .failedChunkIds(failedChunkIds)
                .chunkCount(chunkCount)
                .durationMs(System.currentTimeMillis() - start)
                .error(error)
                .build();
    }

    private static void validate(IndexRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }
        requireDocumentId(request.getDocumentId());
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new InvalidRequestException("user_id must not be blank");
        }
        if (request.getChunks() == null || request.getChunks().isEmpty()) {
            throw new InvalidRequestException("chunks must not be empty");
        }
    }

    private static void requireDocumentId(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new InvalidRequestException("document_id must not be blank");
        }
    }
}

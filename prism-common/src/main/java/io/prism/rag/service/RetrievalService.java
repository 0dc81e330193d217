package io.prism.rag.service;

import io.prism.rag.config.RetrievalProperties;
import io.prism.rag.model.RetrievalMode;
import io.prism.rag.model.RetrievalQuery;
import io.prism.rag.model.RetrievalResult;
import io.prism.rag.model.RetrievedChunk;
import io.prism.rag.retrieval.HybridRetriever;
import io.prism.rag.retrieval.RetrievalException;
import io.prism.rag.retrieval.cache.ChunkCache;
import io.prism.rag.retrieval.rerank.Reranker;
import io.prism.rag.vector.VectorMatch;
import io.prism.rag.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Single entry point of the read path used by the API and by agent tools.
 *
 * <p>Workflow:
 * <ol>
 *   <li>Resolve the mode: hybrid needs a document id and degrades to vector search without one</li>
 *   <li>Vector mode: serve from the chunk cache, otherwise embed, search and cache</li>
 *   <li>Hybrid mode: embed and run {@link HybridRetriever}</li>
 *   <li>Rerank the retrieved set when both the request and the configuration allow it</li>
 * </ol>
 *
 * <p>Embedding and store failures surface as {@link RetrievalException}; an empty list always
 * means nothing matched.</p>
 */
@Slf4j
public class RetrievalService {

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final HybridRetriever hybridRetriever;
    private final Reranker reranker;
    private final ChunkCache chunkCache;
    private final RetrievalProperties properties;

    public RetrievalService(EmbeddingService embeddingService,
                            VectorStore vectorStore,
                            HybridRetriever hybridRetriever,
                            Reranker reranker,
                            ChunkCache chunkCache,
                            RetrievalProperties properties) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.hybridRetriever = hybridRetriever;
        this.reranker = reranker;
        this.chunkCache = chunkCache;
        this.properties = properties;
    }

    public List<RetrievedChunk> retrieve(RetrievalQuery request) {
        validate(request);
        long start = System.currentTimeMillis();
        int topK = Math.min(request.getTopK(), properties.getMaxTopK());

        RetrievalMode mode = request.getMode() != null ? request.getMode() : RetrievalMode.HYBRID;
        if (mode == RetrievalMode.HYBRID && request.getDocumentId() == null) {
            log.info("Hybrid search needs a document id; falling back to vector search for query \"{}\"",
                    request.getQuery());
            mode = RetrievalMode.VECTOR;
        }

        List<RetrievedChunk> chunks = mode == RetrievalMode.HYBRID
                ? hybridSearch(request.getQuery(), request.getUserId(), request.getDocumentId(), topK)
                : vectorSearch(request.getQuery(), request.getUserId(), request.getDocumentId(), topK);

        if (request.isRerank() && properties.isRerankEnabled() && !chunks.isEmpty()) {
            int topN = request.getRerankTopN() != null ? request.getRerankTopN() : properties.getRerankTopN();
            chunks = reranker.rerankChunks(request.getQuery(), chunks, topN);
        }

        log.info("Retrieved {} chunks (mode={}, topK={}) in {}ms",
                chunks.size(), mode.wireName(), topK, System.currentTimeMillis() - start);
        return chunks;
    }

    public List<RetrievedChunk> vectorSearch(String query, String userId, String documentId, int topK) {
        Optional<List<RetrievedChunk>> cached = chunkCache.get(userId, documentId, query, topK);
        if (cached.isPresent()) {
            log.debug("Chunk cache hit for query \"{}\" (document={})", query, documentId);
            return cached.get();
        }

        List<Double> embedding = embedQuery(query);
        List<VectorMatch> matches;
        try {
            matches = vectorStore.query(embedding, userId, documentId, topK);
        } catch (RuntimeException e) {
            throw new RetrievalException("Vector search failed: " + e.getMessage(), e);
        }

        List<RetrievedChunk> chunks = matches.stream()
                .map(match -> RetrievedChunk.builder()
                        .id(match.id())
                        .text(match.text())
                        .metadata(match.metadata())
                        .distance(match.distance())
                        .vectorScore(match.similarity())
                        .build())
                .toList();

        chunkCache.put(userId, documentId, query, topK, chunks);
        return chunks;
    }

    public List<RetrievedChunk> hybridSearch(String query, String userId, String documentId, int topK) {
        List<Double> embedding = embedQuery(query);
        List<RetrievalResult> results = hybridRetriever.search(query, documentId, userId, embedding, topK);

        return results.stream()
                .map(result -> RetrievedChunk.builder()
                        .id(result.getChunkId())
                        .text(result.getText())
                        .metadata(result.getMetadata())
                        .distance(1.0d - result.getFusedScore())
                        .vectorScore(result.getVectorScore())
                        .bm25Score(result.getBm25Score())
                        .fusedScore(result.getFusedScore())
                        .build())
                .toList();
    }

    /**
     * Drops cached results. Intended for tests and for callers that just re-indexed content.
     */
    public void reset() {
        chunkCache.invalidateAll();
    }

    private List<Double> embedQuery(String query) {
        List<Double> embedding;
        try {
            embedding = embeddingService.embedQuery(query);
        } catch (RuntimeException e) {
            throw new RetrievalException("Query embedding failed: " + e.getMessage(), e);
        }
        if (embedding.isEmpty()) {
            throw new RetrievalException("Embedding provider returned an empty vector for the query");
        }
        return embedding;
    }

    private static void validate(RetrievalQuery request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new InvalidRequestException("query must not be blank");
        }
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new InvalidRequestException("user_id must not be blank");
        }
        if (request.getTopK() <= 0) {
            throw new InvalidRequestException("top_k must be positive");
        }
        if (request.getRerankTopN() != null && request.getRerankTopN() <= 0) {
            throw new InvalidRequestException("rerank_top_n must be positive");
        }
    }
}

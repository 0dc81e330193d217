package io.prism.rag.retrieval;

import io.prism.rag.model.Chunk;
import io.prism.rag.model.RetrievalResult;
import io.prism.rag.retrieval.bm25.Bm25Hit;
import io.prism.rag.retrieval.bm25.Bm25IndexData;
import io.prism.rag.retrieval.bm25.Bm25IndexStore;
import io.prism.rag.retrieval.bm25.Bm25SearchEngine;
import io.prism.rag.vector.VectorMatch;
import io.prism.rag.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs vector and BM25 search for one document concurrently and fuses them with
 * {@link RrfFusion}.
 *
 * <p>Workflow:
 * <ol>
 *   <li>Submit the vector query and the BM25 query to the retrieval executor</li>
 *   <li>Join both within the configured timeout</li>
 *   <li>Fuse the two ranked lists; an empty list simply contributes nothing</li>
 * </ol>
 *
 * <p>BM25 indexes are per document, so a search without a document id runs the vector query
 * alone and ranks it through the same fusion. BM25 hits whose {@code user_id} differs from the
 * caller are dropped, the same restriction the vector store applies.</p>
 *
 * <p>Both queries run as {@link FutureTask}s, so a timeout or an interrupted caller interrupts
 * whichever query is still running.</p>
 */
@Slf4j
public class HybridRetriever {

    private final VectorStore vectorStore;
    private final Bm25IndexStore bm25IndexStore;
    private final RrfFusion fusion;
    private final Executor executor;
    private final int candidateMultiplier;
    private final Duration timeout;
    private final double k1;
    private final double b;

    public HybridRetriever(VectorStore vectorStore,
                           Bm25IndexStore bm25IndexStore,
                           RrfFusion fusion,
                           Executor executor,
                           int candidateMultiplier,
                           Duration timeout,
                           double k1,
                           double b) {
        this.vectorStore = vectorStore;
        this.bm25IndexStore = bm25IndexStore;
        this.fusion = fusion;
        this.executor = executor;
        this.candidateMultiplier = Math.max(1, candidateMultiplier);
        this.timeout = timeout;
        this.k1 = k1;
        this.b = b;
    }

    public List<RetrievalResult> search(String query, String documentId, String userId,
                                        List<Double> queryEmbedding, int k) {
        if (k <= 0) {
            return List.of();
        }
        long start = System.currentTimeMillis();
        int candidates = k * candidateMultiplier;

        long deadline = System.nanoTime() + timeout.toNanos();

        FutureTask<List<VectorMatch>> vectorTask = submit(
                () -> vectorStore.query(queryEmbedding, userId, documentId, candidates));
        FutureTask<List<Bm25Hit>> bm25Task = documentId == null
                ? null
                : submit(() -> bm25Search(query, documentId, userId, candidates));

        List<VectorMatch> vectorResults;
        List<Bm25Hit> bm25Results;
        try {
            vectorResults = await(vectorTask, deadline);
            bm25Results = bm25Task != null ? await(bm25Task, deadline) : List.of();
        } catch (TimeoutException e) {
            cancel(vectorTask, bm25Task);
            throw new RetrievalException("Hybrid search timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            cancel(vectorTask, bm25Task);
            Thread.currentThread().interrupt();
            throw new RetrievalException("Hybrid search interrupted", e);
        } catch (ExecutionException e) {
            cancel(vectorTask, bm25Task);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RetrievalException retrievalException) {
                throw retrievalException;
            }
            throw new RetrievalException("Hybrid search failed: " + cause.getMessage(), cause);
        }

        List<RetrievalResult> fused = fusion.fuse(vectorResults, bm25Results, k);

        log.info("Hybrid search completed: {} results (vector={}, bm25={}) in {}ms for document {}",
                fused.size(), vectorResults.size(), bm25Results.size(),
                System.currentTimeMillis() - start, documentId);
        return fused;
    }

    List<Bm25Hit> bm25Search(String query, String documentId, String userId, int candidates) {
        Optional<Bm25IndexData> index;
        try {
            index = bm25IndexStore.load(documentId);
        } catch (RuntimeException e) {
            throw new RetrievalException("Cannot load BM25 index for document " + documentId, e);
        }
        if (index.isEmpty()) {
            log.warn("No BM25 index for document {}; ranking from vector results only", documentId);
            return List.of();
        }
        List<Bm25Hit> hits = new Bm25SearchEngine(index.get(), k1, b).search(query, candidates);
        List<Bm25Hit> owned = hits.stream()
                .filter(hit -> hit.metadata() != null && Objects.equals(userId, hit.metadata().get(Chunk.USER_ID)))
                .toList();
        if (owned.size() < hits.size()) {
            log.debug("Dropped {} BM25 hits of document {} not owned by user {}",
                    hits.size() - owned.size(), documentId, userId);
        }
        return owned;
    }

    private <T> FutureTask<T> submit(Callable<T> query) {
        FutureTask<T> task = new FutureTask<>(query);
        executor.execute(task);
        return task;
    }

    private static <T> T await(Future<T> task, long deadline)
            throws InterruptedException, ExecutionException, TimeoutException {
        return task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    private static void cancel(Future<?>... tasks) {
        for (Future<?> task : tasks) {
            if (task != null) {
                task.cancel(true);
            }
        }
    }
}

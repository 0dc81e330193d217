package io.prism.rag.indexer.service;

import io.prism.rag.indexer.config.IndexingExecutorConfig.IndexingJobProperties;
import io.prism.rag.indexer.model.IndexRequest;
import io.prism.rag.indexer.model.IndexResult;
import io.prism.rag.indexer.model.IndexingJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;

/**
 * Runs indexing requests as asynchronous jobs and tracks their state.
 *
 * <p>Finished jobs stay queryable for {@code prism.index.jobs.retention}, and only the newest
 * {@code prism.index.jobs.max-finished} of them are kept.</p>
 */
@Slf4j
@Service
public class IndexingService {

    private final IndexManager indexManager;
    private final Executor indexingExecutor;
    private final Duration retention;
    private final int maxFinishedJobs;
    private final Clock clock;

    private final Map<String, IndexingJob> jobsById = new ConcurrentHashMap<>();

    // Finished jobs in completion order, oldest first.
    private final Deque<IndexingJob> finishedJobs = new ConcurrentLinkedDeque<>();

    @Autowired
    public IndexingService(IndexManager indexManager,
                           @Qualifier("indexingExecutor") Executor indexingExecutor,
                           IndexingJobProperties jobProperties) {
        this(indexManager, indexingExecutor, jobProperties.getRetention(), jobProperties.getMaxFinished(),
                Clock.systemUTC());
    }

    IndexingService(IndexManager indexManager, Executor indexingExecutor,
                    Duration retention, int maxFinishedJobs, Clock clock) {
        this.indexManager = indexManager;
        this.indexingExecutor = indexingExecutor;
        this.retention = retention;
        this.maxFinishedJobs = Math.max(0, maxFinishedJobs);
        this.clock = clock;
    }

    public IndexingJob startIndexing(IndexRequest request) {
        evictFinishedJobs();
        IndexingJob job = new IndexingJob(UUID.randomUUID().toString(), request.getDocumentId());
        jobsById.put(job.getJobId(), job);
        log.info("Started indexing job {} for document {}", job.getJobId(), request.getDocumentId());

        CompletableFuture.runAsync(() -> runJob(job, request), indexingExecutor);
        return job;
    }

    public IndexingJob getJob(String jobId) {
        IndexingJob job = jobsById.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    public Collection<IndexingJob> getAllJobs() {
        evictFinishedJobs();
        return jobsById.values();
    }

    private void runJob(IndexingJob job, IndexRequest request) {
        try {
            IndexResult result = indexManager.indexDocument(request);
            job.complete(result);
            log.info("Indexing job {} finished: status={}, chunks={}",
                    job.getJobId(), job.getStatus(), result.getChunkCount());
        } catch (IndexInconsistencyException e) {
            job.markInconsistent(e.getMessage());
            log.error("Indexing job {} left document {} inconsistent", job.getJobId(), e.getDocumentId(), e);
        } catch (Exception e) {
            job.fail(e.getMessage());
            log.error("Indexing job {} failed", job.getJobId(), e);
        } finally {
            finishedJobs.addLast(job);
            evictFinishedJobs();
        }
    }

    private synchronized void evictFinishedJobs() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        IndexingJob oldest;
        while ((oldest = finishedJobs.peekFirst()) != null
                && (finishedJobs.size() > maxFinishedJobs || completedBefore(oldest, cutoff))) {
            finishedJobs.pollFirst();
            jobsById.remove(oldest.getJobId());
            evicted++;
        }
        if (evicted > 0) {
            log.debug("Evicted {} finished indexing jobs", evicted);
        }
    }

    private static boolean completedBefore(IndexingJob job, Instant cutoff) {
        return job.getCompletedAt() == null || job.getCompletedAt().isBefore(cutoff);
    }
}

package io.prism.rag.indexer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

@Getter
@RequiredArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexingJob {

    public enum JobStatus { RUNNING, COMPLETED, FAILED, INCONSISTENT }

    private final String jobId;

    private final String documentId;

    private volatile JobStatus status = JobStatus.RUNNING;

    private final Instant startedAt = Instant.now();
    private volatile Instant completedAt;

    private volatile int chunkCount;
    private volatile int failedChunkCount;
    private volatile String error;

    public void complete(IndexResult result) {
        chunkCount = result.getChunkCount();
        failedChunkCount = result.getFailedChunkIds().size();
        if (result.isSucceeded()) {
            status = JobStatus.COMPLETED;
        } else {
            status = JobStatus.FAILED;
            error = result.getError();
        }
        completedAt = Instant.now();
    }

    public void fail(String message) {
        status = JobStatus.FAILED;
        error = message;
        completedAt = Instant.now();
    }

    public void markInconsistent(String message) {
        status = JobStatus.INCONSISTENT;
        error = message;
        completedAt = Instant.now();
    }
}

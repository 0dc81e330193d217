package io.prism.rag.indexer.service;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Unknown indexing job: " + jobId);
    }
}

package io.prism.rag.indexer.controller;

import io.prism.rag.indexer.model.ConsistencyReport;
import io.prism.rag.indexer.model.DeleteResult;
import io.prism.rag.indexer.model.IndexRequest;
import io.prism.rag.indexer.model.IndexResult;
import io.prism.rag.indexer.model.IndexingJob;
import io.prism.rag.indexer.service.IndexManager;
import io.prism.rag.indexer.service.IndexingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;

/**
 * REST endpoints of the write path.
 */
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
public class IndexController {

    private final IndexManager indexManager;
    private final IndexingService indexingService;

    /**
     * Indexes a chunked document synchronously. A failed write that was rolled back answers
     * 502 with the result body.
     */
    @PostMapping("/documents")
    public ResponseEntity<IndexResult> indexDocument(@RequestBody IndexRequest request) {
        IndexResult result = indexManager.indexDocument(request);
        return ResponseEntity.status(result.isSucceeded() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY).body(result);
    }

    @PostMapping("/documents/async")
    public ResponseEntity<IndexingJob> indexDocumentAsync(@RequestBody IndexRequest request) {
        return ResponseEntity.accepted().body(indexingService.startIndexing(request));
    }

    @GetMapping("/jobs/{jobId}")
    public IndexingJob getJob(@PathVariable String jobId) {
        return indexingService.getJob(jobId);
    }

    @GetMapping("/jobs")
    public Collection<IndexingJob> getJobs() {
        return indexingService.getAllJobs();
    }

    @DeleteMapping("/documents/{documentId}")
    public DeleteResult deleteDocument(@PathVariable String documentId) {
        return indexManager.deleteDocument(documentId);
    }

    @GetMapping("/documents/{documentId}/consistency")
    public ConsistencyReport checkConsistency(@PathVariable String documentId) {
        return indexManager.checkConsistency(documentId);
    }
}

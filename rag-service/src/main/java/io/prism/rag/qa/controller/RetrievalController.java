package io.prism.rag.qa.controller;

import io.prism.rag.model.RetrievedChunk;
import io.prism.rag.qa.model.RetrievalRequest;
import io.prism.rag.service.RetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Exposes {@link RetrievalService} directly. An empty list means no match; failures answer
 * with an error status.
 */
@RestController
@RequestMapping("/api/retrieval")
@RequiredArgsConstructor
public class RetrievalController {

    private final RetrievalService retrievalService;

    @PostMapping("/search")
    public List<RetrievedChunk> search(@RequestBody RetrievalRequest request) {
        return retrievalService.retrieve(request.toQuery());
    }
}

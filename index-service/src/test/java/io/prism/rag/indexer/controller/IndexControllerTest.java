package io.prism.rag.indexer.controller;

import io.prism.rag.indexer.model.IndexResult;
import io.prism.rag.indexer.service.IndexInconsistencyException;
import io.prism.rag.indexer.service.IndexManager;
import io.prism.rag.indexer.service.IndexingService;
import io.prism.rag.indexer.service.JobNotFoundException;
import io.prism.rag.service.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class IndexControllerTest {

    private static final String BODY = """
            {"document_id":"doc","user_id":"alice","chunks":[{"text":"hello","index":0}]}
            """;

    private final IndexManager indexManager = mock(IndexManager.class);
    private final IndexingService indexingService = mock(IndexingService.class);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new IndexController(indexManager, indexingService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void successfulIndexAnswersOk() throws Exception {
        when(indexManager.indexDocument(any())).thenReturn(IndexResult.builder()
                .documentId("doc").succeeded(true).status(IndexResult.Status.INDEXED).chunkCount(1).build());

        mvc.perform(post("/api/index/documents").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document_id").value("doc"))
                .andExpect(jsonPath("$.chunk_count").value(1));
    }

    @Test
    void rolledBackIndexAnswersBadGateway() throws Exception {
        when(indexManager.indexDocument(any())).thenReturn(IndexResult.builder()
                .documentId("doc").succeeded(false).status(IndexResult.Status.FAILED).error("disk full").build());

        mvc.perform(post("/api/index/documents").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("disk full"));
    }

    @Test
    void invalidRequestAnswersBadRequest() throws Exception {
        when(indexManager.indexDocument(any())).thenThrow(new InvalidRequestException("chunks must not be empty"));

        mvc.perform(post("/api/index/documents").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("chunks must not be empty"));
    }

    @Test
    void inconsistencyAnswersConflict() throws Exception {
        when(indexManager.indexDocument(any())).thenThrow(
                new IndexInconsistencyException("doc", "rollback failed", new IllegalStateException()));

        mvc.perform(post("/api/index/documents").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict());
    }

    @Test
    void unknownJobAnswersNotFound() throws Exception {
        when(indexingService.getJob("nope")).thenThrow(new JobNotFoundException("nope"));

        mvc.perform(get("/api/index/jobs/nope")).andExpect(status().isNotFound());
    }
}

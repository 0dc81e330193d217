package io.prism.rag.qa.controller;

import io.prism.rag.model.RetrievalQuery;
import io.prism.rag.model.RetrievedChunk;
import io.prism.rag.retrieval.RetrievalException;
import io.prism.rag.service.InvalidRequestException;
import io.prism.rag.service.RetrievalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RetrievalControllerTest {

    private final RetrievalService retrievalService = mock(RetrievalService.class);

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RetrievalController(retrievalService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void returnsRetrievedChunks() throws Exception {
        when(retrievalService.retrieve(any())).thenReturn(List.of(RetrievedChunk.builder()
                .id("report#2")
                .text("Revenue grew 12%.")
                .metadata(Map.of("document_id", "report"))
                .distance(0.2)
                .build()));

        mockMvc.perform(post("/api/retrieval/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue\",\"user_id\":\"alice\",\"document_id\":\"report\",\"top_k\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("report#2"))
                .andExpect(jsonPath("$[0].distance").value(0.2));

        ArgumentCaptor<RetrievalQuery> query = ArgumentCaptor.forClass(RetrievalQuery.class);
        verify(retrievalService).retrieve(query.capture());
        assertThat(query.getValue().getTopK()).isEqualTo(3);
        assertThat(query.getValue().getDocumentId()).isEqualTo("report");
    }

    @Test
    void emptyResultIsNotAnError() throws Exception {
        when(retrievalService.retrieve(any())).thenReturn(List.of());

        mockMvc.perform(post("/api/retrieval/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"nothing\",\"user_id\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void retrievalFailureIsBadGateway() throws Exception {
        when(retrievalService.retrieve(any())).thenThrow(new RetrievalException("Vector store unavailable"));

        mockMvc.perform(post("/api/retrieval/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue\",\"user_id\":\"alice\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value(502))
                .andExpect(jsonPath("$.message").value("Vector store unavailable"));
    }

    @Test
    void invalidRequestIsBadRequest() throws Exception {
        when(retrievalService.retrieve(any())).thenThrow(new InvalidRequestException("user_id is required"));

        mockMvc.perform(post("/api/retrieval/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("user_id is required"));
    }

    @Test
    void rejectedModelCallIsBadGateway() throws Exception {
        when(retrievalService.retrieve(any())).thenThrow(new NonTransientAiException("embedding rejected"));

        mockMvc.perform(post("/api/retrieval/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue\",\"user_id\":\"alice\"}"))
                .andExpect(status().isBadGateway());
    }
}

package io.prism.rag.qa.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prism.rag.model.RetrievalMode;
import io.prism.rag.model.RetrievalQuery;
import io.prism.rag.model.RetrievedChunk;
import io.prism.rag.qa.agent.Source;
import io.prism.rag.retrieval.RetrievalException;
import io.prism.rag.service.RetrievalService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DocumentSearchToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RetrievalService retrievalService = mock(RetrievalService.class);
    private final DocumentSearchTool tool = new DocumentSearchTool(retrievalService, objectMapper);

    private static RetrievedChunk chunk(String id, Double rerankScore) {
        return RetrievedChunk.builder()
                .id(id)
                .text("text of " + id)
                .metadata(Map.of("document_id", "report", "section_path", "Results", "page_number", 4))
                .distance(0.25)
                .rerankScore(rerankScore)
                .build();
    }

    @Test
    void searchesAsCallerAndNumbersCitations() throws Exception {
        when(retrievalService.retrieve(any())).thenReturn(List.of(chunk("report_chunk_3", 0.9), chunk("report_chunk_7", null)));
        ToolContext context = ToolContext.forUser("alice");

        ToolResult result = tool.execute(Map.of("query", "revenue", "user_id", "mallory", "k", "50"), context);

        ArgumentCaptor<RetrievalQuery> captor = ArgumentCaptor.forClass(RetrievalQuery.class);
        verify(retrievalService).retrieve(captor.capture());
        RetrievalQuery query = captor.getValue();
        assertThat(query.getUserId()).isEqualTo("alice");
        assertThat(query.getTopK()).isEqualTo(DocumentSearchTool.MAX_K);
        assertThat(query.getMode()).isEqualTo(RetrievalMode.HYBRID);

        JsonNode items = objectMapper.readTree(result.observation());
        assertThat(items).hasSize(2);
        assertThat(items.get(0).path("citation").asInt()).isEqualTo(1);
        assertThat(items.get(0).path("section").asText()).isEqualTo("Results");
        assertThat(items.get(0).path("page").asInt()).isEqualTo(4);
        assertThat(items.get(0).path("relevance_score").asDouble()).isEqualTo(0.9);
        assertThat(items.get(1).path("relevance_score").asDouble()).isEqualTo(0.75);

        assertThat(context.citations().sources()).extracting(Source::sourceType)
                .containsOnly(Source.SourceType.PDF);
    }

    @Test
    void repeatedChunkKeepsItsCitation() throws Exception {
        when(retrievalService.retrieve(any()))
                .thenReturn(List.of(chunk("a", null)))
                .thenReturn(List.of(chunk("b", null), chunk("a", null)));
        ToolContext context = ToolContext.forUser("alice");

        tool.execute(Map.of("query", "first"), context);
        JsonNode second = objectMapper.readTree(tool.execute(Map.of("query", "second"), context).observation());

        assertThat(second.get(0).path("citation").asInt()).isEqualTo(2);
        assertThat(second.get(1).path("citation").asInt()).isEqualTo(1);
        assertThat(context.citations().size()).isEqualTo(2);
    }

    @Test
    void missingQueryIsToolError() {
        ToolResult result = tool.execute(Map.of(), ToolContext.forUser("alice"));

        assertThat(result.observation()).isEqualTo("Error: document_search requires a 'query'");
    }

    @Test
    void retrievalFailureIsToolError() {
        when(retrievalService.retrieve(any())).thenThrow(new RetrievalException("vector store down"));

        ToolResult result = tool.execute(Map.of("query", "revenue"), ToolContext.forUser("alice"));

        assertThat(result).isInstanceOf(ToolResult.Failure.class);
        assertThat(result.observation()).contains("vector store down");
    }

    @Test
    void noResultsIsReportedAsContent() {
        when(retrievalService.retrieve(any())).thenReturn(List.of());

        ToolResult result = tool.execute(Map.of("query", "revenue"), ToolContext.forUser("alice"));

        assertThat(result).isInstanceOf(ToolResult.Success.class);
        assertThat(result.observation()).contains("No relevant passages");
    }

    @Test
    void snippetIsCapped() {
        assertThat(DocumentSearchTool.snippet("y".repeat(500))).hasSize(DocumentSearchTool.SNIPPET_LENGTH);
        assertThat(DocumentSearchTool.snippet(null)).isEmpty();
    }
}

package io.prism.rag.qa.agent.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prism.rag.model.Chunk;
import io.prism.rag.model.RetrievalMode;
import io.prism.rag.model.RetrievalQuery;
import io.prism.rag.model.RetrievedChunk;
import io.prism.rag.qa.agent.Source;
import io.prism.rag.retrieval.RetrievalException;
import io.prism.rag.service.RetrievalService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Searches the user's uploaded documents through {@link RetrievalService}.
 *
 * <p>The observation is a JSON array; each item carries the {@code citation} number the model
 * must use to reference it.</p>
 */
@Slf4j
public class DocumentSearchTool implements Tool {

    public static final String NAME = "document_search";

    static final int DEFAULT_K = 10;
    static final int MAX_K = 20;
    static final int SNIPPET_LENGTH = 200;

    private static final ToolSchema SCHEMA = new ToolSchema(
            NAME,
            "Search the user's uploaded documents for passages relevant to a query. "
                    + "Use one focused query per entity or sub-question.",
            Map.of(
                    "query", ToolSchema.stringParam("What to search for"),
                    "document_id", ToolSchema.stringParam("Restrict the search to one document (optional)"),
                    "k", ToolSchema.integerParam("Number of passages to return (default 10)")),
            List.of("query"));

    private final RetrievalService retrievalService;
    private final ObjectMapper objectMapper;

    public DocumentSearchTool(RetrievalService retrievalService, ObjectMapper objectMapper) {
        this.retrievalService = retrievalService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
        String query = ToolArguments.string(arguments, "query");
        if (query == null) {
            return ToolResult.failure("document_search requires a 'query'");
        }
        String documentId = ToolArguments.string(arguments, "document_id");
        int k = ToolArguments.integer(arguments, "k", DEFAULT_K, 1, MAX_K);

        List<RetrievedChunk> chunks;
        try {
            chunks = retrievalService.retrieve(RetrievalQuery.builder()
                    .query(query)
                    .userId(context.userId())
                    .documentId(documentId)
                    .mode(RetrievalMode.HYBRID)
                    .topK(k)
                    .rerank(true)
                    .rerankTopN(k)
                    .build());
        } catch (RetrievalException e) {
            log.warn("document_search failed for query \"{}\": {}", query, e.getMessage());
            return ToolResult.failure("Document search failed: " + e.getMessage());
        }

        if (chunks.isEmpty()) {
            return ToolResult.success("No relevant passages found for \"" + query + "\".");
        }

        List<Map<String, Object>> items = new ArrayList<>(chunks.size());
        for (RetrievedChunk chunk : chunks) {
            Map<String, Object> metadata = chunk.getMetadata() != null ? chunk.getMetadata() : Map.of();
            String docId = metadata.get(Chunk.DOCUMENT_ID) != null ? metadata.get(Chunk.DOCUMENT_ID).toString() : null;
            Object section = metadata.get(Chunk.SECTION_PATH);

            int citation = context.citations().cite(chunk.getId(), docId,
                    section != null ? section.toString() : docId,
                    snippet(chunk.getText()), null, Source.SourceType.PDF);

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("citation", citation);
            item.put("id", chunk.getId());
            item.put("text", chunk.getText());
            item.put("section", section);
            item.put("page", metadata.get(Chunk.PAGE_NUMBER));
            item.put("relevance_score", relevance(chunk));
            items.add(item);
        }

        try {
            return ToolResult.success(objectMapper.writeValueAsString(items));
        } catch (JsonProcessingException e) {
            return ToolResult.failure("Cannot render search results: " + e.getOriginalMessage());
        }
    }

    private static double relevance(RetrievedChunk chunk) {
        if (chunk.getRerankScore() != null) {
            return chunk.getRerankScore();
        }
        return 1.0d - chunk.distanceOrDefault();
    }

    static String snippet(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH);
    }
}

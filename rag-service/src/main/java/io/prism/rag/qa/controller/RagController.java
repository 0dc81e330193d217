package io.prism.rag.qa.controller;

import io.prism.rag.qa.model.RagPromptRequest;
import io.prism.rag.qa.model.RagPromptResponse;
import io.prism.rag.qa.service.RagService;
import io.prism.rag.service.EmbeddingService;
import io.prism.rag.vector.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-shot RAG answers and a dependency health check.
 *
 * <pre>
 * curl -X POST http://localhost:9092/api/rag/prompt \
 *   -H "Content-Type: application/json" \
 *   -d '{"question": "What drove the margin change?", "user_id": "u1", "document_id": "annual-report"}'
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/rag")
@RequiredArgsConstructor
public class RagController {

    private static final String HEALTH_USER = "__health__";

    private final RagService ragService;
    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final ChatModel chatModel;

    @PostMapping("/prompt")
    public RagPromptResponse prompt(@RequestBody RagPromptRequest request) {
        log.info("RAG prompt for user {} (document={}, top_k={})",
                request.getUserId(), request.getDocumentId(), request.getTopK());
        return ragService.prompt(request);
    }

    /**
     * Embeds a fixed sample string and runs it against the vector store. Always answers 200; the
     * overall {@code status} is {@code UP} only when every component is.
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> components = new LinkedHashMap<>();

        List<Double> sample = List.of();
        try {
            sample = embeddingService.embedQuery("health check");
            components.put("embedding", Map.of(
                    "status", sample.isEmpty() ? "DOWN" : "UP",
                    "model", embeddingService.getModelName(),
                    "dimensions", sample.size()));
        } catch (RuntimeException e) {
            log.error("Embedding health check failed: {}", e.getMessage());
            components.put("embedding", down(e));
        }

        if (sample.isEmpty()) {
            components.put("vectorStore", Map.of("status", "UNKNOWN"));
        } else {
            try {
                long started = System.currentTimeMillis();
                vectorStore.query(sample, HEALTH_USER, null, 1);
                components.put("vectorStore", Map.of("status", "UP", "latencyMs", System.currentTimeMillis() - started));
            } catch (RuntimeException e) {
                log.error("Vector store health check failed: {}", e.getMessage());
                components.put("vectorStore", down(e));
            }
        }

        components.put("chatModel", Map.of("status", chatModel != null ? "UP" : "DOWN"));

        boolean up = components.values().stream()
                .allMatch(component -> "UP".equals(((Map<?, ?>) component).get("status")));
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", up ? "UP" : "DEGRADED");
        health.put("components", components);
        return health;
    }

    private static Map<String, Object> down(RuntimeException e) {
        return Map.of("status", "DOWN", "error", String.valueOf(e.getMessage()));
    }
}

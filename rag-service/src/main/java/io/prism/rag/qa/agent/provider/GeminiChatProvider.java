package io.prism.rag.qa.agent.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prism.rag.qa.agent.AgentMessage;
import io.prism.rag.qa.agent.ModelTurn;
import io.prism.rag.qa.agent.ToolCall;
import io.prism.rag.qa.agent.tool.GeminiToolFormat;
import io.prism.rag.qa.agent.tool.ToolSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ChatProvider} for the Gemini {@code generateContent} API.
 *
 * <p>System messages become {@code systemInstruction}; the model's tool calls are
 * {@code functionCall} parts of a {@code model} turn and observations are
 * {@code functionResponse} parts of a {@code user} turn. Transient failures are retried with
 * the configured {@link RetryPolicy}.</p>
 */
@Slf4j
public class GeminiChatProvider implements ChatProvider {

    public static final String API_KEY_HEADER = "x-goog-api-key";

    private static final String PROVIDER = "gemini";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final RetryPolicy retryPolicy;

    public GeminiChatProvider(RestClient restClient, ObjectMapper objectMapper, String model,
                              double temperature, int maxTokens, RetryPolicy retryPolicy) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public ModelTurn call(List<AgentMessage> history, List<ToolSchema> tools) {
        Map<String, Object> request = buildRequest(history, tools);
        JsonNode response = retryPolicy.execute("Gemini generateContent", () -> post(request));
        return parseResponse(response);
    }

    Map<String, Object> buildRequest(List<AgentMessage> history, List<ToolSchema> tools) {
        StringBuilder system = new StringBuilder();
        List<Map<String, Object>> contents = new ArrayList<>();

        for (AgentMessage message : history) {
            switch (message.role()) {
                case SYSTEM -> {
                    if (!system.isEmpty()) {
                        system.append("\n\n");
                    }
                    system.append(message.content());
                }
                case USER -> contents.add(content("user", List.of(Map.of("text", message.content()))));
                case ASSISTANT -> {
                    List<Map<String, Object>> parts = new ArrayList<>();
                    if (message.content() != null && !message.content().isBlank()) {
                        parts.add(Map.of("text", message.content()));
                    }
                    if (message.toolCall() != null) {
                        parts.add(Map.of("functionCall", Map.of(
                                "name", message.toolCall().name(),
                                "args", message.toolCall().arguments())));
                    }
                    if (!parts.isEmpty()) {
                        contents.add(content("model", parts));
                    }
                }
                case TOOL -> contents.add(content("user", List.of(Map.of("functionResponse", Map.of(
                        "name", message.toolCall().name(),
                        "response", Map.of("content", message.content()))))));
            }
        }

        Map<String, Object> request = new LinkedHashMap<>();
        if (!system.isEmpty()) {
            request.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system.toString()))));
        }
        request.put("contents", contents);
        if (!tools.isEmpty()) {
            request.put("tools", List.of(Map.of("functionDeclarations",
                    tools.stream().map(GeminiToolFormat.INSTANCE::render).toList())));
        }
        request.put("generationConfig", Map.of("temperature", temperature, "maxOutputTokens", maxTokens));
        return request;
    }

    ModelTurn parseResponse(JsonNode response) {
        JsonNode candidates = response == null ? null : response.path("candidates");
        if (candidates == null || !candidates.isArray() || candidates.isEmpty()) {
            String reason = response != null ? response.path("promptFeedback").path("blockReason").asText("") : "";
            throw new NonTransientAiException("Gemini returned no candidates"
                    + (reason.isEmpty() ? "" : " (blocked: " + reason + ")"));
        }

        StringBuilder text = new StringBuilder();
        ToolCall call = null;
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            if (part.has("text")) {
                text.append(part.path("text").asText());
            } else if (part.has("functionCall") && call == null) {
                JsonNode functionCall = part.path("functionCall");
                Map<String, Object> args = functionCall.has("args")
                        ? objectMapper.convertValue(functionCall.path("args"), new TypeReference<Map<String, Object>>() {
                        })
                        : Map.of();
                call = new ToolCall(null, functionCall.path("name").asText(), args);
            }
        }
        return new ModelTurn(text.toString(), call);
    }

    private JsonNode post(Map<String, Object> request) {
        try {
            return restClient.post()
                    .uri("/models/{model}:generateContent", model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw ProviderErrors.translate(PROVIDER, e);
        }
    }

    private static Map<String, Object> content(String role, List<Map<String, Object>> parts) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("role", role);
        content.put("parts", parts);
        return content;
    }
}

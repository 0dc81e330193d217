package io.prism.rag.qa.agent.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prism.rag.qa.agent.AgentMessage;
import io.prism.rag.qa.agent.ModelTurn;
import io.prism.rag.qa.agent.ToolCall;
import io.prism.rag.qa.agent.tool.OpenAiToolFormat;
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
 * {@link ChatProvider} for OpenAI-compatible {@code /chat/completions} endpoints.
 *
 * <p>Tool calls travel as {@code assistant.tool_calls} with JSON-encoded arguments; their
 * results come back as {@code role: tool} messages keyed by {@code tool_call_id}.</p>
 */
@Slf4j
public class OpenAiChatProvider implements ChatProvider {

    private static final String PROVIDER = "openai";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final RetryPolicy retryPolicy;

    public OpenAiChatProvider(RestClient restClient, ObjectMapper objectMapper, String model,
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
        JsonNode response = retryPolicy.execute("OpenAI chat completion", () -> post(request));
        return parseResponse(response);
    }

    Map<String, Object> buildRequest(List<AgentMessage> history, List<ToolSchema> tools) {
        List<Map<String, Object>> messages = new ArrayList<>(history.size());
        for (AgentMessage message : history) {
            messages.add(toWire(message));
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("messages", messages);
        request.put("temperature", temperature);
        request.put("max_tokens", maxTokens);
        if (!tools.isEmpty()) {
            request.put("tools", tools.stream().map(OpenAiToolFormat.INSTANCE::render).toList());
            request.put("tool_choice", "auto");
        }
        return request;
    }

    private Map<String, Object> toWire(AgentMessage message) {
        Map<String, Object> wire = new LinkedHashMap<>();
        switch (message.role()) {
            case SYSTEM -> {
                wire.put("role", "system");
                wire.put("content", message.content());
            }
            case USER -> {
                wire.put("role", "user");
                wire.put("content", message.content());
            }
            case ASSISTANT -> {
                wire.put("role", "assistant");
                wire.put("content", message.content());
                if (message.toolCall() != null) {
                    ToolCall call = message.toolCall();
                    wire.put("tool_calls", List.of(Map.of(
                            "id", call.id(),
                            "type", "function",
                            "function", Map.of("name", call.name(), "arguments", toJson(call.arguments())))));
                }
            }
            case TOOL -> {
                wire.put("role", "tool");
                wire.put("tool_call_id", message.toolCall().id());
                wire.put("content", message.content());
            }
        }
        return wire;
    }

    ModelTurn parseResponse(JsonNode response) {
        JsonNode message = response == null ? null : response.path("choices").path(0).path("message");
        if (message == null || message.isMissingNode()) {
            throw new NonTransientAiException("OpenAI response has no choices");
        }

        String content = message.path("content").isTextual() ? message.path("content").asText() : "";
        JsonNode toolCalls = message.path("tool_calls");
        if (!toolCalls.isArray() || toolCalls.isEmpty()) {
            return ModelTurn.text(content);
        }
        if (toolCalls.size() > 1) {
            log.debug("OpenAI returned {} tool calls; executing the first", toolCalls.size());
        }

        JsonNode first = toolCalls.get(0);
        JsonNode function = first.path("function");
        ToolCall call = new ToolCall(
                first.path("id").asText(null),
                function.path("name").asText(),
                parseArguments(function.path("arguments").asText("{}")));
        return new ModelTurn(content, call);
    }

    private JsonNode post(Map<String, Object> request) {
        try {
            return restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw ProviderErrors.translate(PROVIDER, e);
        }
    }

    private Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("Unparseable tool arguments from OpenAI: {}", json);
            return Map.of();
        }
    }

    private String toJson(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tool arguments", e);
        }
    }
}

package io.prism.rag.qa.agent.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;
import java.util.Locale;

/**
 * Classifies with a Spring AI {@link ChatModel} asked for strict JSON. Any failure, including
 * an unparseable reply, falls back to the rule-based router.
 */
@Slf4j
public class LlmIntentRouter implements IntentRouter {

    static final String PROMPT = """
            Classify the user's query into exactly one intent.

            DIRECT_ANSWER: greetings, thanks, questions about the assistant itself.
            DOCUMENT_QA: a question answered by looking something up in the user's documents.
            WEB_SEARCH: needs recent or public information (news, prices, today's events).
            COMPLEX_REASONING: comparisons, aggregations or anything needing several separate searches.

            Examples:
            "hello" -> {"intent": "DIRECT_ANSWER", "confidence": 0.98, "reasoning": "greeting"}
            "What does the paper conclude?" -> {"intent": "DOCUMENT_QA", "confidence": 0.9, "reasoning": "single lookup"}
            "latest Nvidia earnings" -> {"intent": "WEB_SEARCH", "confidence": 0.9, "reasoning": "recent data"}
            "compare Tesla vs SpaceX expenses" -> {"intent": "COMPLEX_REASONING", "confidence": 0.95, "reasoning": "two entities"}

            Reply with a single JSON object with keys intent, confidence, reasoning and nothing else.""";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final IntentRouter fallback;

    public LlmIntentRouter(ChatModel chatModel, ObjectMapper objectMapper, IntentRouter fallback) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.fallback = fallback;
    }

    @Override
    public IntentClassification classify(String query) {
        try {
            ChatResponse response = chatModel.call(new Prompt(List.of(
                    new SystemMessage(PROMPT),
                    new UserMessage(query))));
            return parse(response.getResult().getOutput().getText());
        } catch (Exception e) {
            log.warn("LLM intent classification failed, using rules: {}", e.getMessage());
            return fallback.classify(query);
        }
    }

    IntentClassification parse(String raw) throws JsonProcessingException {
        String json = raw.trim();
        int start = json.indexOf('{');
        int end = json.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("No JSON object in classifier reply: " + raw);
        }
        JsonNode node = objectMapper.readTree(json.substring(start, end + 1));
        Intent intent = Intent.valueOf(node.path("intent").asText().trim().toUpperCase(Locale.ROOT));
        double confidence = Math.max(0d, Math.min(1d, node.path("confidence").asDouble(0.5d)));
        return new IntentClassification(intent, confidence, node.path("reasoning").asText(""));
    }
}

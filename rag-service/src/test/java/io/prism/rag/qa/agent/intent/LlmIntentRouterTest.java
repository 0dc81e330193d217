package io.prism.rag.qa.agent.intent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmIntentRouterTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final LlmIntentRouter router = new LlmIntentRouter(chatModel, new ObjectMapper(), new RuleBasedIntentRouter());

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void parsesJsonWrappedInProse() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("""
                Sure:
                ```json
                {"intent": "web_search", "confidence": 1.7, "reasoning": "asks about today"}
                ```"""));

        IntentClassification classification = router.classify("what happened today?");

        assertThat(classification.intent()).isEqualTo(Intent.WEB_SEARCH);
        assertThat(classification.confidence()).isEqualTo(1.0);
        assertThat(classification.reasoning()).isEqualTo("asks about today");
    }

    @Test
    void unparseableReplyFallsBackToRules() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("I think it's a comparison."));

        assertThat(router.classify("Compare Tesla vs SpaceX").intent()).isEqualTo(Intent.COMPLEX_REASONING);
    }

    @Test
    void modelFailureFallsBackToRules() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("timeout"));

        assertThat(router.classify("hello").intent()).isEqualTo(Intent.DIRECT_ANSWER);
    }

    @Test
    void unknownIntentFallsBackToRules() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("{\"intent\": \"SMALL_TALK\"}"));

        assertThat(router.classify("What does the report say?").intent()).isEqualTo(Intent.DOCUMENT_QA);
    }
}

package io.prism.rag.qa.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * One event of a streamed run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentStreamEvent(Type type, String content, Map<String, Object> metadata) {

    public enum Type {
        THINKING, TOOL_CALL, TOOL_RESULT, ANSWER;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static AgentStreamEvent of(Type type, String content) {
        return new AgentStreamEvent(type, content, null);
    }
}

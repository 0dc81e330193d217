package io.prism.rag.qa.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One iteration of the loop. {@code action} and {@code observation} are {@code null} when the
 * model answered in plain text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ThoughtStep(String thought,
                          String action,
                          @JsonProperty("action_input") Map<String, Object> actionInput,
                          String observation) {
}

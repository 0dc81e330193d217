package io.prism.rag.qa.agent;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Terminal artifact of an agent run.
 */
@Value
@Builder
public class AgentResponse {

    String answer;

    List<Source> sources;

    @JsonProperty("intermediate_steps")
    List<ThoughtStep> intermediateSteps;

    @JsonProperty("model_used")
    String modelUsed;

    @JsonProperty("total_latency_ms")
    long totalLatencyMs;

    @JsonProperty("termination_reason")
    TerminationReason terminationReason;
}

package io.prism.rag.qa.agent;

import io.prism.rag.qa.agent.intent.Intent;
import io.prism.rag.qa.agent.intent.IntentClassification;
import io.prism.rag.qa.agent.intent.IntentRouter;
import io.prism.rag.qa.agent.intent.Greetings;
import io.prism.rag.qa.agent.provider.ChatProvider;
import io.prism.rag.qa.agent.tool.FinishTool;
import io.prism.rag.qa.agent.tool.ToolContext;
import io.prism.rag.qa.agent.tool.ToolNotFoundException;
import io.prism.rag.qa.agent.tool.ToolRegistry;
import io.prism.rag.qa.agent.tool.ToolResult;
import io.prism.rag.qa.agent.tool.ToolSchema;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Think / act / observe loop over a {@link ChatProvider} and a {@link ToolRegistry}.
 *
 * <p>A run:
 * <ol>
 *   <li>asks the {@link IntentRouter} first; confident greetings are answered directly</li>
 *   <li>calls the model with the history and the tool schemas</li>
 *   <li>executes the requested tool and appends the observation to the history</li>
 *   <li>stops on a {@code finish} call, on a complete plain-text answer, or after
 *       {@code maxSteps} iterations, in which case the answer is synthesized from the
 *       observations gathered so far</li>
 * </ol>
 *
 * <p>The loop never returns an empty answer. A run is cancelled by interrupting its thread;
 * the check happens before each step.</p>
 */
@Slf4j
public class ReActAgent {

    static final int STREAM_RESULT_LIMIT = 500;
    static final int FALLBACK_EXCERPT_LIMIT = 400;

    private final ChatProvider provider;
    private final ToolRegistry toolRegistry;
    private final IntentRouter intentRouter;
    private final int maxSteps;
    private final double directAnswerConfidence;
    private final Clock clock;

    public ReActAgent(ChatProvider provider, ToolRegistry toolRegistry, IntentRouter intentRouter,
                      int maxSteps, double directAnswerConfidence, Clock clock) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be >= 1");
        }
        if (!toolRegistry.contains(FinishTool.NAME)) {
            throw new IllegalArgumentException("Tool registry must contain the finish tool");
        }
        this.provider = provider;
        this.toolRegistry = toolRegistry;
        this.intentRouter = intentRouter;
        this.maxSteps = maxSteps;
        this.directAnswerConfidence = directAnswerConfidence;
        this.clock = clock;
    }

    public AgentResponse run(String query, String userId) {
        return run(query, userId, AgentEventListener.NOOP);
    }

    public AgentResponse run(String query, String userId, AgentEventListener listener) {
        long start = System.currentTimeMillis();
        IntentClassification classification = intentRouter.classify(query);
        log.info("Agent run for user {}: intent={} ({})", userId, classification.intent(), classification.confidence());

        if (classification.intent() == Intent.DIRECT_ANSWER && classification.confidence() >= directAnswerConfidence) {
            String answer = Greetings.reply(query);
            listener.onEvent(AgentStreamEvent.of(AgentStreamEvent.Type.ANSWER, answer));
            return response(answer, new ToolContext(userId, new CitationTracker()), List.of(),
                    TerminationReason.DIRECT_ANSWER, start);
        }

        ToolContext context = new ToolContext(userId, new CitationTracker());
        List<AgentMessage> history = new ArrayList<>();
        history.add(AgentMessage.system(AgentPrompts.system(LocalDate.now(clock))));
        history.add(AgentMessage.user(AgentPrompts.task(query, userId, classification)));

        List<ThoughtStep> steps = new ArrayList<>();
        List<String> observations = new ArrayList<>();
        List<ToolSchema> tools = toolRegistry.schemas();

        for (int step = 1; step <= maxSteps; step++) {
            checkCancelled();

            ModelTurn turn = provider.call(history, tools);
            String thought = turn.thought() != null ? turn.thought() : "";
            if (!thought.isBlank()) {
                listener.onEvent(AgentStreamEvent.of(AgentStreamEvent.Type.THINKING, thought));
            }

            if (!turn.hasToolCall()) {
                steps.add(new ThoughtStep(thought, null, null, null));
                if (isCompleteAnswer(thought)) {
                    String answer = stripFinalAnswerPrefix(thought);
                    log.info("Agent finished with a plain-text answer after {} steps", step);
                    listener.onEvent(AgentStreamEvent.of(AgentStreamEvent.Type.ANSWER, answer));
                    return response(answer, context, steps, TerminationReason.FINISHED, start);
                }
                log.debug("Step {}: no tool call and no complete answer, re-prompting", step);
                history.add(AgentMessage.assistant(thought));
                history.add(AgentMessage.user(AgentPrompts.CONTINUE));
                continue;
            }

            ToolCall call = withId(turn.toolCall(), step);

            if (FinishTool.NAME.equals(call.name())) {
                ToolResult result = toolRegistry.invoke(FinishTool.NAME, call.arguments(), context);
                if (result instanceof ToolResult.Success success) {
                    steps.add(new ThoughtStep(thought, call.name(), call.arguments(), null));
                    log.info("Agent finished via finish tool after {} steps", step);
                    listener.onEvent(AgentStreamEvent.of(AgentStreamEvent.Type.ANSWER, success.content()));
                    return response(success.content(), context, steps, TerminationReason.FINISHED, start);
                }
                recordObservation(history, steps, observations, thought, call, result.observation(), listener, false);
                continue;
            }

            listener.onEvent(new AgentStreamEvent(AgentStreamEvent.Type.TOOL_CALL, call.name(),
                    Map.of("arguments", call.arguments())));
            String observation = execute(call, context);
            recordObservation(history, steps, observations, thought, call, observation, listener, true);
        }

        log.warn("Agent reached the step limit ({}) without finishing; synthesizing", maxSteps);
        checkCancelled();
        String answer = synthesize(history, observations);
        listener.onEvent(AgentStreamEvent.of(AgentStreamEvent.Type.ANSWER, answer));
        return response(answer, context, steps, TerminationReason.STEP_LIMIT_REACHED, start);
    }

    // ---------------------------------------------------------------
    // Steps
    // ---------------------------------------------------------------

    private String execute(ToolCall call, ToolContext context) {
        try {
            return toolRegistry.invoke(call.name(), call.arguments(), context).observation();
        } catch (ToolNotFoundException e) {
            log.warn("Model called unknown tool {}", call.name());
            return "Error: " + e.getMessage();
        } catch (RuntimeException e) {
            log.warn("Tool {} failed: {}", call.name(), e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    private void recordObservation(List<AgentMessage> history, List<ThoughtStep> steps, List<String> observations,
                                   String thought, ToolCall call, String observation,
                                   AgentEventListener listener, boolean countsAsEvidence) {
        history.add(AgentMessage.assistant(thought, call));
        history.add(AgentMessage.toolResult(call, observation));
        steps.add(new ThoughtStep(thought, call.name(), call.arguments(), observation));
        if (countsAsEvidence && !observation.startsWith("Error:")) {
            observations.add(observation);
        }
        listener.onEvent(new AgentStreamEvent(AgentStreamEvent.Type.TOOL_RESULT, truncate(observation, STREAM_RESULT_LIMIT),
                Map.of("tool", call.name())));
    }

    /**
     * Best-effort answer once the step limit is hit. Asks the model once without tools; if that
     * fails or returns nothing, stitches the observations together.
     */
    private String synthesize(List<AgentMessage> history, List<String> observations) {
        if (observations.isEmpty()) {
            return AgentPrompts.NO_INFORMATION;
        }
        List<AgentMessage> request = new ArrayList<>(history);
        request.add(AgentMessage.user(AgentPrompts.SYNTHESIZE));
        try {
            ModelTurn turn = provider.call(request, List.of());
            if (turn.thought() != null && !turn.thought().isBlank()) {
                return stripFinalAnswerPrefix(turn.thought());
            }
            log.warn("Synthesis returned an empty answer; falling back to observation excerpts");
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Synthesis call failed, falling back to observation excerpts: {}", e.getMessage());
        }

        StringBuilder answer = new StringBuilder("Based on the information gathered so far:");
        for (String observation : observations) {
            answer.append("\n- ").append(truncate(observation, FALLBACK_EXCERPT_LIMIT));
        }
        return answer.toString();
    }

    static boolean isCompleteAnswer(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return text.contains(AgentPrompts.CITATION_MARKER) || text.trim().startsWith(AgentPrompts.FINAL_ANSWER_PREFIX);
    }

    private static String stripFinalAnswerPrefix(String text) {
        String trimmed = text.trim();
        return trimmed.startsWith(AgentPrompts.FINAL_ANSWER_PREFIX)
                ? trimmed.substring(AgentPrompts.FINAL_ANSWER_PREFIX.length()).trim()
                : trimmed;
    }

    private static ToolCall withId(ToolCall call, int step) {
        if (call.id() != null && !call.id().isBlank()) {
            return call;
        }
        return new ToolCall("call_" + step, call.name(), call.arguments());
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Agent run cancelled");
        }
    }

    static String truncate(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, limit) + "...";
    }

    private AgentResponse response(String answer, ToolContext context, List<ThoughtStep> steps,
                                   TerminationReason reason, long start) {
        return AgentResponse.builder()
                .answer(answer)
                .sources(context.citations().sources())
                .intermediateSteps(List.copyOf(steps))
                .modelUsed(provider.modelName())
                .totalLatencyMs(System.currentTimeMillis() - start)
                .terminationReason(reason)
                .build();
    }
}

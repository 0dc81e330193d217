package io.prism.rag.qa.controller;

import io.prism.rag.qa.agent.AgentResponse;
import io.prism.rag.qa.agent.AgentStreamEvent;
import io.prism.rag.qa.agent.ReActAgent;
import io.prism.rag.qa.config.AgentProperties;
import io.prism.rag.qa.model.AgentRequest;
import io.prism.rag.service.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;

/**
 * Agent endpoints: a blocking run and a Server-Sent Events stream of the same run.
 *
 * <p>Both run on the agent executor. A timeout, a client that goes away or a completed response
 * cancels the running task: the interrupt aborts an in-flight provider call and the agent stops
 * before its next step.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/agent")
public class AgentController {

    private final ReActAgent agent;
    private final ThreadPoolTaskExecutor agentExecutor;
    private final AgentProperties agentProperties;

    public AgentController(ReActAgent agent,
                           @Qualifier("agentExecutor") ThreadPoolTaskExecutor agentExecutor,
                           AgentProperties agentProperties) {
        this.agent = agent;
        this.agentExecutor = agentExecutor;
        this.agentProperties = agentProperties;
    }

    @PostMapping("/chat")
    public DeferredResult<AgentResponse> chat(@RequestBody AgentRequest request) {
        validate(request);
        DeferredResult<AgentResponse> result = new DeferredResult<>(agentProperties.getChatTimeout().toMillis());

        Future<?> run = agentExecutor.submit(() -> {
            try {
                result.setResult(agent.run(request.getQuery(), request.getUserId()));
            } catch (CancellationException e) {
                log.info("Agent run cancelled for user {}", request.getUserId());
            } catch (Exception e) {
                result.setErrorResult(e);
            }
        });

        result.onTimeout(() -> {
            log.warn("Agent run for user {} exceeded {}", request.getUserId(), agentProperties.getChatTimeout());
            run.cancel(true);
        });
        result.onError(error -> run.cancel(true));
        result.onCompletion(() -> run.cancel(true));
        return result;
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestBody AgentRequest request) {
        validate(request);
        SseEmitter emitter = new SseEmitter(agentProperties.getStreamTimeout().toMillis());

        Future<?> run = agentExecutor.submit(() -> {
            try {
                agent.run(request.getQuery(), request.getUserId(), event -> send(emitter, event));
                emitter.complete();
            } catch (CancellationException e) {
                log.info("Streamed agent run cancelled for user {}", request.getUserId());
                emitter.complete();
            } catch (UncheckedIOException e) {
                log.info("Client disconnected from agent stream for user {}", request.getUserId());
                emitter.completeWithError(e.getCause());
            } catch (Exception e) {
                log.warn("Streamed agent run failed for user {}: {}", request.getUserId(), e.getMessage());
                emitter.completeWithError(e);
            }
        });

        emitter.onTimeout(() -> run.cancel(true));
        emitter.onError(error -> run.cancel(true));
        emitter.onCompletion(() -> run.cancel(true));
        return emitter;
    }

    private static void send(SseEmitter emitter, AgentStreamEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type().wireName())
                    .data(event, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void validate(AgentRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new InvalidRequestException("query must not be blank");
        }
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new InvalidRequestException("user_id must not be blank");
        }
    }
}

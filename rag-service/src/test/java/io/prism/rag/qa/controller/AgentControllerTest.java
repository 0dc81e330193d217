package io.prism.rag.qa.controller;

import io.prism.rag.qa.agent.AgentEventListener;
import io.prism.rag.qa.agent.AgentResponse;
import io.prism.rag.qa.agent.AgentStreamEvent;
import io.prism.rag.qa.agent.ReActAgent;
import io.prism.rag.qa.agent.TerminationReason;
import io.prism.rag.qa.agent.provider.ProviderTransientException;
import io.prism.rag.qa.config.AgentProperties;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockAsyncContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AgentControllerTest {

    private final ReActAgent agent = mock(ReActAgent.class);

    private ThreadPoolTaskExecutor executor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("agent-test-");
        executor.initialize();

        AgentProperties properties = new AgentProperties();
        properties.setChatTimeout(Duration.ofSeconds(30));
        properties.setStreamTimeout(Duration.ofSeconds(30));

        AgentController controller = new AgentController(agent, executor, properties);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static AgentResponse answer(String text) {
        return AgentResponse.builder()
                .answer(text)
                .sources(List.of())
                .intermediateSteps(List.of())
                .modelUsed("gpt-4o-mini")
                .terminationReason(TerminationReason.DIRECT_ANSWER)
                .build();
    }

    private MvcResult start(String path, String body) throws Exception {
        return mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(request().asyncStarted())
                .andReturn();
    }

    private static void notifyListeners(MvcResult result, boolean timeout) throws IOException {
        MockAsyncContext asyncContext = (MockAsyncContext) result.getRequest().getAsyncContext();
        for (AsyncListener listener : List.copyOf(asyncContext.getListeners())) {
            if (timeout) {
                listener.onTimeout(new AsyncEvent(asyncContext));
            } else {
                listener.onError(new AsyncEvent(asyncContext, new IOException("Broken pipe")));
            }
        }
    }

    /**
     * Stubs a run that blocks until its thread is interrupted.
     */
    private void blockUntilCancelled(CountDownLatch running, CountDownLatch interrupted) {
        doAnswer(invocation -> {
            if (invocation.getArguments().length > 2) {
                AgentEventListener listener = invocation.getArgument(2);
                listener.onEvent(AgentStreamEvent.of(AgentStreamEvent.Type.THINKING, "Searching..."));
            }
            running.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw new CancellationException("cancelled");
            }
            return answer("too late");
        }).when(agent).run(anyString(), anyString(), any());
        doAnswer(invocation -> agent.run(invocation.getArgument(0), invocation.getArgument(1), AgentEventListener.NOOP))
                .when(agent).run(anyString(), anyString());
    }

    @Test
    void chatReturnsAgentResponse() throws Exception {
        when(agent.run("hello", "alice")).thenReturn(answer("Hello!"));

        MvcResult started = start("/api/agent/chat", "{\"query\":\"hello\",\"user_id\":\"alice\"}");

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Hello!"))
                .andExpect(jsonPath("$.termination_reason").value("DIRECT_ANSWER"));
    }

    @Test
    void missingUserIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/agent/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"hello\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("user_id must not be blank"));
        verifyNoInteractions(agent);
    }

    @Test
    void exhaustedProviderRetriesAreServiceUnavailable() throws Exception {
        when(agent.run(anyString(), anyString()))
                .thenThrow(new ProviderTransientException("gemini", 429, "gemini returned HTTP 429", null));

        MvcResult started = start("/api/agent/chat", "{\"query\":\"Compare A vs B\",\"user_id\":\"alice\"}");

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void chatTimeoutCancelsTheRun() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        blockUntilCancelled(running, interrupted);

        MvcResult started = start("/api/agent/chat", "{\"query\":\"Compare A vs B\",\"user_id\":\"alice\"}");
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        notifyListeners(started, true);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void streamSendsNamedEventsInOrder() throws Exception {
        doAnswer(invocation -> {
            AgentEventListener listener = invocation.getArgument(2);
            listener.onEvent(AgentStreamEvent.of(AgentStreamEvent.Type.THINKING, "Look it up"));
            listener.onEvent(new AgentStreamEvent(AgentStreamEvent.Type.TOOL_CALL, "document_search",
                    Map.of("arguments", Map.of("query", "capital"))));
            listener.onEvent(new AgentStreamEvent(AgentStreamEvent.Type.TOOL_RESULT, "Paris is the capital",
                    Map.of("tool", "document_search")));
            listener.onEvent(AgentStreamEvent.of(AgentStreamEvent.Type.ANSWER, "Paris [[citation:1]]"));
            return answer("Paris [[citation:1]]");
        }).when(agent).run(eq("capital of France?"), eq("alice"), any());

        MvcResult started = start("/api/agent/stream", "{\"query\":\"capital of France?\",\"user_id\":\"alice\"}");
        started.getAsyncResult(5_000);
        mockMvc.perform(asyncDispatch(started)).andExpect(status().isOk());

        String body = started.getResponse().getContentAsString();
        int thinking = body.indexOf("event:thinking");
        int toolCall = body.indexOf("event:tool_call");
        int toolResult = body.indexOf("event:tool_result");
        int answer = body.indexOf("event:answer");

        assertThat(thinking).isNotNegative();
        assertThat(toolCall).isGreaterThan(thinking);
        assertThat(toolResult).isGreaterThan(toolCall);
        assertThat(answer).isGreaterThan(toolResult);
        assertThat(body).contains("\"type\":\"tool_call\"", "\"content\":\"Paris [[citation:1]]\"");
    }

    @Test
    void streamDisconnectCancelsTheRun() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        blockUntilCancelled(running, interrupted);

        MvcResult started = start("/api/agent/stream", "{\"query\":\"Compare A vs B\",\"user_id\":\"alice\"}");
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        notifyListeners(started, false);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }
}

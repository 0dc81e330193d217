package io.prism.rag.qa.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prism.rag.qa.agent.ReActAgent;
import io.prism.rag.qa.agent.intent.IntentRouter;
import io.prism.rag.qa.agent.intent.LlmIntentRouter;
import io.prism.rag.qa.agent.intent.RuleBasedIntentRouter;
import io.prism.rag.qa.agent.provider.ChatProvider;
import io.prism.rag.qa.agent.provider.GeminiChatProvider;
import io.prism.rag.qa.agent.provider.OpenAiChatProvider;
import io.prism.rag.qa.agent.provider.RetryPolicy;
import io.prism.rag.qa.agent.tool.DocumentSearchTool;
import io.prism.rag.qa.agent.tool.FinishTool;
import io.prism.rag.qa.agent.tool.RestWebSearchClient;
import io.prism.rag.qa.agent.tool.ToolRegistry;
import io.prism.rag.qa.agent.tool.WebSearchTool;
import io.prism.rag.service.RetrievalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Wiring of the ReAct agent: model provider, retry policy, tools and intent routing.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        AgentProperties.class,
        WebSearchProperties.class
})
public class AgentConfig {

    // ----------------------------------------------------------------------
    // Model provider
    // ----------------------------------------------------------------------

    @Bean
    public RetryPolicy providerRetryPolicy(AgentProperties props) {
        AgentProperties.Retry retry = props.getRetry();
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .multiplier(retry.getMultiplier())
                .minBackoff(retry.getMinBackoff())
                .maxBackoff(retry.getMaxBackoff())
                .build();
    }

    /**
     * OpenAI is called without retries; Gemini goes through the configured backoff policy.
     */
    @Bean
    public ChatProvider chatProvider(AgentProperties props, RetryPolicy providerRetryPolicy, ObjectMapper objectMapper) {
        if ("gemini".equalsIgnoreCase(props.getProvider())) {
            AgentProperties.Provider gemini = props.getGemini();
            RestClient.Builder builder = providerClient(gemini);
            if (gemini.getApiKey() != null) {
                builder.defaultHeader(GeminiChatProvider.API_KEY_HEADER, gemini.getApiKey());
            }
            log.info("Agent provider: Gemini ({})", gemini.getModel());
            return new GeminiChatProvider(builder.build(), objectMapper, gemini.getModel(),
                    props.getTemperature(), props.getMaxTokens(), providerRetryPolicy);
        }

        AgentProperties.Provider openai = props.getOpenai();
        RestClient.Builder builder = providerClient(openai);
        if (openai.getApiKey() != null) {
            builder.defaultHeaders(h -> h.setBearerAuth(openai.getApiKey()));
        }
        log.info("Agent provider: OpenAI ({})", openai.getModel());
        return new OpenAiChatProvider(builder.build(), objectMapper, openai.getModel(),
                props.getTemperature(), props.getMaxTokens(), RetryPolicy.none());
    }

    // ----------------------------------------------------------------------
    // Tools
    // ----------------------------------------------------------------------

    @Bean
    public ToolRegistry toolRegistry(RetrievalService retrievalService,
                                     WebSearchProperties webSearch,
                                     ObjectMapper objectMapper) {
        ToolRegistry registry = new ToolRegistry()
                .register(new DocumentSearchTool(retrievalService, objectMapper));

        if (webSearch.isEnabled()) {
            JdkClientHttpRequestFactory requestFactory = timeouts(webSearch.getTimeout(), webSearch.getTimeout());
            RestClient restClient = RestClient.builder()
                    .baseUrl(webSearch.getUrl())
                    .requestFactory(requestFactory)
                    .build();
            registry.register(new WebSearchTool(new RestWebSearchClient(restClient, webSearch.getApiKey()),
                    objectMapper, webSearch.getMaxResults()));
        }

        return registry.register(new FinishTool());
    }

    // ----------------------------------------------------------------------
    // Agent
    // ----------------------------------------------------------------------

    @Bean
    public IntentRouter intentRouter(AgentProperties props, ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        RuleBasedIntentRouter rules = new RuleBasedIntentRouter();
        ChatModel model = chatModel.getIfAvailable();
        if ("llm".equalsIgnoreCase(props.getRouter()) && model != null) {
            log.info("Intent routing: LLM with rule-based fallback");
            return new LlmIntentRouter(model, objectMapper, rules);
        }
        log.info("Intent routing: rule-based");
        return rules;
    }

    @Bean
    public ReActAgent reActAgent(ChatProvider chatProvider, ToolRegistry toolRegistry,
                                 IntentRouter intentRouter, AgentProperties props) {
        return new ReActAgent(chatProvider, toolRegistry, intentRouter,
                props.getMaxSteps(), props.getDirectAnswerConfidence(), Clock.systemDefaultZone());
    }

    /**
     * Runs streamed agent sessions off the request thread so a disconnect can cancel them.
     */
    @Bean(name = "agentExecutor")
    public ThreadPoolTaskExecutor agentExecutor(AgentProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getExecutor().getCoreSize());
        executor.setMaxPoolSize(props.getExecutor().getMaxSize());
        executor.setQueueCapacity(props.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("agent-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    private static RestClient.Builder providerClient(AgentProperties.Provider provider) {
        return RestClient.builder()
                .baseUrl(provider.getBaseUrl())
                .requestFactory(timeouts(provider.getConnectTimeout(), provider.getReadTimeout()));
    }

    /**
     * JDK client so that interrupting a cancelled agent run aborts its in-flight exchange.
     */
    static JdkClientHttpRequestFactory timeouts(Duration connect, Duration read) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connect)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(read);
        return requestFactory;
    }
}

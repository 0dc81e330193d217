package io.prism.rag.qa.config;

import io.prism.rag.config.RetrievalProperties;
import io.prism.rag.config.StoreConfig;
import io.prism.rag.retrieval.HybridRetriever;
import io.prism.rag.retrieval.RrfFusion;
import io.prism.rag.retrieval.bm25.Bm25IndexStore;
import io.prism.rag.retrieval.cache.ChunkCache;
import io.prism.rag.retrieval.rerank.FallbackReranker;
import io.prism.rag.retrieval.rerank.JinaReranker;
import io.prism.rag.retrieval.rerank.Reranker;
import io.prism.rag.retrieval.rerank.RuleBasedReranker;
import io.prism.rag.service.EmbeddingService;
import io.prism.rag.service.RetrievalService;
import io.prism.rag.vector.VectorStore;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wiring of the read path: hybrid retriever, reranker chain, chunk cache and retrieval service.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        RetrievalProperties.class,
        RetrievalConfig.JinaProperties.class
})
public class RetrievalConfig {

    // ----------------------------------------------------------------------
    // Executor
    // ----------------------------------------------------------------------

    /**
     * Runs the vector and BM25 halves of a hybrid search side by side.
     */
    @Bean(name = "retrievalExecutor")
    public Executor retrievalExecutor(RetrievalProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getExecutor().getCorePoolSize());
        executor.setMaxPoolSize(props.getExecutor().getMaxPoolSize());
        executor.setQueueCapacity(props.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("retrieval-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // ----------------------------------------------------------------------
    // Retrieval
    // ----------------------------------------------------------------------

    @Bean
    public HybridRetriever hybridRetriever(VectorStore vectorStore,
                                           Bm25IndexStore bm25IndexStore,
                                           StoreConfig.Bm25Properties bm25Properties,
                                           RetrievalProperties props,
                                           @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
        return new HybridRetriever(
                vectorStore,
                bm25IndexStore,
                new RrfFusion(props.getRrfK(), props.getVectorWeight(), props.getBm25Weight()),
                retrievalExecutor,
                props.getCandidateMultiplier(),
                props.getSearchTimeout(),
                bm25Properties.getK1(),
                bm25Properties.getB());
    }

    @Bean
    public ChunkCache chunkCache(RetrievalProperties props) {
        return new ChunkCache(props.getCacheTtl(), props.getCacheMaxSize());
    }

    @Bean
    public RetrievalService retrievalService(EmbeddingService embeddingService,
                                             VectorStore vectorStore,
                                             HybridRetriever hybridRetriever,
                                             Reranker reranker,
                                             ChunkCache chunkCache,
                                             RetrievalProperties props) {
        return new RetrievalService(embeddingService, vectorStore, hybridRetriever, reranker, chunkCache, props);
    }

    // ----------------------------------------------------------------------
    // Reranking
    // ----------------------------------------------------------------------

    @Bean
    public Reranker reranker(RetrievalProperties props, JinaProperties jina) {
        RuleBasedReranker rule = new RuleBasedReranker();
        if ("rule".equalsIgnoreCase(props.getRerankProvider())) {
            log.info("Using rule-based reranker");
            return rule;
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(jina.getTimeout());
        requestFactory.setReadTimeout(jina.getTimeout());
        RestClient restClient = RestClient.builder()
                .baseUrl(jina.getUrl())
                .requestFactory(requestFactory)
                .build();

        log.info("Using Jina reranker ({}) with rule-based fallback", jina.getModel());
        return new FallbackReranker(new JinaReranker(restClient, jina.getApiKey(), jina.getModel()), rule);
    }

    // ----------------------------------------------------------------------
    // Configuration properties
    // ----------------------------------------------------------------------

    @Data
    @ConfigurationProperties(prefix = "prism.rerank.jina")
    public static class JinaProperties {
        private String url = "https://api.jina.ai";
        private String apiKey;
        private String model = "jina-reranker-v3";
        private Duration timeout = Duration.ofSeconds(10);
    }
}

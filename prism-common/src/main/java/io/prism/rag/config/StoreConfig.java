package io.prism.rag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prism.rag.retrieval.bm25.Bm25IndexStore;
import io.prism.rag.retrieval.bm25.FileSystemBm25IndexStore;
import io.prism.rag.service.EmbeddingService;
import io.prism.rag.vector.InMemoryVectorStore;
import io.prism.rag.vector.VectorStore;
import io.prism.rag.vector.chroma.ChromaCollectionApi;
import io.prism.rag.vector.chroma.ChromaVectorStore;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.support.RestClientAdapter;
import org.springframework.web.service.invoker.HttpServiceProxyFactory;

import java.nio.file.Path;

/**
 * Storage wiring shared by the index service and the RAG service.
 *
 * <p>Both processes must see the same vector collection and the same BM25 index directory, so
 * the beans live here rather than in either application.</p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        StoreConfig.Bm25Properties.class,
        StoreConfig.VectorStoreProperties.class,
        StoreConfig.EmbeddingProperties.class
})
public class StoreConfig {

    public static final String CHROMA_TOKEN_HEADER = "X-Chroma-Token";

    // ----------------------------------------------------------------------
    // BM25 index store
    // ----------------------------------------------------------------------

    @Bean
    public Bm25IndexStore bm25IndexStore(Bm25Properties props, ObjectMapper objectMapper) {
        log.info("BM25 indexes stored under {}", props.getIndexDir());
        return new FileSystemBm25IndexStore(Path.of(props.getIndexDir()), objectMapper);
    }

    // ----------------------------------------------------------------------
    // Vector store
    // ----------------------------------------------------------------------

    @Bean
    @ConditionalOnProperty(prefix = "prism.vector-store", name = "type", havingValue = "chroma")
    public VectorStore chromaVectorStore(VectorStoreProperties props) {
        RestClient.Builder builder = RestClient.builder().baseUrl(props.getUrl());
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader(CHROMA_TOKEN_HEADER, props.getApiKey());
        }
        ChromaCollectionApi api = HttpServiceProxyFactory
                .builderFor(RestClientAdapter.create(builder.build()))
                .build()
                .createClient(ChromaCollectionApi.class);
        log.info("Using Chroma vector store at {} (collection {})", props.getUrl(), props.getCollection());
        return new ChromaVectorStore(api, props.getCollection());
    }

    @Bean
    @ConditionalOnProperty(prefix = "prism.vector-store", name = "type", havingValue = "memory", matchIfMissing = true)
    public VectorStore inMemoryVectorStore() {
        log.info("Using in-memory vector store");
        return new InMemoryVectorStore();
    }

    // ----------------------------------------------------------------------
    // Embedding service
    // ----------------------------------------------------------------------

    @Bean
    public EmbeddingService embeddingService(EmbeddingModel embeddingModel, EmbeddingProperties props) {
        return new EmbeddingService(embeddingModel,
                embeddingModel.getClass().getSimpleName(),
                props.getQueryPrefix());
    }

    // ----------------------------------------------------------------------
    // Configuration properties
    // ----------------------------------------------------------------------

    @Data
    @ConfigurationProperties(prefix = "prism.bm25")
    public static class Bm25Properties {
        private String indexDir = "./data/bm25";
        private double k1 = 1.5d;
        private double b = 0.75d;
    }

    @Data
    @ConfigurationProperties(prefix = "prism.vector-store")
    public static class VectorStoreProperties {
        /** {@code chroma} or {@code memory}. */
        private String type = "memory";
        private String url = "http://localhost:8000";
        private String collection = "prism_chunks";
        private String apiKey;
    }

    @Data
    @ConfigurationProperties(prefix = "prism.embedding")
    public static class EmbeddingProperties {
        /** Prefix for query-side embeddings of asymmetric models; empty by default. */
        private String queryPrefix = "";
    }
}

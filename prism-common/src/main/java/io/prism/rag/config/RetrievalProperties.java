package io.prism.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for hybrid retrieval, caching and reranking.
 *
 * <p>Bound from {@code prism.retrieval.*} in {@code application.yml}.</p>
 */
@Data
@ConfigurationProperties(prefix = "prism.retrieval")
public class RetrievalProperties {

    /** RRF weight of the dense vector result list. */
    private double vectorWeight = 1.0d;

    /** RRF weight of the BM25 result list. */
    private double bm25Weight = 1.0d;

    private int rrfK = 60;

    /** Each underlying search returns {@code topK * candidateMultiplier} candidates. */
    private int candidateMultiplier = 4;

    /** Upper bound for the joined vector + BM25 search. */
    private Duration searchTimeout = Duration.ofSeconds(10);

    private Duration cacheTtl = Duration.ofHours(1);

    private long cacheMaxSize = 10_000;

    private boolean rerankEnabled = true;

    private int rerankTopN = 5;

    /** {@code jina} or {@code rule}. */
    private String rerankProvider = "jina";

    private int maxTopK = 50;

    private Executor executor = new Executor();

    @Data
    public static class Executor {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 500;
    }
}

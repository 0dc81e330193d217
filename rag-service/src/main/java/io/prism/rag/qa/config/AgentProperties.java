package io.prism.rag.qa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the ReAct agent and its model providers.
 *
 * <p>Bound from {@code prism.agent.*} in {@code application.yml}.</p>
 */
@Data
@ConfigurationProperties(prefix = "prism.agent")
public class AgentProperties {

    /** {@code openai} or {@code gemini}. */
    private String provider = "openai";

    private int maxSteps = 10;

    private double temperature = 0.3d;

    private int maxTokens = 1000;

    /** {@code rule} or {@code llm}. */
    private String router = "rule";

    /** Minimum confidence for a DIRECT_ANSWER classification to skip the loop. */
    private double directAnswerConfidence = 0.9d;

    /** Upper bound for one blocking run; the run is cancelled when it expires. */
    private Duration chatTimeout = Duration.ofMinutes(3);

    /** Upper bound for one streamed run before the emitter times out. */
    private Duration streamTimeout = Duration.ofMinutes(5);

    private Provider openai = new Provider("https://api.openai.com/v1", "gpt-4o-mini");

    private Provider gemini = new Provider("https://generativelanguage.googleapis.com/v1beta", "gemini-2.0-flash");

    private Retry retry = new Retry();

    private Executor executor = new Executor();

    @Data
    public static class Provider {
        private String baseUrl;
        private String apiKey;
        private String model;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);

        public Provider() {
        }

        public Provider(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }
    }

    /**
     * Backoff for transient provider errors: waits {@code multiplier * 2^(attempt-1)} seconds,
     * clamped to {@code [minBackoff, maxBackoff]}.
     */
    @Data
    public static class Retry {
        private int maxAttempts = 5;
        private double multiplier = 2.0d;
        private Duration minBackoff = Duration.ofSeconds(4);
        private Duration maxBackoff = Duration.ofSeconds(60);
    }

    @Data
    public static class Executor {
        private int coreSize = 4;
        private int maxSize = 16;
        private int queueCapacity = 100;
    }
}

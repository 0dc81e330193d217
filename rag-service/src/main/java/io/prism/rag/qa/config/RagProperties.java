package io.prism.rag.qa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the single-shot RAG prompt endpoint.
 *
 * <p>Bound from {@code prism.rag.*} in {@code application.yml}.</p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "prism.rag")
public class RagProperties {

    /** Chunks retrieved when the request does not set {@code topK}. */
    private int defaultTopK = 5;

    /** Cap, in characters, on the passages block of the prompt. */
    private int maxContextLength = 12000;

    private String defaultSystemPrompt = """
            You answer questions about the user's documents using only the numbered passages you are given.
            - Do not add facts that are not in the passages.
            - After each claim, cite the passage it came from with its marker, such as [[citation:2]].
            - When several passages agree, combine them and cite all of them.
            - When the passages only partly cover the question, answer that part and say what is missing.
            - Keep the answer short and start with the answer itself.""";
}

package io.prism.rag.qa.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answer of {@code POST /api/rag/prompt} with its numbered sources.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RagPromptResponse {

    private String answer;

    private String question;

    /** Chat model that produced the answer, or {@code none} when nothing was retrieved. */
    private String model;

    private long searchTimeMs;

    private long generationTimeMs;

    private long totalTimeMs;

    private int sourcesUsed;

    private List<Source> sources;

    /** Passages as ranked, present only when the request asked for them. */
    private List<ContextChunk> context;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Source {

        /** Number used in the answer's {@code [[citation:N]]} markers. */
        private int citation;

        private String documentId;

        private String chunkId;

        private String section;

        private Object page;

        private String chunkText;

        private double score;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ContextChunk {

        private int rank;

        private double score;

        private String text;

        private String section;
    }
}

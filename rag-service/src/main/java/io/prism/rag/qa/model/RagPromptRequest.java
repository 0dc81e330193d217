package io.prism.rag.qa.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.prism.rag.model.RetrievalMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/rag/prompt}. Field names follow the retrieval endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RagPromptRequest {

    private String question;

    @JsonProperty("user_id")
    private String userId;

    /** Scopes retrieval to one document, enabling hybrid search. */
    @JsonProperty("document_id")
    private String documentId;

    private RetrievalMode mode;

    /** {@code 0} means {@code prism.rag.default-top-k}. */
    @Builder.Default
    @JsonProperty("top_k")
    private int topK = 0;

    @JsonProperty("system_prompt")
    private String systemPrompt;

    /** Echo the ranked passages in the response. */
    @Builder.Default
    @JsonProperty("include_context")
    private boolean includeContext = false;
}

package io.prism.rag.qa.service;

import io.prism.rag.model.Chunk;
import io.prism.rag.model.RetrievalMode;
import io.prism.rag.model.RetrievalQuery;
import io.prism.rag.model.RetrievedChunk;
import io.prism.rag.qa.config.RagProperties;
import io.prism.rag.qa.model.RagPromptRequest;
import io.prism.rag.qa.model.RagPromptResponse;
import io.prism.rag.qa.model.RagPromptResponse.ContextChunk;
import io.prism.rag.qa.model.RagPromptResponse.Source;
import io.prism.rag.service.InvalidRequestException;
import io.prism.rag.service.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Single-shot grounded answering, without the agent loop.
 *
 * <p>Retrieves the user's chunks (hybrid when a document id is given), numbers them as
 * {@code [[citation:N]]} sources inside the prompt, and asks the Spring AI {@link ChatModel} for
 * an answer. The context block is capped at {@code prism.rag.max-context-length} characters.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RagService {

    static final String NO_CONTEXT_ANSWER = "I couldn't find any relevant passages to answer your question. "
            + "Please try rephrasing it or check that the relevant documents have been indexed.";

    private static final String USER_PROMPT = """
            Answer the question using the numbered passages below.

            === PASSAGES ===
            %s
            === END PASSAGES ===

            Question: %s""";

    private final RetrievalService retrievalService;
    private final ChatModel chatModel;
    private final RagProperties ragProperties;

    public RagPromptResponse prompt(RagPromptRequest request) {
        if (!StringUtils.hasText(request.getQuestion())) {
            throw new InvalidRequestException("question must not be blank");
        }
        long started = System.currentTimeMillis();

        List<RetrievedChunk> chunks = retrievalService.retrieve(toQuery(request));
        long retrievedAt = System.currentTimeMillis();
        log.info("Retrieved {} chunks for RAG prompt in {}ms (document={})",
                chunks.size(), retrievedAt - started, request.getDocumentId());

        Generated generated = chunks.isEmpty()
                ? new Generated(NO_CONTEXT_ANSWER, "none")
                : generate(request, chunks);
        long finished = System.currentTimeMillis();

        List<Source> sources = IntStream.range(0, chunks.size())
                .mapToObj(i -> toSource(i + 1, chunks.get(i)))
                .toList();

        return RagPromptResponse.builder()
                .answer(generated.answer())
                .question(request.getQuestion())
                .model(generated.model())
                .searchTimeMs(retrievedAt - started)
                .generationTimeMs(finished - retrievedAt)
                .totalTimeMs(finished - started)
                .sourcesUsed(sources.size())
                .sources(sources)
                .context(request.isIncludeContext() ? toContext(chunks) : null)
                .build();
    }

    private RetrievalQuery toQuery(RagPromptRequest request) {
        int topK = request.getTopK() > 0 ? request.getTopK() : ragProperties.getDefaultTopK();
        return RetrievalQuery.builder()
                .query(request.getQuestion())
                .userId(request.getUserId())
                .documentId(request.getDocumentId())
                .mode(request.getMode() != null ? request.getMode() : RetrievalMode.HYBRID)
                .topK(topK)
                .rerank(true)
                .rerankTopN(topK)
                .build();
    }

    private Generated generate(RagPromptRequest request, List<RetrievedChunk> chunks) {
        String system = StringUtils.hasText(request.getSystemPrompt())
                ? request.getSystemPrompt()
                : ragProperties.getDefaultSystemPrompt();
        String user = String.format(USER_PROMPT, assembleContext(chunks), request.getQuestion());

        ChatResponse response = chatModel.call(new Prompt(List.of(new SystemMessage(system), new UserMessage(user))));
        String answer = response.getResult().getOutput().getText();
        String model = response.getMetadata() != null && StringUtils.hasText(response.getMetadata().getModel())
                ? response.getMetadata().getModel()
                : "unknown";
        log.info("Generated RAG answer with {} ({} chars)", model, answer != null ? answer.length() : 0);
        return new Generated(answer, model);
    }

    /**
     * Renders chunks as numbered passages. Stops before the passage that would exceed the length
     * cap, keeping a truncated head of it only when more than 100 chars of room remain.
     */
    String assembleContext(List<RetrievedChunk> chunks) {
        int maxLength = ragProperties.getMaxContextLength();
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            String section = metadataString(chunk, Chunk.SECTION_PATH);
            String passage = String.format("[[citation:%d]] %s (score: %.2f)%n%s%n%n",
                    i + 1, section != null ? section : "Unknown section", score(chunk), chunk.getText());

            int room = maxLength - context.length();
            if (passage.length() > room) {
                if (room > 100) {
                    context.append(passage, 0, room);
                    log.debug("RAG context truncated at passage {} of {}", i + 1, chunks.size());
                }
                break;
            }
            context.append(passage);
        }
        return context.toString().trim();
    }

    private static Source toSource(int citation, RetrievedChunk chunk) {
        Map<String, Object> metadata = chunk.getMetadata() != null ? chunk.getMetadata() : Map.of();
        return Source.builder()
                .citation(citation)
                .documentId(metadataString(chunk, Chunk.DOCUMENT_ID))
                .chunkId(chunk.getId())
                .section(metadataString(chunk, Chunk.SECTION_PATH))
                .page(metadata.get(Chunk.PAGE_NUMBER))
                .chunkText(chunk.getText())
                .score(score(chunk))
                .build();
    }

    private static List<ContextChunk> toContext(List<RetrievedChunk> chunks) {
        return IntStream.range(0, chunks.size())
                .mapToObj(i -> ContextChunk.builder()
                        .rank(i + 1)
                        .score(score(chunks.get(i)))
                        .text(chunks.get(i).getText())
                        .section(metadataString(chunks.get(i), Chunk.SECTION_PATH))
                        .build())
                .toList();
    }

    private static double score(RetrievedChunk chunk) {
        if (chunk.getRerankScore() != null) {
            return chunk.getRerankScore();
        }
        if (chunk.getFusedScore() != null) {
            return chunk.getFusedScore();
        }
        return 1.0d - chunk.distanceOrDefault();
    }

    private static String metadataString(RetrievedChunk chunk, String key) {
        Object value = chunk.getMetadata() != null ? chunk.getMetadata().get(key) : null;
        return value != null ? value.toString() : null;
    }

    private record Generated(String answer, String model) {
    }
}

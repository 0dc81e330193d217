package io.prism.rag.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.retry.TransientAiException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Produces dense vectors for chunk text and search queries through the configured Spring AI
 * {@link EmbeddingModel}.
 *
 * <p>Which provider backs the model (OpenAI or Ollama) is decided by
 * {@code spring.ai.model.embedding}; this class only sees the black-box contract of text in,
 * fixed-length vector out.</p>
 *
 * <ul>
 *   <li>{@link #embedQuery(String)} embeds a query, optionally with an instruction prefix</li>
 *   <li>{@link #embedBatch(List)} embeds chunk texts in provider calls of {@value #BATCH_SIZE}</li>
 * </ul>
 *
 * <p>If the provider rejects a single input as too large, the text is cut at the boundary
 * nearest its middle, both parts are embedded, and the vectors are averaged.</p>
 */
@Slf4j
public class EmbeddingService {

    public static final int BATCH_SIZE = 100;

    // Chunking happens upstream; anything longer is malformed input.
    private static final int MAX_INPUT_CHARS = 8000;

    private static final int SPLIT_WINDOW = 120;

    private static final Pattern OVERSIZED = Pattern.compile(
            "input \\(\\d+ tokens\\) is too large|physical batch size|maximum context length");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private final EmbeddingModel embeddingModel;

    @Getter
    private final String modelName;

    private final String queryPrefix;

    public EmbeddingService(EmbeddingModel embeddingModel, String modelName) {
        this(embeddingModel, modelName, "");
    }

    public EmbeddingService(EmbeddingModel embeddingModel, String modelName, String queryPrefix) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.queryPrefix = queryPrefix != null ? queryPrefix : "";
    }

    public List<Double> embed(String text) {
        return embedSingle(prepare(text));
    }

    public List<Double> embedQuery(String query) {
        String normalized = normalize(query);
        return embedSingle(normalized.isEmpty() ? "" : truncate(queryPrefix + normalized));
    }

    /**
     * Embeds texts in order. The returned list has one vector per input; blank inputs map to an
     * empty vector.
     */
    public List<List<Double>> embedBatch(List<String> texts) {
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        int batches = 0;
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            List<String> batch = texts.subList(from, Math.min(from + BATCH_SIZE, texts.size()))
                    .stream()
                    .map(this::prepare)
                    .toList();
            vectors.addAll(callBatch(batch));
            batches++;
        }
        log.debug("Embedded {} texts in {} provider call(s) with {}", texts.size(), batches, modelName);
        return vectors;
    }

    private List<List<Double>> callBatch(List<String> batch) {
        if (batch.stream().anyMatch(String::isEmpty)) {
            return batch.stream().map(this::embedSingle).toList();
        }
        try {
            List<Embedding> results = embeddingModel.call(new EmbeddingRequest(batch, null)).getResults();
            if (results.size() != batch.size()) {
                throw new IllegalStateException("Embedding provider returned " + results.size()
                        + " vectors for " + batch.size() + " inputs");
            }
            return results.stream().map(result -> toVector(result.getOutput())).toList();
        } catch (TransientAiException e) {
            if (!isOversized(e)) {
                throw e;
            }
            log.info("Provider rejected a batch of {} as oversized, retrying inputs individually", batch.size());
            return batch.stream().map(this::embedSingle).toList();
        }
    }

    private List<Double> embedSingle(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        try {
            return toVector(embeddingModel.call(new EmbeddingRequest(List.of(text), null))
                    .getResults().get(0).getOutput());
        } catch (TransientAiException e) {
            if (!isOversized(e) || text.length() < 2) {
                throw e;
            }
            int cut = splitPoint(text);
            log.info("Input of {} chars is too large for {}, embedding halves split at {}", text.length(), modelName, cut);
            return average(embedSingle(text.substring(0, cut).trim()), embedSingle(text.substring(cut).trim()));
        }
    }

    private static List<Double> average(List<Double> first, List<Double> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return first.isEmpty() ? second : first;
        }
        if (first.size() != second.size()) {
            throw new IllegalStateException("Split embeddings differ in dimension: "
                    + first.size() + " vs " + second.size());
        }
        List<Double> mean = new ArrayList<>(first.size());
        for (int i = 0; i < first.size(); i++) {
            mean.add((first.get(i) + second.get(i)) / 2.0d);
        }
        return mean;
    }

    /**
     * Position to cut an oversized text: the paragraph break, sentence end or space closest to the
     * middle, within {@value #SPLIT_WINDOW} chars of it, else the middle itself.
     */
    static int splitPoint(String text) {
        int middle = text.length() / 2;
        for (String boundary : List.of("\n", ". ", " ")) {
            int best = -1;
            for (int offset = 0; offset <= SPLIT_WINDOW && best < 0; offset++) {
                if (boundaryAt(text, boundary, middle - offset)) {
                    best = middle - offset;
                } else if (boundaryAt(text, boundary, middle + offset)) {
                    best = middle + offset;
                }
            }
            if (best > 0) {
                return best + boundary.length() - 1;
            }
        }
        return middle;
    }

    private static boolean boundaryAt(String text, String boundary, int index) {
        return index > 0 && index < text.length() - 1 && text.startsWith(boundary, index);
    }

    private static boolean isOversized(TransientAiException e) {
        return e.getMessage() != null && OVERSIZED.matcher(e.getMessage()).find();
    }

    private String prepare(String text) {
        return truncate(normalize(text));
    }

    private String truncate(String text) {
        if (text.length() <= MAX_INPUT_CHARS) {
            return text;
        }
        log.warn("Embedding input of {} chars truncated to {}", text.length(), MAX_INPUT_CHARS);
        return text.substring(0, MAX_INPUT_CHARS);
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = HORIZONTAL_SPACE.matcher(text.replace("\u0000", "")).replaceAll(" ");
        return BLANK_LINES.matcher(cleaned).replaceAll("\n\n").trim();
    }

    private static List<Double> toVector(float[] output) {
        List<Double> vector = new ArrayList<>(output.length);
        for (float value : output) {
            vector.add((double) value);
        }
        return vector;
    }
}

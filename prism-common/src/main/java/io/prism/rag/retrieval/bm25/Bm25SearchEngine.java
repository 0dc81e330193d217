package io.prism.rag.retrieval.bm25;

import io.prism.rag.retrieval.Tokenizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory Okapi BM25 scorer over one document's chunk index.
 *
 * <p>Query cost is proportional to the number of query terms times the average posting list
 * length. Scores grow with relevance; ties are broken by chunk index so equal scores keep
 * document order.</p>
 */
public class Bm25SearchEngine {

    public static final double DEFAULT_K1 = 1.5d;
    public static final double DEFAULT_B = 0.75d;

    private static final Comparator<Bm25Hit> RANKING = Comparator
            .comparingDouble(Bm25Hit::score).reversed()
            .thenComparingInt(Bm25Hit::chunkIndex);

    private final Bm25IndexData index;
    private final double k1;
    private final double b;

    public Bm25SearchEngine(Bm25IndexData index) {
        this(index, DEFAULT_K1, DEFAULT_B);
    }

    public Bm25SearchEngine(Bm25IndexData index, double k1, double b) {
        if (k1 < 0) {
            throw new IllegalArgumentException("k1 must be >= 0");
        }
        if (b < 0 || b > 1) {
            throw new IllegalArgumentException("b must be within [0, 1]");
        }
        this.index = index;
        this.k1 = k1;
        this.b = b;
    }

    public List<Bm25Hit> search(String query, int k) {
        if (k <= 0 || index == null || index.isEmpty()) {
            return List.of();
        }

        List<String> queryTerms = Tokenizer.tokenize(query);
        if (queryTerms.isEmpty()) {
            return List.of();
        }

        int chunkCount = index.getChunkCount();
        double averageLength = Math.max(index.getAverageChunkLength(), 1e-9);
        Map<Integer, Double> scores = new HashMap<>();

        for (String term : queryTerms) {
            List<Integer> posting = index.getPostings().get(term);
            if (posting == null || posting.isEmpty()) {
                continue;
            }
            double idf = idf(chunkCount, index.getDocumentFrequencies().getOrDefault(term, posting.size()));

            for (Integer ordinal : posting) {
                Bm25IndexData.IndexedChunk chunk = index.getChunks().get(ordinal);
                int tf = chunk.getTermFrequencies().getOrDefault(term, 0);
                if (tf == 0) {
                    continue;
                }
                double norm = k1 * (1 - b + b * chunk.getLength() / averageLength);
                double termScore = idf * (tf * (k1 + 1)) / (tf + norm);
                scores.merge(ordinal, termScore, Double::sum);
            }
        }

        List<Bm25Hit> hits = new ArrayList<>(scores.size());
        for (Map.Entry<Integer, Double> entry : scores.entrySet()) {
            Bm25IndexData.IndexedChunk chunk = index.getChunks().get(entry.getKey());
            hits.add(new Bm25Hit(chunk.getChunkId(), chunk.getChunkIndex(), chunk.getText(),
                    chunk.getMetadata(), entry.getValue()));
        }
        hits.sort(RANKING);
        return hits.size() > k ? new ArrayList<>(hits.subList(0, k)) : hits;
    }

    /** Non-negative IDF variant: {@code ln((N - df + 0.5) / (df + 0.5) + 1)}. */
    static double idf(int chunkCount, int documentFrequency) {
        return Math.log((chunkCount - documentFrequency + 0.5d) / (documentFrequency + 0.5d) + 1d);
    }

    public Bm25IndexData getIndex() {
        return index;
    }
}

package io.prism.rag.retrieval;

import io.prism.rag.model.Chunk;
import io.prism.rag.model.RetrievalResult;
import io.prism.rag.retrieval.bm25.Bm25Hit;
import io.prism.rag.vector.VectorMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion of a vector result list and a BM25 result list.
 *
 * <p>For every chunk: {@code fused = sum(weight_list / (k + rank_in_list))} over the lists that
 * contain it, with 1-based ranks. A chunk found by only one list is still scored from that list.
 * Output is sorted by fused score descending, then chunk index ascending.</p>
 */
public class RrfFusion {

    public static final int DEFAULT_K = 60;

    private static final Comparator<RetrievalResult> RANKING = Comparator
            .comparingDouble(RetrievalResult::getFusedScore).reversed()
            .thenComparingInt(RetrievalResult::chunkIndex);

    private final int k;
    private final double vectorWeight;
    private final double bm25Weight;

    public RrfFusion() {
        this(DEFAULT_K, 1.0d, 1.0d);
    }

    public RrfFusion(int k, double vectorWeight, double bm25Weight) {
        if (k < 0) {
            throw new IllegalArgumentException("RRF constant must be >= 0");
        }
        if (vectorWeight < 0 || bm25Weight < 0) {
            throw new IllegalArgumentException("RRF weights must be >= 0");
        }
        this.k = k;
        this.vectorWeight = vectorWeight;
        this.bm25Weight = bm25Weight;
    }

    public List<RetrievalResult> fuse(List<VectorMatch> vectorResults, List<Bm25Hit> bm25Results, int limit) {
        Map<String, RetrievalResult> byId = new LinkedHashMap<>();

        int rank = 1;
        for (VectorMatch match : vectorResults) {
            RetrievalResult result = byId.computeIfAbsent(match.id(), id -> RetrievalResult.builder()
                    .chunkId(id)
                    .text(match.text())
                    .metadata(match.metadata())
                    .build());
            if (result.getVectorScore() == null) {
                result.setVectorScore(match.similarity());
                result.setFusedScore(result.getFusedScore() + contribution(vectorWeight, rank));
            }
            rank++;
        }

        rank = 1;
        for (Bm25Hit hit : bm25Results) {
            RetrievalResult result = byId.computeIfAbsent(hit.chunkId(), id -> RetrievalResult.builder()
                    .chunkId(id)
                    .text(hit.text())
                    .metadata(withChunkIndex(hit))
                    .build());
            if (result.getBm25Score() == null) {
                result.setBm25Score(hit.score());
                result.setFusedScore(result.getFusedScore() + contribution(bm25Weight, rank));
            }
            rank++;
        }

        List<RetrievalResult> fused = new ArrayList<>(byId.values());
        fused.sort(RANKING);
        return limit >= 0 && fused.size() > limit ? new ArrayList<>(fused.subList(0, limit)) : fused;
    }

    double contribution(double weight, int rank) {
        return weight / (k + rank);
    }

    private static Map<String, Object> withChunkIndex(Bm25Hit hit) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (hit.metadata() != null) {
            metadata.putAll(hit.metadata());
        }
        metadata.putIfAbsent(Chunk.CHUNK_INDEX, hit.chunkIndex());
        return metadata;
    }
}

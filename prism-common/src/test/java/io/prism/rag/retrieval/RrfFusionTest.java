package io.prism.rag.retrieval;

import io.prism.rag.model.RetrievalResult;
import io.prism.rag.retrieval.bm25.Bm25Hit;
import io.prism.rag.vector.VectorMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RrfFusionTest {

    private static VectorMatch vector(String id, int index, double distance) {
        return new VectorMatch(id, "text " + id, Map.of("chunk_index", index), distance);
    }

    private static Bm25Hit bm25(String id, int index, double score) {
        return new Bm25Hit(id, index, "text " + id, Map.of(), score);
    }

    @Test
    void chunkFoundByBothListsOutranksSingleListHits() {
        RrfFusion fusion = new RrfFusion();

        List<RetrievalResult> fused = fusion.fuse(
                List.of(vector("a", 0, 0.1), vector("b", 1, 0.2)),
                List.of(bm25("b", 1, 7.0), bm25("c", 2, 3.0)),
                10);

        assertThat(fused).extracting(RetrievalResult::getChunkId).containsExactly("b", "a", "c");
        assertThat(fused.get(0).getFusedScore()).isCloseTo(1d / 62 + 1d / 61, within(1e-12));
        assertThat(fused.get(0).getVectorScore()).isCloseTo(0.8, within(1e-12));
        assertThat(fused.get(0).getBm25Score()).isEqualTo(7.0);
    }

    @Test
    void rankOneInBothBeatsRankOneInOne() {
        List<RetrievalResult> fused = new RrfFusion().fuse(
                List.of(vector("x", 5, 0.1), vector("y", 0, 0.2)),
                List.of(bm25("x", 5, 2.0)),
                10);

        assertThat(fused.get(0).getChunkId()).isEqualTo("x");
        assertThat(fused.get(0).getFusedScore()).isGreaterThan(1d / 61);
    }

    @Test
    void emptyBm25ListKeepsVectorOrder() {
        List<RetrievalResult> fused = new RrfFusion().fuse(
                List.of(vector("a", 3, 0.1), vector("b", 1, 0.2), vector("c", 2, 0.3)),
                List.of(),
                10);

        assertThat(fused).extracting(RetrievalResult::getChunkId).containsExactly("a", "b", "c");
        assertThat(fused).allMatch(r -> r.getBm25Score() == null);
    }

    @Test
    void equalScoresAreOrderedByChunkIndex() {
        List<RetrievalResult> fused = new RrfFusion().fuse(
                List.of(vector("late", 9, 0.1)),
                List.of(bm25("early", 2, 1.0)),
                10);

        assertThat(fused).extracting(RetrievalResult::getChunkId).containsExactly("early", "late");
    }

    @Test
    void weightsScaleContributions() {
        RrfFusion fusion = new RrfFusion(60, 1.0, 3.0);

        List<RetrievalResult> fused = fusion.fuse(
                List.of(vector("v", 0, 0.1)),
                List.of(bm25("k", 1, 1.0)),
                10);

        assertThat(fused.get(0).getChunkId()).isEqualTo("k");
        assertThat(fusion.contribution(3.0, 1)).isCloseTo(3d / 61, within(1e-12));
    }

    @Test
    void truncatesToLimit() {
        List<RetrievalResult> fused = new RrfFusion().fuse(
                List.of(vector("a", 0, 0.1), vector("b", 1, 0.2), vector("c", 2, 0.3)),
                List.of(),
                2);

        assertThat(fused).hasSize(2);
    }

    @Test
    void rejectsNegativeParameters() {
        assertThatThrownBy(() -> new RrfFusion(-1, 1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RrfFusion(60, -1, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}

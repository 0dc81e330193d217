package io.prism.rag.retrieval.bm25;

import io.prism.rag.model.Chunk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class Bm25SearchEngineTest {

    private static Bm25IndexData index(String... texts) {
        List<Chunk> chunks = new java.util.ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            chunks.add(new Chunk("doc", texts[i], i, Map.of()));
        }
        return new Bm25IndexBuilder().build("doc", chunks);
    }

    @Test
    void ranksChunkWithMoreMatchingTermsFirst() {
        Bm25SearchEngine engine = new Bm25SearchEngine(index(
                "the weather is mild today",
                "battery capacity and battery chemistry",
                "battery"));

        List<Bm25Hit> hits = engine.search("battery chemistry", 10);

        assertThat(hits).extracting(Bm25Hit::chunkId)
                .containsExactly("doc_chunk_1", "doc_chunk_2");
        assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
    }

    @Test
    void equalScoresKeepDocumentOrder() {
        Bm25SearchEngine engine = new Bm25SearchEngine(index(
                "solar panel",
                "wind turbine",
                "solar panel"));

        List<Bm25Hit> hits = engine.search("solar", 10);

        assertThat(hits).extracting(Bm25Hit::chunkIndex).containsExactly(0, 2);
        assertThat(hits.get(0).score()).isEqualTo(hits.get(1).score());
    }

    @Test
    void limitsResultsToK() {
        Bm25SearchEngine engine = new Bm25SearchEngine(index("a x", "a y", "a z"));

        assertThat(engine.search("a", 2)).hasSize(2);
        assertThat(engine.search("a", 0)).isEmpty();
    }

    @Test
    void unknownOrEmptyQueryYieldsNothing() {
        Bm25SearchEngine engine = new Bm25SearchEngine(index("alpha beta"));

        assertThat(engine.search("gamma", 5)).isEmpty();
        assertThat(engine.search("   ", 5)).isEmpty();
    }

    @Test
    void emptyIndexYieldsNothing() {
        assertThat(new Bm25SearchEngine(index()).search("anything", 5)).isEmpty();
    }

    @Test
    void idfStaysPositiveForUbiquitousTerms() {
        assertThat(Bm25SearchEngine.idf(3, 3)).isGreaterThan(0d);
        assertThat(Bm25SearchEngine.idf(10, 1)).isGreaterThan(Bm25SearchEngine.idf(10, 5));
        assertThat(Bm25SearchEngine.idf(1, 1)).isCloseTo(Math.log(1d / 3d + 1d), within(1e-12));
    }

    @Test
    void rejectsInvalidParameters() {
        Bm25IndexData data = index("x");
        assertThatThrownBy(() -> new Bm25SearchEngine(data, -1, 0.75))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Bm25SearchEngine(data, 1.5, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findsCjkTextByBigram() {
        Bm25SearchEngine engine = new Bm25SearchEngine(index("今天天气很好", "营收增长显著"));

        List<Bm25Hit> hits = engine.search("营收", 5);

        assertThat(hits).isNotEmpty();
        assertThat(hits.get(0).chunkIndex()).isEqualTo(1);
    }
}

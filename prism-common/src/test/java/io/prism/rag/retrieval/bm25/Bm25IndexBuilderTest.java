package io.prism.rag.retrieval.bm25;

import io.prism.rag.model.Chunk;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class Bm25IndexBuilderTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void buildsStatisticsInChunkOrder() {
        Bm25IndexData data = new Bm25IndexBuilder(clock).build("doc", List.of(
                new Chunk("doc", "beta gamma gamma", 1, Map.of()),
                new Chunk("doc", "alpha beta", 0, Map.of("section_path", "Intro"))));

        assertThat(data.getDocumentId()).isEqualTo("doc");
        assertThat(data.getBuiltAt()).isEqualTo(clock.instant());
        assertThat(data.getChunkCount()).isEqualTo(2);
        assertThat(data.getAverageChunkLength()).isEqualTo(2.5d);
        assertThat(data.getVocabulary()).containsExactly("alpha", "beta", "gamma");
        assertThat(data.getDocumentFrequencies()).containsEntry("beta", 2).containsEntry("gamma", 1);
        assertThat(data.getPostings().get("beta")).containsExactly(0, 1);
        assertThat(data.getChunks()).extracting(Bm25IndexData.IndexedChunk::getChunkIndex).containsExactly(0, 1);
        assertThat(data.getChunks().get(1).getTermFrequencies()).containsEntry("gamma", 2);
        assertThat(data.getChunks().get(0).getMetadata()).containsEntry("section_path", "Intro");
    }

    @Test
    void emptyChunkListBuildsEmptyIndex() {
        Bm25IndexData data = new Bm25IndexBuilder(clock).build("doc", List.of());

        assertThat(data.isEmpty()).isTrue();
        assertThat(data.getAverageChunkLength()).isZero();
    }
}

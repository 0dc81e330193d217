package io.prism.rag.vector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryVectorStoreTest {

    private InMemoryVectorStore store;

    private static VectorEntry entry(String doc, int index, String user, Double... embedding) {
        return new VectorEntry(doc + "_chunk_" + index, "text " + index, List.of(embedding),
                Map.of("document_id", doc, "user_id", user, "chunk_index", index));
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        store.add(List.of(
                entry("d1", 0, "alice", 1.0, 0.0),
                entry("d1", 1, "alice", 0.0, 1.0),
                entry("d2", 0, "alice", 0.9, 0.1),
                entry("d3", 0, "bob", 1.0, 0.0)));
    }

    @Test
    void returnsClosestFirstScopedToUser() {
        List<VectorMatch> matches = store.query(List.of(1.0, 0.0), "alice", null, 10);

        assertThat(matches).extracting(VectorMatch::id)
                .containsExactly("d1_chunk_0", "d2_chunk_0", "d1_chunk_1");
        assertThat(matches.get(0).distance()).isCloseTo(0.0, within(1e-9));
        assertThat(matches.get(0).similarity()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void filtersByDocument() {
        List<VectorMatch> matches = store.query(List.of(1.0, 0.0), "alice", "d1", 10);

        assertThat(matches).extracting(VectorMatch::id).containsExactly("d1_chunk_0", "d1_chunk_1");
    }

    @Test
    void neverReturnsAnotherUsersChunks() {
        assertThat(store.query(List.of(1.0, 0.0), "bob", null, 10))
                .extracting(VectorMatch::id).containsExactly("d3_chunk_0");
        assertThat(store.query(List.of(1.0, 0.0), "carol", null, 10)).isEmpty();
    }

    @Test
    void deletesAndCountsByDocument() {
        assertThat(store.countByDocument("d1")).isEqualTo(2);

        store.deleteByDocument("d1");

        assertThat(store.countByDocument("d1")).isZero();
        assertThat(store.countByDocument("d2")).isEqualTo(1);
    }

    @Test
    void rejectsDimensionMismatch() {
        assertThatThrownBy(() -> store.query(List.of(1.0, 0.0, 0.0), "alice", null, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimension");
    }

    @Test
    void zeroVectorIsMaximallyDistant() {
        assertThat(InMemoryVectorStore.cosineDistance(List.of(0.0, 0.0), List.of(1.0, 0.0))).isEqualTo(1.0);
    }
}

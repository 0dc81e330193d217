package io.prism.rag.retrieval;

import io.prism.rag.model.Chunk;
import io.prism.rag.model.RetrievalResult;
import io.prism.rag.retrieval.bm25.Bm25IndexBuilder;
import io.prism.rag.retrieval.bm25.Bm25IndexStore;
import io.prism.rag.vector.InMemoryVectorStore;
import io.prism.rag.vector.VectorEntry;
import io.prism.rag.vector.VectorMatch;
import io.prism.rag.vector.VectorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HybridRetrieverTest {

    private final List<Double> query = List.of(1.0, 0.0);

    private ExecutorService executor;
    private InMemoryVectorStore vectorStore;
    private Bm25IndexStore bm25Store;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        vectorStore = new InMemoryVectorStore();
        bm25Store = mock(Bm25IndexStore.class);

        vectorStore.add(List.of(
                entry(0, "solar panels convert light", 0.6, 0.8),
                entry(1, "wind turbines rotate", 1.0, 0.0),
                entry(2, "battery storage chemistry", 0.8, 0.6)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static VectorEntry entry(int index, String text, Double... embedding) {
        return new VectorEntry(Chunk.idFor("doc", index), text, List.of(embedding),
                Map.of("document_id", "doc", "user_id", "alice", "chunk_index", index));
    }

    private static Map<String, Object> owner(String userId) {
        return Map.of(Chunk.USER_ID, userId);
    }

    private HybridRetriever retriever(VectorStore store, Duration timeout) {
        return new HybridRetriever(store, bm25Store, new RrfFusion(), executor, 4, timeout, 1.5, 0.75);
    }

    @Test
    void missingBm25IndexGivesVectorOrder() {
        when(bm25Store.load("doc")).thenReturn(Optional.empty());

        List<RetrievalResult> results = retriever(vectorStore, Duration.ofSeconds(5))
                .search("anything", "doc", "alice", query, 3);

        List<String> vectorOnly = vectorStore.query(query, "alice", "doc", 3).stream()
                .map(VectorMatch::id).toList();
        assertThat(results).extracting(RetrievalResult::getChunkId).isEqualTo(vectorOnly);
    }

    @Test
    void keywordMatchIsPromotedByFusion() {
        List<Chunk> chunks = List.of(
                new Chunk("doc", "solar panels convert light", 0, owner("alice")),
                new Chunk("doc", "wind turbines rotate", 1, owner("alice")),
                new Chunk("doc", "battery storage chemistry", 2, owner("alice")));
        when(bm25Store.load("doc")).thenReturn(Optional.of(new Bm25IndexBuilder().build("doc", chunks)));

        List<RetrievalResult> results = retriever(vectorStore, Duration.ofSeconds(5))
                .search("battery chemistry", "doc", "alice", query, 3);

        assertThat(results.get(0).getChunkId()).isEqualTo("doc_chunk_2");
        assertThat(results.get(0).getBm25Score()).isNotNull();
        assertThat(results.get(0).getVectorScore()).isNotNull();
    }

    @Test
    void searchWithoutDocumentSkipsBm25() {
        List<RetrievalResult> results = retriever(vectorStore, Duration.ofSeconds(5))
                .search("wind", null, "alice", query, 2);

        assertThat(results).hasSize(2);
        verify(bm25Store, never()).load(anyString());
    }

    @Test
    void timeoutSurfacesAsRetrievalException() {
        VectorStore slow = mock(VectorStore.class);
        when(slow.query(any(), any(), any(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        });
        when(bm25Store.load("doc")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> retriever(slow, Duration.ofMillis(50))
                .search("q", "doc", "alice", query, 3))
                .isInstanceOf(RetrievalException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void unreadableIndexSurfacesAsRetrievalException() {
        when(bm25Store.load("doc")).thenThrow(new IllegalStateException("corrupt"));

        assertThatThrownBy(() -> retriever(vectorStore, Duration.ofSeconds(5))
                .search("q", "doc", "alice", query, 3))
                .isInstanceOf(RetrievalException.class)
                .hasMessageContaining("doc");
    }

    @Test
    void nonPositiveKReturnsNothing() {
        assertThat(retriever(vectorStore, Duration.ofSeconds(5)).search("q", "doc", "alice", query, 0)).isEmpty();
    }

    @Test
    void bm25HitsOfAnotherUserAreNotReturned() {
        List<Chunk> chunks = List.of(new Chunk("doc", "alice secret salary figures", 0, owner("alice")));
        when(bm25Store.load("doc")).thenReturn(Optional.of(new Bm25IndexBuilder().build("doc", chunks)));

        List<RetrievalResult> results = retriever(vectorStore, Duration.ofSeconds(5))
                .search("salary", "doc", "bob", query, 3);

        assertThat(results).isEmpty();
    }

    @Test
    void bm25HitsAreFilteredPerChunkOwner() {
        List<Chunk> chunks = List.of(
                new Chunk("doc", "quarterly salary review", 0, owner("alice")),
                new Chunk("doc", "salary bands for engineering", 1, owner("bob")));
        when(bm25Store.load("doc")).thenReturn(Optional.of(new Bm25IndexBuilder().build("doc", chunks)));

        List<RetrievalResult> results = retriever(mock(VectorStore.class), Duration.ofSeconds(5))
                .search("salary", "doc", "bob", query, 3);

        assertThat(results).extracting(RetrievalResult::getChunkId).containsExactly("doc_chunk_1");
    }

    @Test
    void vectorAndBm25QueriesRunConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        VectorStore store = mock(VectorStore.class);
        when(store.query(any(), any(), any(), anyInt())).thenAnswer(invocation -> {
            bothStarted.countDown();
            assertThat(bothStarted.await(5, TimeUnit.SECONDS)).isTrue();
            return List.of();
        });
        when(bm25Store.load("doc")).thenAnswer(invocation -> {
            bothStarted.countDown();
            assertThat(bothStarted.await(5, TimeUnit.SECONDS)).isTrue();
            return Optional.empty();
        });

        List<RetrievalResult> results = retriever(store, Duration.ofSeconds(10))
                .search("q", "doc", "alice", query, 3);

        assertThat(results).isEmpty();
        assertThat(bothStarted.getCount()).isZero();
    }

    @Test
    void timeoutInterruptsTheRunningQuery() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        VectorStore slow = mock(VectorStore.class);
        when(slow.query(any(), any(), any(), anyInt())).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return List.of();
        });
        when(bm25Store.load("doc")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> retriever(slow, Duration.ofMillis(50))
                .search("q", "doc", "alice", query, 3))
                .isInstanceOf(RetrievalException.class);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }
}

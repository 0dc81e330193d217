package io.prism.rag.retrieval.rerank;

import io.prism.rag.model.RetrievedChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class JinaRerankerTest {

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.jina.test");
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Test
    void mapsRelevanceScoresOntoChunks() {
        server.expect(requestTo("https://api.jina.test/v1/rerank"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(jsonPath("$.model").value("jina-reranker-v2-base-multilingual"))
                .andExpect(jsonPath("$.top_n").value(2))
                .andExpect(jsonPath("$.return_documents").value(false))
                .andExpect(jsonPath("$.documents", hasSize(3)))
                .andRespond(withSuccess("""
                        {"results":[{"index":2,"relevance_score":0.91},{"index":0,"relevance_score":0.40}]}
                        """, MediaType.APPLICATION_JSON));

        JinaReranker reranker = new JinaReranker(restClient, "secret", "jina-reranker-v2-base-multilingual");
        List<RetrievedChunk> chunks = List.of(
                RetrievedChunk.builder().id("a").text("first").build(),
                RetrievedChunk.builder().id("b").text("second").build(),
                RetrievedChunk.builder().id("c").text("third").build());

        List<RetrievedChunk> ranked = reranker.rerankChunks("query", chunks, 2);

        assertThat(ranked).extracting(RetrievedChunk::getId).containsExactly("c", "a");
        assertThat(ranked.get(0).getRerankScore()).isEqualTo(0.91);
        server.verify();
    }

    @Test
    void serverErrorBecomesRerankException() {
        server.expect(requestTo("https://api.jina.test/v1/rerank")).andRespond(withServerError());

        JinaReranker reranker = new JinaReranker(restClient, "secret", "m");

        assertThatThrownBy(() -> reranker.rerank("q", List.of("a"), 1))
                .isInstanceOf(RerankException.class);
    }

    @Test
    void outOfRangeIndexIsRejected() {
        server.expect(requestTo("https://api.jina.test/v1/rerank"))
                .andRespond(withSuccess("{\"results\":[{\"index\":5,\"relevance_score\":0.9}]}",
                        MediaType.APPLICATION_JSON));

        JinaReranker reranker = new JinaReranker(restClient, "secret", "m");

        assertThatThrownBy(() -> reranker.rerank("q", List.of("a", "b"), 2))
                .isInstanceOf(RerankException.class)
                .hasMessageContaining("out-of-range");
    }

    @Test
    void missingApiKeyFailsWithoutCallingRemote() {
        JinaReranker reranker = new JinaReranker(restClient, "", "m");

        assertThatThrownBy(() -> reranker.rerank("q", List.of("a"), 1))
                .isInstanceOf(RerankException.class)
                .hasMessageContaining("API key");
        server.verify();
    }
}

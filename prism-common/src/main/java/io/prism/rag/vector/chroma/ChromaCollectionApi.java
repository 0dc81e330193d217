package io.prism.rag.vector.chroma;

import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.service.annotation.HttpExchange;
import org.springframework.web.service.annotation.PostExchange;

import java.util.List;
import java.util.Map;

/**
 * Spring HTTP Interface for the Chroma collections REST API (v1).
 */
@HttpExchange("/api/v1/collections")
public interface ChromaCollectionApi {

    @PostExchange
    ChromaModels.Collection getOrCreate(@RequestBody ChromaModels.CreateCollection request);

    @PostExchange("/{collectionId}/add")
    void add(@PathVariable String collectionId, @RequestBody ChromaModels.AddRequest request);

    @PostExchange("/{collectionId}/query")
    ChromaModels.QueryResult query(@PathVariable String collectionId, @RequestBody ChromaModels.QueryRequest request);

    @PostExchange("/{collectionId}/get")
    ChromaModels.GetResult get(@PathVariable String collectionId, @RequestBody ChromaModels.GetRequest request);

    @PostExchange("/{collectionId}/delete")
    List<String> delete(@PathVariable String collectionId, @RequestBody Map<String, Object> request);
}

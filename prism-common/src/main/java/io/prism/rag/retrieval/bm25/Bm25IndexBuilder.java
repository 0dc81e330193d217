package io.prism.rag.retrieval.bm25;

import io.prism.rag.model.Chunk;
import io.prism.rag.retrieval.Tokenizer;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds a {@link Bm25IndexData} from a document's chunks in a single pass over their tokens.
 */
public class Bm25IndexBuilder {

    private final Clock clock;

    public Bm25IndexBuilder() {
        this(Clock.systemUTC());
    }

    public Bm25IndexBuilder(Clock clock) {
        this.clock = clock;
    }

    public Bm25IndexData build(String documentId, List<Chunk> chunks) {
        List<Chunk> ordered = new ArrayList<>(chunks);
        ordered.sort(Comparator.comparingInt(Chunk::getIndex));

        List<Bm25IndexData.IndexedChunk> indexed = new ArrayList<>(ordered.size());
        SortedMap<String, Integer> documentFrequencies = new TreeMap<>();
        SortedMap<String, List<Integer>> postings = new TreeMap<>();
        long totalLength = 0;

        for (int ordinal = 0; ordinal < ordered.size(); ordinal++) {
            Chunk chunk = ordered.get(ordinal);
            List<String> terms = Tokenizer.tokenize(chunk.getText());

            SortedMap<String, Integer> frequencies = new TreeMap<>();
            for (String term : terms) {
                frequencies.merge(term, 1, Integer::sum);
            }
            for (String term : frequencies.keySet()) {
                documentFrequencies.merge(term, 1, Integer::sum);
                postings.computeIfAbsent(term, t -> new ArrayList<>()).add(ordinal);
            }
            totalLength += terms.size();

            indexed.add(Bm25IndexData.IndexedChunk.builder()
                    .chunkId(chunk.getId())
                    .chunkIndex(chunk.getIndex())
                    .text(chunk.getText())
                    .metadata(new LinkedHashMap<>(chunk.getMetadata()))
                    .length(terms.size())
                    .termFrequencies(frequencies)
                    .build());
        }

        return Bm25IndexData.builder()
                .documentId(documentId)
                .builtAt(clock.instant())
                .chunkCount(indexed.size())
                .averageChunkLength(indexed.isEmpty() ? 0d : (double) totalLength / indexed.size())
                .vocabulary(new ArrayList<>(documentFrequencies.keySet()))
                .documentFrequencies(documentFrequencies)
                .postings(postings)
                .chunks(indexed)
                .build();
    }
}

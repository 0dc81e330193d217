package io.prism.rag.retrieval.rerank;

import io.prism.rag.model.Chunk;
import io.prism.rag.model.RetrievedChunk;
import io.prism.rag.retrieval.Tokenizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Local reranker with no external dependency.
 *
 * <p>Plain documents are scored by the share of query terms they contain, plus a small bonus
 * for text mentioning a core section. Chunks with metadata go through a section-aware pass:
 * <ol>
 *   <li>group chunks by {@code section_path}</li>
 *   <li>score each group by the mean vector distance of its chunks (lower is better)</li>
 *   <li>multiply by {@value #CORE_SECTION_BOOST} when the section is a core section</li>
 *   <li>multiply by {@value #TABLE_BOOST} when the query asks for tabular data and the group
 *       holds a table chunk</li>
 *   <li>order groups by score ascending, chunks inside a group by chunk index</li>
 * </ol>
 */
public class RuleBasedReranker extends AbstractReranker {

    public static final List<String> CORE_SECTIONS =
            List.of("Abstract", "Introduction", "Conclusion", "摘要", "引言", "结论");

    static final double CORE_SECTION_BOOST = 0.7d;
    static final double TABLE_BOOST = 0.8d;
    static final double CORE_TEXT_BONUS = 0.1d;

    private static final List<String> TABLE_WORDS = List.of("table", "表格");

    @Override
    public String name() {
        return "rule";
    }

    @Override
    protected List<RerankResult> doRerank(String query, List<String> documents, int topN) {
        Set<String> queryTerms = new HashSet<>(Tokenizer.tokenize(query));

        List<RerankResult> scored = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            String text = documents.get(i) != null ? documents.get(i) : "";
            double score = 0d;
            if (!queryTerms.isEmpty()) {
                Set<String> docTerms = new HashSet<>(Tokenizer.tokenize(text));
                long overlap = queryTerms.stream().filter(docTerms::contains).count();
                score = (double) overlap / queryTerms.size();
            }
            if (mentionsCoreSection(text)) {
                score += CORE_TEXT_BONUS;
            }
            scored.add(new RerankResult(i, score));
        }

        scored.sort(Comparator.comparingDouble(RerankResult::relevanceScore).reversed()
                .thenComparingInt(RerankResult::index));
        return scored;
    }

    @Override
    public List<RetrievedChunk> rerankChunks(String query, List<RetrievedChunk> chunks, int topN) {
        if (chunks == null || chunks.isEmpty() || topN <= 0) {
            return List.of();
        }

        Map<String, List<RetrievedChunk>> sections = new LinkedHashMap<>();
        for (RetrievedChunk chunk : chunks) {
            sections.computeIfAbsent(sectionOf(chunk), s -> new ArrayList<>()).add(chunk);
        }

        boolean wantsTable = mentionsTable(query);
        List<SectionScore> ranked = new ArrayList<>(sections.size());
        for (Map.Entry<String, List<RetrievedChunk>> entry : sections.entrySet()) {
            List<RetrievedChunk> group = entry.getValue();
            double score = group.stream().mapToDouble(RetrievedChunk::distanceOrDefault).average().orElse(1.0d);
            if (isCoreSection(entry.getKey())) {
                score *= CORE_SECTION_BOOST;
            }
            if (wantsTable && group.stream().anyMatch(RuleBasedReranker::isTable)) {
                score *= TABLE_BOOST;
            }
            ranked.add(new SectionScore(group, score));
        }
        ranked.sort(Comparator.comparingDouble(SectionScore::score));

        List<RetrievedChunk> out = new ArrayList<>(Math.min(topN, chunks.size()));
        for (SectionScore section : ranked) {
            List<RetrievedChunk> group = new ArrayList<>(section.chunks());
            group.sort(Comparator.comparingInt(RetrievedChunk::chunkIndex));
            for (RetrievedChunk chunk : group) {
                if (out.size() == topN) {
                    return out;
                }
                out.add(chunk.toBuilder().rerankScore(1.0d - section.score()).build());
            }
        }
        return out;
    }

    private static String sectionOf(RetrievedChunk chunk) {
        Object section = chunk.getMetadata() != null ? chunk.getMetadata().get(Chunk.SECTION_PATH) : null;
        return section != null ? section.toString() : "unknown";
    }

    private static boolean isCoreSection(String section) {
        return CORE_SECTIONS.stream().anyMatch(section::contains);
    }

    private static boolean mentionsCoreSection(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return CORE_SECTIONS.stream().anyMatch(core -> lower.contains(core.toLowerCase(Locale.ROOT)));
    }

    private static boolean mentionsTable(String query) {
        String lower = query != null ? query.toLowerCase(Locale.ROOT) : "";
        return TABLE_WORDS.stream().anyMatch(lower::contains);
    }

    private static boolean isTable(RetrievedChunk chunk) {
        return chunk.getMetadata() != null && "table".equals(chunk.getMetadata().get(Chunk.ELEMENT_TYPE));
    }

    private record SectionScore(List<RetrievedChunk> chunks, double score) {
    }
}

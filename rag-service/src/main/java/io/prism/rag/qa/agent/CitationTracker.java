package io.prism.rag.qa.agent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numbers sources in the order tools first return them. A source seen again keeps its number.
 */
public class CitationTracker {

    private final Map<String, Source> byKey = new LinkedHashMap<>();

    /**
     * @param key identity of the source, such as a chunk id or a URL
     * @return the citation number, starting at 1
     */
    public synchronized int cite(String key, String documentId, String title, String snippet,
                                 String url, Source.SourceType type) {
        Source existing = byKey.get(key);
        if (existing != null) {
            return existing.citation();
        }
        int number = byKey.size() + 1;
        byKey.put(key, new Source(number, documentId, title, snippet, url, type));
        return number;
    }

    public synchronized List<Source> sources() {
        return new ArrayList<>(byKey.values());
    }

    public synchronized int size() {
        return byKey.size();
    }
}

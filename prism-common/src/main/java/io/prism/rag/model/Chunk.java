package io.prism.rag.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit of retrieval: a piece of document text plus its structural metadata.
 *
 * <p>The identifier is derived from {@code (documentId, index)} so the vector store and the
 * BM25 index can be joined without a separate mapping table.</p>
 */
@Data
@NoArgsConstructor
public class Chunk {

    public static final String DOCUMENT_ID = "document_id";
    public static final String USER_ID = "user_id";
    public static final String SECTION_PATH = "section_path";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String PAGE_NUMBER = "page_number";
    public static final String ELEMENT_TYPE = "element_type";
    public static final String CREATED_AT = "created_at";

    private String id;
    private String documentId;
    private String text;
    private int index;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public Chunk(String documentId, String text, int index, Map<String, Object> metadata) {
        this.id = idFor(documentId, index);
        this.documentId = documentId;
        this.text = text;
        this.index = index;
        this.metadata = new LinkedHashMap<>(metadata != null ? metadata : Collections.emptyMap());
        this.metadata.put(DOCUMENT_ID, documentId);
        this.metadata.put(CHUNK_INDEX, index);
    }

    public static String idFor(String documentId, int index) {
        return documentId + "_chunk_" + index;
    }

    @JsonIgnore
    public String getSectionPath() {
        Object section = metadata.get(SECTION_PATH);
        return section != null ? section.toString() : "unknown";
    }

    /**
     * Reads {@code chunk_index} from a metadata map, tolerating the numeric and string forms
     * vector stores hand back.
     */
    public static int chunkIndexOf(Map<String, Object> metadata) {
        if (metadata == null) {
            return 0;
        }
        Object value = metadata.get(CHUNK_INDEX);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}

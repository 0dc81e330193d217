package io.prism.rag.qa.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * A citable source. {@code citation} is the number used in {@code [[citation:N]]} markers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Source(int citation,
                     String documentId,
                     String title,
                     String textSnippet,
                     String url,
                     SourceType sourceType) {

    public enum SourceType {
        WEB, PDF;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}

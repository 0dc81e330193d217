package io.prism.rag.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RetrievalMode {

    VECTOR,
    HYBRID;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RetrievalMode fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        return RetrievalMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

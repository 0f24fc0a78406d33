package com.naagi.kb.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Source metadata carried by every chunk so a passage can be traced back to its origin.
 */
public record Traceability(
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("source_system") String sourceSystem,
        @JsonProperty("space_key") String spaceKey
) {

    public static Traceability of(Document doc) {
        return new Traceability(doc.title(), doc.url(), doc.sourceSystem(), doc.spaceKey());
    }

    /**
     * A chunk is traceable when it names its source system and at least one of title or url.
     */
    @JsonIgnore
    public boolean isComplete() {
        return notBlank(sourceSystem) && (notBlank(title) || notBlank(url));
    }

    @JsonIgnore
    public boolean hasTitleAndUrl() {
        return notBlank(title) && notBlank(url);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}

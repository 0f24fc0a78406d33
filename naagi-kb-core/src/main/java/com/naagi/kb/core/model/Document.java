package com.naagi.kb.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One normalized source unit as produced by enrichment. Immutable for a given run.
 */
public record Document(
        @JsonProperty("doc_id") @JsonAlias("id") String docId,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("source_system") String sourceSystem,
        @JsonProperty("body_text") @JsonAlias({"text_md", "text"}) String bodyText,
        @JsonProperty("section_map") List<Section> sectionMap,
        @JsonProperty("space_key") String spaceKey,
        @JsonProperty("doctype") String doctype,
        @JsonProperty("quality_score") Double qualityScore
) {
    private static final double DEFAULT_QUALITY = 1.0;

    @JsonCreator
    public Document {
        sectionMap = sectionMap == null ? List.of() : List.copyOf(sectionMap);
    }

    public Document(String docId, String title, String url, String sourceSystem, String bodyText) {
        this(docId, title, url, sourceSystem, bodyText, List.of(), null, null, null);
    }

    public double getQualityScoreOrDefault() {
        return qualityScore != null ? qualityScore : DEFAULT_QUALITY;
    }
}

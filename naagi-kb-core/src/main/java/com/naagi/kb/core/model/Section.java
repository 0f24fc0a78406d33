package com.naagi.kb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Heading entry of a document's section map, with character offsets into the body text.
 */
public record Section(
        @JsonProperty("heading") String heading,
        @JsonProperty("startChar") int startChar,
        @JsonProperty("endChar") Integer endChar
) {}

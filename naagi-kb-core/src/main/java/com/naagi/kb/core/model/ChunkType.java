package com.naagi.kb.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChunkType {
    HEADING("heading"),
    PARAGRAPH("paragraph"),
    SENTENCE("sentence"),
    CODE("code"),
    TABLE("table"),
    TOKEN_WINDOW("token-window");

    private final String label;

    ChunkType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ChunkType fromLabel(String label) {
        for (ChunkType type : values()) {
            if (type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown chunk type: " + label);
    }
}

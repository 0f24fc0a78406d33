package com.naagi.kb.core.io;

public class ArtifactFormatException extends RuntimeException {

    public ArtifactFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

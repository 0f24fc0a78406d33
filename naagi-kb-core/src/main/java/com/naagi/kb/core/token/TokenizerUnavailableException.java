package com.naagi.kb.core.token;

public class TokenizerUnavailableException extends RuntimeException {

    public TokenizerUnavailableException(String message) {
        super(message);
    }

    public TokenizerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

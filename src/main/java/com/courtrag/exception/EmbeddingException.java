package com.courtrag.exception;

public class EmbeddingException extends CourtRagException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}

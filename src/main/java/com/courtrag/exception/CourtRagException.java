package com.courtrag.exception;

public class CourtRagException extends RuntimeException {

    public CourtRagException(String message) {
        super(message);
    }

    public CourtRagException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.courtrag.exception;

public class InvalidConfigurationException extends CourtRagException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}

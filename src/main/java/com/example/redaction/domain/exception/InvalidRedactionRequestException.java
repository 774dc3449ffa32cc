package com.example.redaction.domain.exception;

/**
 * Raised when a redaction request or contextual proposal violates its field constraints.
 */
public class InvalidRedactionRequestException extends DomainException {

    public InvalidRedactionRequestException(String message) {
        super(message);
    }
}

package com.example.redaction.domain.exception;

/**
 * Input rejected before any processing starts: missing, oversized or of an unsupported type.
 */
public abstract class DocumentInputException extends DomainException {

    protected DocumentInputException(String message) {
        super(message);
    }

    protected DocumentInputException(String message, Throwable cause) {
        super(message, cause);
    }
}

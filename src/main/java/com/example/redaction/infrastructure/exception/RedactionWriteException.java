package com.example.redaction.infrastructure.exception;

/**
 * Raised when a format-specific writer fails while producing the redacted copy.
 * The partially written output is always discarded.
 */
public class RedactionWriteException extends InfrastructureException {

    public RedactionWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

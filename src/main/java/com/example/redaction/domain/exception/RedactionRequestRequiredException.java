package com.example.redaction.domain.exception;

/**
 * Raised when a redaction run is started without any accepted redaction.
 */
public class RedactionRequestRequiredException extends DomainException {

    public RedactionRequestRequiredException() {
        super("Please add at least one redaction before processing.");
    }
}

package com.example.redaction.infrastructure.exception;

/**
 * Raised when temp files cannot be created, written, published or securely deleted.
 */
public class FileStoreException extends InfrastructureException {

    public FileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

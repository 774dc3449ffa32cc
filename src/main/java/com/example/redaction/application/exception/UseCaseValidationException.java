package com.example.redaction.application.exception;

/**
 * Signals validation issues detected while running an application layer use case.
 * Controllers translate this exception into HTTP 400 responses.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * Builds an exception containing a validation message that can be propagated to the caller.
	 *
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}

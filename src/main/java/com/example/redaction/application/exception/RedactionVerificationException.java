package com.example.redaction.application.exception;

import java.util.List;

/**
 * Raised when an applied redaction could not be verified: some accepted literals are still recoverable
 * from the output. The unverified artifact has already been discarded when this is thrown.
 */
public class RedactionVerificationException extends ApplicationException {

    private final List<String> survivingTexts;

	/**
	 * @param fileName       document that failed verification
	 * @param survivingTexts literals still present in the re-extracted text
	 */
    public RedactionVerificationException(String fileName, List<String> survivingTexts) {
        super(String.format("Redaction of %s could not be verified: %d redacted text(s) remain recoverable.",
                fileName, survivingTexts.size()));
        this.survivingTexts = List.copyOf(survivingTexts);
    }

    /**
     * @return the literals an operator has to address before retrying
     */
    public List<String> getSurvivingTexts() {
        return survivingTexts;
    }
}

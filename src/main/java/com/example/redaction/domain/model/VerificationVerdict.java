package com.example.redaction.domain.model;

import java.util.List;

/**
 * Outcome of re-extracting a redacted artifact: either verified, or failed with the literals that survived.
 */
public record VerificationVerdict(VerificationStatus status, List<String> survivingTexts) {

    public VerificationVerdict {
        survivingTexts = survivingTexts == null ? List.of() : List.copyOf(survivingTexts);
    }

    public static VerificationVerdict verified() {
        return new VerificationVerdict(VerificationStatus.VERIFIED, List.of());
    }

    public static VerificationVerdict failed(List<String> survivingTexts) {
        return new VerificationVerdict(VerificationStatus.FAILED, survivingTexts);
    }

    public boolean isVerified() {
        return status == VerificationStatus.VERIFIED;
    }
}

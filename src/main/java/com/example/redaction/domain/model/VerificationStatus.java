package com.example.redaction.domain.model;

public enum VerificationStatus {
    VERIFIED,
    FAILED
}

package com.example.redaction.domain.model;

/**
 * Predominant horizontal reading direction of a page.
 */
public enum TextDirection {
    LTR,
    RTL,
    MIXED
}

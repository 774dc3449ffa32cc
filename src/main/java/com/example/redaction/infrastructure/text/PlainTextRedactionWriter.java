package com.example.redaction.infrastructure.text;

import com.example.redaction.domain.model.Occurrence;
import com.example.redaction.domain.service.OccurrenceFinder;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;

/**
 * Replaces every accepted span of a plain text with a fixed marker.
 */
@Component
public class PlainTextRedactionWriter {

    public static final String MARKER = "[REDACTED]";

    /**
     * @param text     decoded document text
     * @param literals accepted literals
     * @return UTF-8 bytes of the redacted text
     */
    public byte[] redact(String text, Collection<String> literals) {
        List<Occurrence> spans = OccurrenceFinder.findAll(text, literals);
        StringBuilder redacted = new StringBuilder(text);
        for (int i = spans.size() - 1; i >= 0; i--) {
            Occurrence span = spans.get(i);
            redacted.replace(span.start(), span.end(), MARKER);
        }
        return redacted.toString().getBytes(StandardCharsets.UTF_8);
    }
}

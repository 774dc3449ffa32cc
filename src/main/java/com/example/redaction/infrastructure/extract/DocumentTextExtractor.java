package com.example.redaction.infrastructure.extract;

import com.example.redaction.domain.model.Document;
import com.example.redaction.domain.model.FormatKind;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes text extraction to the adapter registered for the document's format.
 * Used for the operator preview and, on the output bytes, for post-redaction verification.
 */
@Component
public class DocumentTextExtractor {

    private final Map<FormatKind, FormatTextExtractor> extractors = new EnumMap<>(FormatKind.class);

    public DocumentTextExtractor(List<FormatTextExtractor> extractors) {
        for (FormatTextExtractor extractor : extractors) {
            this.extractors.put(extractor.format(), extractor);
        }
        for (FormatKind format : FormatKind.values()) {
            if (!this.extractors.containsKey(format)) {
                throw new IllegalStateException("No text extractor registered for " + format);
            }
        }
    }

    public String extract(Document document) {
        return extract(document.content(), document.format(), document.fileName());
    }

    /**
     * @param content  raw bytes, e.g. of a redacted artifact
     * @param format   format of the bytes
     * @param fileName name used in error messages
     * @return flat text
     */
    public String extract(byte[] content, FormatKind format, String fileName) {
        return extractors.get(format).extract(content, fileName);
    }

    /**
     * @param content  raw bytes of a redacted artifact
     * @param format   format of the bytes
     * @param fileName name used in error messages
     * @return all text recoverable from the bytes, including parts outside the reading order
     */
    public String recoverableText(byte[] content, FormatKind format, String fileName) {
        return extractors.get(format).recoverableText(content, fileName);
    }
}

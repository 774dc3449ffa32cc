package com.example.redaction.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable handle over the bytes of a loaded document and its resolved format.
 * Every redaction works on a copy obtained through {@link #content()}, so the loaded bytes never change.
 */
public final class Document {

    private final String fileName;
    private final byte[] content;
    private final FormatKind format;

    /**
     * @param fileName logical name used in logs and reports
     * @param content  raw document bytes; copied on the way in
     * @param format   resolved document format
     */
    public Document(String fileName, byte[] content, FormatKind format) {
        this.fileName = fileName == null || fileName.isBlank() ? "document" + format.defaultExtension() : fileName;
        this.content = Arrays.copyOf(Objects.requireNonNull(content, "content"), content.length);
        this.format = Objects.requireNonNull(format, "format");
    }

    public String fileName() {
        return fileName;
    }

    /**
     * @return a fresh working copy of the document bytes
     */
    public byte[] content() {
        return Arrays.copyOf(content, content.length);
    }

    public int size() {
        return content.length;
    }

    public FormatKind format() {
        return format;
    }

    @Override
    public String toString() {
        return "Document[" + fileName + ", " + format + ", " + content.length + " bytes]";
    }
}

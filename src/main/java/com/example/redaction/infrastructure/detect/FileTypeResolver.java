package com.example.redaction.infrastructure.detect;

import com.example.redaction.domain.exception.DocumentNotFoundException;
import com.example.redaction.domain.exception.DocumentPathRequiredException;
import com.example.redaction.domain.exception.DocumentTooLargeException;
import com.example.redaction.domain.exception.UnsupportedDocumentTypeException;
import com.example.redaction.domain.model.Document;
import com.example.redaction.domain.model.FormatKind;
import com.example.redaction.infrastructure.config.RedactionProperties;
import com.example.redaction.infrastructure.exception.DocumentExtractionException;

import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Classifies input files into one of the supported {@link FormatKind}s.
 * The media type sniffed from the content by Apache Tika wins; the file extension is only consulted when
 * Tika cannot tell more than "some binary" or "some archive", and for an archive only an extension naming that
 * kind of archive is accepted. Anything unrecognized is rejected.
 */
@Component
public class FileTypeResolver {

    private static final Logger log = LoggerFactory.getLogger(FileTypeResolver.class);

    private static final Map<String, FormatKind> MEDIA_TYPES = Map.of(
            "application/pdf", FormatKind.PDF,
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document", FormatKind.DOCX,
            "application/msword", FormatKind.DOCX,
            "text/plain", FormatKind.TEXT,
            "application/rtf", FormatKind.TEXT,
            "text/rtf", FormatKind.TEXT
    );
    private static final Map<String, FormatKind> EXTENSIONS = Map.of(
            ".pdf", FormatKind.PDF,
            ".docx", FormatKind.DOCX,
            ".doc", FormatKind.DOCX,
            ".txt", FormatKind.TEXT,
            ".text", FormatKind.TEXT,
            ".rtf", FormatKind.TEXT
    );
    private static final String OCTET_STREAM = "application/octet-stream";
    // containers whose content type alone is inconclusive, with the extensions that may name them
    private static final Map<String, Set<String>> CONTAINER_EXTENSIONS = Map.of(
            "application/zip", Set.of(".docx"),
            "application/x-tika-ooxml", Set.of(".docx"),
            "application/x-tika-msoffice", Set.of(".doc")
    );

    private final Tika tika;
    private final long maxFileSizeBytes;

    public FileTypeResolver(RedactionProperties properties) {
        this.tika = new Tika();
        this.maxFileSizeBytes = properties.maxFileSize().toBytes();
    }

    /**
     * Validates the path and determines the document format.
     *
     * @param path file to classify
     * @return resolved format
     * @throws DocumentPathRequiredException     when {@code path} is null
     * @throws DocumentNotFoundException         when the path is missing or not a regular file
     * @throws DocumentTooLargeException         when the file exceeds the configured ceiling
     * @throws UnsupportedDocumentTypeException  when neither content nor extension identify a supported format
     */
    public FormatKind resolve(Path path) {
        if (path == null) {
            throw new DocumentPathRequiredException();
        }
        if (!Files.isRegularFile(path)) {
            throw new DocumentNotFoundException(path.toAbsolutePath().toString());
        }
        String fileName = fileNameOf(path);
        long size = sizeOf(path);
        if (size > maxFileSizeBytes) {
            throw new DocumentTooLargeException(fileName, size, maxFileSizeBytes);
        }

        String mediaType = detectMediaType(path);
        FormatKind byContent = MEDIA_TYPES.get(mediaType);
        if (byContent != null) {
            log.debug("Resolved {} as {} from content type {}", fileName, byContent, mediaType);
            return byContent;
        }
        String extension = extensionOf(fileName);
        if (extensionFallbackAllowed(mediaType, extension)) {
            FormatKind byExtension = EXTENSIONS.get(extension);
            if (byExtension != null) {
                log.info("Content type of {} is inconclusive ({}); falling back to extension: {}", fileName, mediaType, byExtension);
                return byExtension;
            }
        }
        throw new UnsupportedDocumentTypeException(fileName, mediaType);
    }

    /**
     * Resolves the format and reads the file into an immutable {@link Document}.
     *
     * @param path file to load
     * @return loaded document
     * @throws DocumentExtractionException when the bytes cannot be read
     */
    public Document load(Path path) {
        FormatKind format = resolve(path);
        try {
            return new Document(fileNameOf(path), Files.readAllBytes(path), format);
        } catch (IOException e) {
            throw new DocumentExtractionException("Unable to read the document at " + path, e);
        }
    }

    private static boolean extensionFallbackAllowed(String mediaType, String extension) {
        if (mediaType == null || OCTET_STREAM.equals(mediaType)) {
            return true;
        }
        Set<String> allowed = CONTAINER_EXTENSIONS.get(mediaType);
        return allowed != null && allowed.contains(extension);
    }

    private String detectMediaType(Path path) {
        try {
            String detected = tika.detect(path);
            if (detected == null) {
                return null;
            }
            int parameters = detected.indexOf(';');
            String bare = parameters >= 0 ? detected.substring(0, parameters) : detected;
            return bare.trim().toLowerCase(Locale.ROOT);
        } catch (IOException e) {
            log.warn("Content type detection failed for {}", path, e);
            return null;
        }
    }

    private long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new DocumentExtractionException("Unable to read the size of " + path, e);
        }
    }

    private static String fileNameOf(Path path) {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}

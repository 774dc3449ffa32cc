package com.example.redaction.infrastructure.text;

import com.example.redaction.domain.model.FormatKind;
import com.example.redaction.infrastructure.exception.DocumentExtractionException;
import com.example.redaction.infrastructure.extract.FormatTextExtractor;

import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes plain text (and RTF, whose markup is not interpreted) as strict UTF-8.
 */
@Component
public class PlainTextExtractor implements FormatTextExtractor {

    @Override
    public FormatKind format() {
        return FormatKind.TEXT;
    }

    /**
     * @throws DocumentExtractionException when the bytes are not valid UTF-8
     */
    @Override
    public String extract(byte[] content, String fileName) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DocumentExtractionException("Text file extraction failed for " + fileName + ": not valid UTF-8", e);
        }
    }
}

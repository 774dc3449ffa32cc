package com.example.redaction.application.service;

import com.example.redaction.domain.model.AcceptedRedactionSet;
import com.example.redaction.domain.model.FormatKind;
import com.example.redaction.domain.model.VerificationVerdict;
import com.example.redaction.infrastructure.extract.DocumentTextExtractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-extracts a redacted artifact and checks that none of the accepted literals can still be found in it.
 * The check reads everything recoverable from the bytes, not only what the writer rewrote.
 */
@Service
public class RedactionVerifier {

    private static final Logger log = LoggerFactory.getLogger(RedactionVerifier.class);

    private final DocumentTextExtractor textExtractor;

    public RedactionVerifier(DocumentTextExtractor textExtractor) {
        this.textExtractor = textExtractor;
    }

    /**
     * @param content    redacted bytes
     * @param format     format of the bytes
     * @param redactions accepted redactions
     * @param fileName   name used in logs
     * @return VERIFIED, or FAILED with every literal that is still present
     */
    public VerificationVerdict verify(byte[] content, FormatKind format, AcceptedRedactionSet redactions, String fileName) {
        String text = textExtractor.recoverableText(content, format, fileName);
        List<String> surviving = new ArrayList<>();
        for (String literal : redactions.texts()) {
            if (text.contains(literal)) {
                surviving.add(literal);
            }
        }
        if (surviving.isEmpty()) {
            log.info("Verified redaction of {}: {} literal(s) no longer recoverable", fileName, redactions.texts().size());
            return VerificationVerdict.verified();
        }
        log.warn("Verification of {} failed: {} literal(s) still recoverable", fileName, surviving.size());
        return VerificationVerdict.failed(surviving);
    }
}

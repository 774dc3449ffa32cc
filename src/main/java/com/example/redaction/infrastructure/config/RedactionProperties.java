package com.example.redaction.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables of the redaction engine, bound from the {@code redaction.*} namespace.
 *
 * @param maxFileSize   hard ceiling for input documents
 * @param workDirectory root for temp files; the system temp directory when unset
 * @param layout        PDF layout analysis settings
 * @param pdf           PDF output settings
 */
@ConfigurationProperties(prefix = "redaction")
public record RedactionProperties(
        @DefaultValue("100MB") DataSize maxFileSize,
        Path workDirectory,
        @DefaultValue Layout layout,
        @DefaultValue Pdf pdf
) {

    public RedactionProperties {
        maxFileSize = maxFileSize == null ? DataSize.ofMegabytes(100) : maxFileSize;
        layout = layout == null ? Layout.defaults() : layout;
        pdf = pdf == null ? Pdf.defaults() : pdf;
    }

    /**
     * Settings used outside a Spring context, e.g. in unit tests.
     */
    public static RedactionProperties defaults() {
        return new RedactionProperties(DataSize.ofMegabytes(100), null, Layout.defaults(), Pdf.defaults());
    }

    /**
     * @param workerThreads       size of the per-page analysis pool; {@code 0} picks the processor count capped at 4
     * @param analysisTimeout     upper bound for analyzing all pages of one document
     * @param minColumnSeparation silhouette score a multi-column split must reach to be accepted
     */
    public record Layout(
            @DefaultValue("0") int workerThreads,
            @DefaultValue("30s") Duration analysisTimeout,
            @DefaultValue("0.6") double minColumnSeparation
    ) {
        public Layout {
            analysisTimeout = analysisTimeout == null ? Duration.ofSeconds(30) : analysisTimeout;
        }

        public static Layout defaults() {
            return new Layout(0, Duration.ofSeconds(30), 0.6d);
        }

        public int effectiveWorkerThreads() {
            if (workerThreads > 0) {
                return workerThreads;
            }
            return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 4));
        }
    }

    /**
     * @param boxPadding    distance the blackout box extends beyond the matched glyphs
     * @param ownerPassword owner password for the encrypted output; a random one per document when blank
     */
    public record Pdf(
            @DefaultValue("2.0") float boxPadding,
            String ownerPassword
    ) {
        public static Pdf defaults() {
            return new Pdf(2.0f, null);
        }
    }
}

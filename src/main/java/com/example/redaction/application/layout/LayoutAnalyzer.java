package com.example.redaction.application.layout;

import com.example.redaction.application.exception.UseCaseValidationException;
import com.example.redaction.domain.model.Document;
import com.example.redaction.domain.model.DocumentLayout;
import com.example.redaction.domain.model.FontStatistics;
import com.example.redaction.domain.model.FormatKind;
import com.example.redaction.domain.model.PageLayout;
import com.example.redaction.domain.model.PositionedWord;
import com.example.redaction.infrastructure.config.RedactionProperties;
import com.example.redaction.infrastructure.exception.LayoutAnalysisException;
import com.example.redaction.infrastructure.pdf.PdfWordExtractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Application-layer service that analyzes the geometry of a PDF.
 * Words are read sequentially (a PDFBox document must not be shared between threads); the per-page
 * clustering then runs on the bounded layout pool. Pages that fail or run past the analysis timeout
 * degrade to an empty layout instead of failing the document.
 */
@Service
public class LayoutAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LayoutAnalyzer.class);

    private final PdfWordExtractor wordExtractor;
    private final ExecutorService executor;
    private final PageLayoutAnalyzer pageAnalyzer;
    private final Duration timeout;

    public LayoutAnalyzer(PdfWordExtractor wordExtractor,
                          @Qualifier("layoutExecutor") ExecutorService executor,
                          RedactionProperties properties) {
        this.wordExtractor = wordExtractor;
        this.executor = executor;
        this.pageAnalyzer = new PageLayoutAnalyzer(new ColumnDetector(properties.layout().minColumnSeparation()));
        this.timeout = properties.layout().analysisTimeout();
    }

    /**
     * @param document PDF document
     * @return layout of every page, in page order
     * @throws UseCaseValidationException when the document is not a PDF
     * @throws com.example.redaction.infrastructure.exception.DocumentExtractionException when the PDF cannot be parsed
     */
    public DocumentLayout analyze(Document document) {
        if (document.format() != FormatKind.PDF) {
            throw new UseCaseValidationException("Layout analysis is only available for PDF documents, not " + document.format() + ".");
        }
        List<List<PositionedWord>> pages = wordExtractor.extractWords(document.content(), document.fileName());
        DocumentLayout layout = analyzeWords(pages);
        log.info("Analyzed layout of {}: {} page(s), complexity {}", document.fileName(), layout.pageCount(),
                String.format("%.2f", layout.layoutComplexity()));
        return layout;
    }

    /**
     * Analyzes words that were already extracted, one list per page.
     */
    public DocumentLayout analyzeWords(List<List<PositionedWord>> pages) {
        List<Future<PageLayout>> futures = new ArrayList<>(pages.size());
        for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
            int index = pageIndex;
            List<PositionedWord> words = pages.get(pageIndex);
            futures.add(executor.submit(() -> analyzePage(index, words)));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<PageLayout> layouts = new ArrayList<>(pages.size());
        List<PositionedWord> allWords = new ArrayList<>();
        for (int pageIndex = 0; pageIndex < futures.size(); pageIndex++) {
            layouts.add(await(pageIndex, futures.get(pageIndex), deadline));
            allWords.addAll(pages.get(pageIndex));
        }
        return new DocumentLayout(layouts, FontStatistics.of(allWords));
    }

    private PageLayout analyzePage(int pageIndex, List<PositionedWord> words) {
        try {
            PageLayout layout = pageAnalyzer.analyze(pageIndex, words);
            log.debug("Page {}: {} words, {} column(s), {} block(s)", pageIndex + 1, layout.wordCount(),
                    layout.columns().size(), layout.textBlocks().size());
            return layout;
        } catch (RuntimeException e) {
            throw new LayoutAnalysisException(pageIndex, "Layout analysis failed on page " + (pageIndex + 1), e);
        }
    }

    private PageLayout await(int pageIndex, Future<PageLayout> future, long deadline) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Layout analysis of page {} timed out; treating it as empty", pageIndex + 1);
        } catch (ExecutionException e) {
            log.warn("Layout analysis of page {} failed; treating it as empty", pageIndex + 1, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for the layout of page {}; treating it as empty", pageIndex + 1);
        }
        return PageLayout.empty(pageIndex);
    }
}

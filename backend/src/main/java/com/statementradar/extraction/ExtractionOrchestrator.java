package com.statementradar.extraction;

import com.statementradar.common.RetryPolicy;
import com.statementradar.common.Sleeper;
import com.statementradar.config.AsyncConfig;
import com.statementradar.domain.ExtractedStatement;
import com.statementradar.domain.ExtractionErrorCode;
import com.statementradar.domain.ExtractionResult;
import com.statementradar.domain.RankedPage;
import com.statementradar.extraction.config.ExtractionClientConfig;
import com.statementradar.extraction.config.ExtractionProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Extracts the top-ranked classified pages through the vision service with bounded concurrency.
 * Rate-limited calls are retried with exponential backoff; every other failure is recorded for its
 * page and never aborts the rest of the batch. Results are returned sorted by page number.
 */
@Service
@Slf4j
public class ExtractionOrchestrator {

    private final VisionExtractionClient client;
    private final ExtractionProperties properties;
    private final Executor extractionExecutor;
    private final RateLimiter extractionRateLimiter;
    private final ExtractionErrorClassifier errorClassifier;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    @Autowired
    public ExtractionOrchestrator(VisionExtractionClient client,
                                  ExtractionProperties properties,
                                  @Qualifier(AsyncConfig.EXTRACTION_EXECUTOR) Executor extractionExecutor,
                                  @Qualifier(ExtractionClientConfig.EXTRACTION_RATE_LIMITER) RateLimiter extractionRateLimiter,
                                  ExtractionErrorClassifier errorClassifier) {
        this(client, properties, extractionExecutor, extractionRateLimiter, errorClassifier, Sleeper.THREAD);
    }

    ExtractionOrchestrator(VisionExtractionClient client,
                           ExtractionProperties properties,
                           Executor extractionExecutor,
                           RateLimiter extractionRateLimiter,
                           ExtractionErrorClassifier errorClassifier,
                           Sleeper sleeper) {
        this.client = client;
        this.properties = properties;
        this.extractionExecutor = extractionExecutor;
        this.extractionRateLimiter = extractionRateLimiter;
        this.errorClassifier = errorClassifier;
        this.sleeper = sleeper;
        this.retryPolicy = new RetryPolicy(
                properties.getBaseDelayMs(),
                properties.getJitterMs(),
                properties.getMaxDelayMs(),
                Math.max(1, properties.getMaxRetries()));
    }

    /** First top-K classified pages of an already ranked list. */
    public List<RankedPage> selectPages(List<RankedPage> ranked) {
        return ranked.stream()
                .filter(RankedPage::classified)
                .limit(Math.max(0, properties.getTopK()))
                .toList();
    }

    public ExtractionBatch extract(List<RankedPage> ranked) {
        List<RankedPage> selected = selectPages(ranked);
        if (selected.isEmpty()) {
            log.warn("No classified pages to extract");
            return new ExtractionBatch(selected, List.of());
        }
        log.info("Extracting {} pages with concurrency {}", selected.size(), properties.getConcurrency());

        Semaphore semaphore = new Semaphore(Math.max(1, properties.getConcurrency()));
        Queue<ExtractionResult> completed = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>(selected.size());
        for (RankedPage page : selected) {
            futures.add(CompletableFuture.runAsync(
                    () -> completed.add(extractWithPermit(page, semaphore)),
                    extractionExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ExtractionResult> results = new ArrayList<>(completed);
        results.sort(Comparator.comparingInt(ExtractionResult::getPageNum));
        ExtractionBatch batch = new ExtractionBatch(selected, results);
        log.info("Extraction finished: {} succeeded, {} failed", batch.successes().size(), batch.failures().size());
        return batch;
    }

    private ExtractionResult extractWithPermit(RankedPage page, Semaphore semaphore) {
        boolean acquired = false;
        try {
            semaphore.acquire();
            acquired = true;
            return extractPage(page);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExtractionResult.failure(page, ExtractionErrorCode.INTERRUPTED, "Interrupted waiting for a worker", 0);
        } catch (RuntimeException e) {
            log.warn("Extraction of page {} failed unexpectedly: {}", page.pageNum(), e.getMessage(), e);
            return ExtractionResult.failure(page, ExtractionErrorCode.SERVICE_ERROR, e.getMessage(), 0);
        } finally {
            if (acquired) {
                semaphore.release();
            }
        }
    }

    /**
     * Extracts one page: validates inputs, then calls the service, retrying rate-limited failures
     * until the attempt budget is spent.
     */
    ExtractionResult extractPage(RankedPage page) {
        if (!page.page().hasImage()) {
            return ExtractionResult.failure(page, ExtractionErrorCode.MISSING_IMAGE, "Page has no image", 0);
        }
        if (page.page().trimmedTextLength() < properties.getMinTextLength()) {
            return ExtractionResult.failure(page, ExtractionErrorCode.TEXT_TOO_SHORT,
                    "Page text shorter than " + properties.getMinTextLength() + " characters", 0);
        }
        String hint = page.statementType().hint();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                if (!extractionRateLimiter.acquirePermission()) {
                    throw new ExtractionTransientException("Local extraction rate limit reached");
                }
                ExtractedStatement data = client.extract(page.page().image(), hint, page.page().text());
                if (data == null) {
                    throw new ExtractionFatalException(ExtractionErrorCode.EMPTY_RESPONSE, "Vision service returned no data");
                }
                log.debug("Page {} extracted on attempt {}: {} line items", page.pageNum(), attempts, data.lineItemCount());
                return ExtractionResult.success(page, data, attempts);
            } catch (RuntimeException e) {
                ExtractionException error = errorClassifier.classify(e);
                if (!error.isRetryable()) {
                    log.warn("Page {} failed with {}: {}", page.pageNum(), error.getErrorCode(), error.getMessage());
                    return ExtractionResult.failure(page, error.getErrorCode(), error.getMessage(), attempts);
                }
                if (!retryPolicy.hasAttemptsLeft(attempts)) {
                    log.warn("Page {} still rate limited after {} attempts", page.pageNum(), attempts);
                    return ExtractionResult.failure(page, ExtractionErrorCode.RETRIES_EXHAUSTED,
                            "Rate limited after " + attempts + " attempts: " + error.getMessage(), attempts);
                }
                long delay = retryPolicy.delayMs(attempts - 1);
                log.warn("Page {} rate limited (attempt {}/{}), retrying in {} ms",
                        page.pageNum(), attempts, retryPolicy.getMaxAttempts(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return ExtractionResult.failure(page, ExtractionErrorCode.INTERRUPTED,
                            "Interrupted during backoff", attempts);
                }
            }
        }
    }
}

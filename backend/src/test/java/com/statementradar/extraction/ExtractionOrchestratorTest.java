package com.statementradar.extraction;

import com.statementradar.domain.ClassificationScore;
import com.statementradar.domain.ExtractedStatement;
import com.statementradar.domain.ExtractionErrorCode;
import com.statementradar.domain.ExtractionResult;
import com.statementradar.domain.Page;
import com.statementradar.domain.PageImage;
import com.statementradar.domain.RankedPage;
import com.statementradar.domain.StatementType;
import com.statementradar.extraction.config.ExtractionProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionOrchestratorTest {

    private static final String TEXT = "Statement of financial position as of December 31, 2024";
    private static final ExtractedStatement DATA = new ExtractedStatement(
            "ABC", null, "PHP", List.of("2024"), "2024", Map.of(), Map.of(), null);

    private ExtractionProperties properties;
    private List<Long> sleeps;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        properties = new ExtractionProperties();
        sleeps = Collections.synchronizedList(new ArrayList<>());
        pool = Executors.newFixedThreadPool(5);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("rate limited twice then success: 2 retries, result successful")
    void extractPage_retriesRateLimitThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        VisionExtractionClient client = (image, hint, text) -> {
            if (calls.incrementAndGet() <= 2) {
                throw new ExtractionTransientException("429 Too Many Requests");
            }
            return DATA;
        };

        ExtractionResult result = orchestrator(client).extractPage(page(1, StatementType.BALANCE_SHEET, 10.0));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(result.retries()).isEqualTo(2);
        assertThat(sleeps).hasSize(2);
        assertThat(sleeps.get(1)).isGreaterThanOrEqualTo(sleeps.get(0));
        assertThat(sleeps).allSatisfy(d -> assertThat(d).isLessThanOrEqualTo(properties.getMaxDelayMs()));
    }

    @Test
    @DisplayName("a transient error is retried max-retries - 1 times, then escalated")
    void extractPage_rateLimitedForever_escalatesToFatal() {
        AtomicInteger calls = new AtomicInteger();
        VisionExtractionClient client = (image, hint, text) -> {
            calls.incrementAndGet();
            throw new RuntimeException("rate limit exceeded");
        };

        ExtractionResult result = orchestrator(client).extractPage(page(1, StatementType.BALANCE_SHEET, 10.0));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ExtractionErrorCode.RETRIES_EXHAUSTED);
        assertThat(calls.get()).isEqualTo(properties.getMaxRetries());
        assertThat(sleeps).hasSize(properties.getMaxRetries() - 1);
    }

    @Test
    void extractPage_fatalError_notRetried() {
        AtomicInteger calls = new AtomicInteger();
        VisionExtractionClient client = (image, hint, text) -> {
            calls.incrementAndGet();
            throw new ExtractionFatalException(ExtractionErrorCode.MALFORMED_RESPONSE, "not json");
        };

        ExtractionResult result = orchestrator(client).extractPage(page(1, StatementType.BALANCE_SHEET, 10.0));

        assertThat(result.getErrorCode()).isEqualTo(ExtractionErrorCode.MALFORMED_RESPONSE);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void extractPage_missingImage_failsFastWithoutCall() {
        AtomicInteger calls = new AtomicInteger();
        VisionExtractionClient client = (image, hint, text) -> {
            calls.incrementAndGet();
            return DATA;
        };
        RankedPage noImage = new RankedPage(Page.textOnly(2, TEXT), score(2, StatementType.BALANCE_SHEET, 10.0));

        ExtractionResult result = orchestrator(client).extractPage(noImage);

        assertThat(result.getErrorCode()).isEqualTo(ExtractionErrorCode.MISSING_IMAGE);
        assertThat(result.getAttempts()).isZero();
        assertThat(calls.get()).isZero();
    }

    @Test
    void extractPage_passesStatementHintAndText() {
        List<String> hints = new ArrayList<>();
        VisionExtractionClient client = (image, hint, text) -> {
            hints.add(hint + "|" + text);
            return DATA;
        };

        orchestrator(client).extractPage(page(1, StatementType.CASH_FLOW, 10.0));

        assertThat(hints).containsExactly("cash_flow|" + TEXT + " #1");
    }

    @Test
    void selectPages_takesTopKClassifiedOnly() {
        properties.setTopK(2);
        List<RankedPage> ranked = List.of(
                page(4, StatementType.BALANCE_SHEET, 20.0),
                page(2, StatementType.INCOME_STATEMENT, 15.0),
                page(7, StatementType.CASH_FLOW, 9.0),
                unclassified(1));

        assertThat(orchestrator((i, h, t) -> DATA).selectPages(ranked))
                .extracting(RankedPage::pageNum).containsExactly(4, 2);
    }

    @Test
    @DisplayName("results come back sorted by page number whatever the completion order")
    void extract_resultsSortedByPageNum() {
        VisionExtractionClient client = (image, hint, text) -> {
            // the first-ranked page finishes last
            if (text.endsWith("#9")) {
                sleepQuietly(100);
            }
            return DATA;
        };
        List<RankedPage> ranked = List.of(
                page(9, StatementType.BALANCE_SHEET, 30.0),
                page(3, StatementType.INCOME_STATEMENT, 20.0),
                page(5, StatementType.CASH_FLOW, 10.0));

        ExtractionBatch batch = orchestrator(client).extract(ranked);

        assertThat(batch.results()).extracting(ExtractionResult::getPageNum).containsExactly(3, 5, 9);
        assertThat(batch.isExhausted()).isFalse();
        assertThat(batch.failures()).isEmpty();
    }

    @Test
    @DisplayName("one failing page does not abort the others")
    void extract_partialFailure_keepsOtherPages() {
        VisionExtractionClient client = (image, hint, text) -> {
            if (text.endsWith("#2")) {
                throw new ExtractionFatalException(ExtractionErrorCode.EMPTY_RESPONSE, "empty");
            }
            return DATA;
        };

        ExtractionBatch batch = orchestrator(client).extract(List.of(
                page(1, StatementType.BALANCE_SHEET, 20.0),
                page(2, StatementType.INCOME_STATEMENT, 10.0)));

        assertThat(batch.successes()).extracting(ExtractionResult::getPageNum).containsExactly(1);
        assertThat(batch.failures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.pageNum()).isEqualTo(2);
                    assertThat(f.errorCode()).isEqualTo(ExtractionErrorCode.EMPTY_RESPONSE);
                });
        assertThat(batch.isExhausted()).isFalse();
    }

    @Test
    void extract_allFatal_exhausted() {
        VisionExtractionClient client = (image, hint, text) -> {
            throw new ExtractionFatalException(ExtractionErrorCode.MALFORMED_RESPONSE, "bad");
        };

        ExtractionBatch batch = orchestrator(client).extract(List.of(
                page(1, StatementType.BALANCE_SHEET, 20.0),
                page(2, StatementType.INCOME_STATEMENT, 10.0)));

        assertThat(batch.isExhausted()).isTrue();
        assertThat(batch.failures()).hasSize(2);
    }

    @Test
    void extract_noClassifiedPages_emptyAndExhausted() {
        ExtractionBatch batch = orchestrator((i, h, t) -> DATA).extract(List.of(unclassified(1)));

        assertThat(batch.selectedPages()).isEmpty();
        assertThat(batch.isExhausted()).isTrue();
    }

    @Test
    @DisplayName("no more than the configured number of extractions run at once")
    void extract_respectsConcurrencyLimit() {
        properties.setConcurrency(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        VisionExtractionClient client = (image, hint, text) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            sleepQuietly(30);
            inFlight.decrementAndGet();
            return DATA;
        };
        List<RankedPage> ranked = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            ranked.add(page(i, StatementType.BALANCE_SHEET, 10.0));
        }

        ExtractionBatch batch = orchestrator(client).extract(ranked);

        assertThat(batch.successes()).hasSize(6);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
    }

    private ExtractionOrchestrator orchestrator(VisionExtractionClient client) {
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000)
                .timeoutDuration(Duration.ZERO)
                .build());
        return new ExtractionOrchestrator(client, properties, pool, limiter,
                new ExtractionErrorClassifier(), sleeps::add);
    }

    private static RankedPage page(int pageNum, StatementType type, double score) {
        Page page = new Page(pageNum, TEXT + " #" + pageNum, new PageImage("image/png", new byte[]{1, 2, 3}));
        return new RankedPage(page, score(pageNum, type, score));
    }

    private static RankedPage unclassified(int pageNum) {
        return new RankedPage(Page.textOnly(pageNum, "narrative"), ClassificationScore.skipped(pageNum, "text too short"));
    }

    private static ClassificationScore score(int pageNum, StatementType type, double score) {
        return new ClassificationScore(pageNum, type, score, 10.0, 5, score >= 3.0, Map.of(), List.of(), null);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

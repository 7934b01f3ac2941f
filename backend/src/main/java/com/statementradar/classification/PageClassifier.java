package com.statementradar.classification;

import com.statementradar.classification.config.ClassificationProperties;
import com.statementradar.config.AsyncConfig;
import com.statementradar.domain.ClassificationScore;
import com.statementradar.domain.Page;
import com.statementradar.domain.RankedPage;
import com.statementradar.domain.StatementType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Classifies every page of a document and ranks them by score, highest first.
 * Equal scores keep the original page order. Never throws for a single bad page:
 * a page that cannot be scored is reported as unclassified.
 */
@Service
@Slf4j
public class PageClassifier {

    static final String SKIP_TEXT_TOO_SHORT = "text too short";
    static final String SKIP_SCORING_FAILED = "scoring failed";

    private final PageScorer pageScorer;
    private final ClassificationProperties properties;
    private final Executor classificationExecutor;

    public PageClassifier(PageScorer pageScorer,
                          ClassificationProperties properties,
                          @Qualifier(AsyncConfig.CLASSIFICATION_EXECUTOR) Executor classificationExecutor) {
        this.pageScorer = pageScorer;
        this.properties = properties;
        this.classificationExecutor = classificationExecutor;
    }

    public List<RankedPage> classify(List<Page> pages) {
        if (pages == null || pages.isEmpty()) {
            return List.of();
        }
        List<RankedPage> scored = pages.size() > properties.getParallelPageThreshold()
                ? scoreInParallel(pages)
                : scoreSequentially(pages);
        List<RankedPage> ranked = rank(scored);
        long classified = ranked.stream().filter(RankedPage::classified).count();
        log.info("Classified {} of {} pages as financial statements", classified, pages.size());
        return ranked;
    }

    /**
     * Scores one page. Text shorter than the configured minimum is skipped without scoring.
     */
    public ClassificationScore classifyPage(Page page) {
        if (page.trimmedTextLength() < properties.getMinTextLength()) {
            return ClassificationScore.skipped(page.pageNum(), SKIP_TEXT_TOO_SHORT);
        }
        TextScore textScore = pageScorer.score(page.text());
        StatementType winner = textScore.winningType();
        double score = textScore.maxScore();
        boolean classified = score >= properties.getFinancialThreshold();
        log.debug("Page {} scored {} as {} (density {}%, classified={})",
                page.pageNum(), score, winner, String.format("%.1f", textScore.numberDensityPct()), classified);
        return new ClassificationScore(
                page.pageNum(),
                winner,
                score,
                textScore.numberDensityPct(),
                textScore.financialNumberCount(),
                classified,
                textScore.typeScores(),
                textScore.matchedPhrases().getOrDefault(winner, List.of()),
                null);
    }

    /** Stable sort by score descending. */
    public static List<RankedPage> rank(List<RankedPage> pages) {
        List<RankedPage> ranked = new ArrayList<>(pages);
        ranked.sort(Comparator.comparingDouble(RankedPage::score).reversed());
        return List.copyOf(ranked);
    }

    private List<RankedPage> scoreSequentially(List<Page> pages) {
        List<RankedPage> scored = new ArrayList<>(pages.size());
        for (Page page : pages) {
            scored.add(new RankedPage(page, safeClassify(page)));
        }
        return scored;
    }

    private List<RankedPage> scoreInParallel(List<Page> pages) {
        List<CompletableFuture<RankedPage>> futures = new ArrayList<>(pages.size());
        for (Page page : pages) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> new RankedPage(page, safeClassify(page)), classificationExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        // futures are in page order, so joining them keeps the original order for the stable sort
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private ClassificationScore safeClassify(Page page) {
        try {
            return classifyPage(page);
        } catch (RuntimeException e) {
            log.warn("Page {} could not be scored: {}", page.pageNum(), e.getMessage(), e);
            return ClassificationScore.skipped(page.pageNum(), SKIP_SCORING_FAILED);
        }
    }
}

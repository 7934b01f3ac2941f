package com.statementradar.pipeline;

import com.statementradar.classification.PageClassifier;
import com.statementradar.consolidation.Consolidator;
import com.statementradar.domain.ConsolidatedStatement;
import com.statementradar.domain.Page;
import com.statementradar.domain.RankedPage;
import com.statementradar.extraction.ExtractionBatch;
import com.statementradar.extraction.ExtractionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs classification, extraction and consolidation for one document.
 * Per-page failures end up in the report; only a run with no successful page throws.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StatementPipeline {

    private final PageClassifier pageClassifier;
    private final ExtractionOrchestrator extractionOrchestrator;
    private final Consolidator consolidator;

    public <S> PipelineReport run(S source, DocumentRenderer<S> renderer) {
        List<Page> pages = renderer.render(source);
        log.info("Rendered {} pages", pages.size());
        return run(pages);
    }

    /**
     * @throws PipelineExhaustedException when no selected page was extracted successfully
     */
    public PipelineReport run(List<Page> pages) {
        Instant started = Instant.now();
        List<RankedPage> ranked = pageClassifier.classify(pages);
        ExtractionBatch batch = extractionOrchestrator.extract(ranked);
        if (batch.isExhausted()) {
            log.warn("Run exhausted: {} pages selected, none extracted", batch.selectedPages().size());
            throw new PipelineExhaustedException(batch.selectedPages().size(), batch.failures());
        }
        ConsolidatedStatement statement = consolidator.consolidate(batch.successes());
        Duration elapsed = Duration.between(started, Instant.now());
        log.info("Run finished in {} ms: {} pages consolidated, {} failed",
                elapsed.toMillis(), statement.consolidationInfo().sourcePages().size(), batch.failures().size());
        return new PipelineReport(
                ranked,
                batch.selectedPages(),
                batch.results(),
                batch.failures(),
                statement.consolidationInfo().failedChecks(),
                statement,
                elapsed);
    }
}

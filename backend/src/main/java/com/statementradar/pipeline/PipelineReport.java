package com.statementradar.pipeline;

import com.statementradar.domain.ConsolidatedStatement;
import com.statementradar.domain.ExtractionResult;
import com.statementradar.domain.RankedPage;
import com.statementradar.domain.ValidationCheck;
import com.statementradar.extraction.ExtractionFailure;

import java.time.Duration;
import java.util.List;

/**
 * Everything a caller needs after a run: the consolidated statement plus the failure and warning manifests.
 */
public record PipelineReport(
        List<RankedPage> rankedPages,
        List<RankedPage> selectedPages,
        List<ExtractionResult> extractionResults,
        List<ExtractionFailure> failures,
        List<ValidationCheck> validationWarnings,
        ConsolidatedStatement statement,
        Duration elapsed
) {

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}

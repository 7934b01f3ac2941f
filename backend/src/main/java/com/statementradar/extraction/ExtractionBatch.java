package com.statementradar.extraction;

import com.statementradar.domain.ExtractionResult;
import com.statementradar.domain.RankedPage;

import java.util.List;

/**
 * Results of one extraction run, sorted by page number, plus the pages that were selected.
 */
public record ExtractionBatch(List<RankedPage> selectedPages, List<ExtractionResult> results) {

    public ExtractionBatch {
        selectedPages = List.copyOf(selectedPages);
        results = List.copyOf(results);
    }

    public List<ExtractionResult> successes() {
        return results.stream().filter(ExtractionResult::isSuccess).toList();
    }

    public List<ExtractionFailure> failures() {
        return results.stream().filter(r -> !r.isSuccess()).map(ExtractionFailure::from).toList();
    }

    /** True when no page was extracted successfully; the run cannot be consolidated. */
    public boolean isExhausted() {
        return results.stream().noneMatch(ExtractionResult::isSuccess);
    }
}

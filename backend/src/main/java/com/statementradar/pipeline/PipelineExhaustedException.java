package com.statementradar.pipeline;

import com.statementradar.extraction.ExtractionFailure;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when no selected page could be extracted, so there is nothing to consolidate.
 * Carries the per-page failure manifest.
 */
@Getter
public class PipelineExhaustedException extends RuntimeException {

    private final int pagesSelected;
    private final List<ExtractionFailure> failures;

    public PipelineExhaustedException(int pagesSelected, List<ExtractionFailure> failures) {
        super(pagesSelected == 0
                ? "No page was classified as a financial statement"
                : "All " + pagesSelected + " selected pages failed extraction");
        this.pagesSelected = pagesSelected;
        this.failures = List.copyOf(failures);
    }
}

package com.statementradar.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of extracting one selected page. Failures carry an error code and message instead of data.
 */
@Getter
@RequiredArgsConstructor
public class ExtractionResult {

    private final int pageNum;
    private final StatementType statementType;
    private final double confidence;
    private final boolean success;
    private final ExtractedStatement data;
    private final ExtractionErrorCode errorCode;
    private final String errorMessage;
    /** Calls made to the extraction service, including the successful one. */
    private final int attempts;

    public static ExtractionResult success(RankedPage page, ExtractedStatement data, int attempts) {
        return new ExtractionResult(page.pageNum(), page.statementType(), page.confidence(),
                true, data, null, null, attempts);
    }

    public static ExtractionResult failure(RankedPage page, ExtractionErrorCode errorCode, String message, int attempts) {
        return new ExtractionResult(page.pageNum(), page.statementType(), page.confidence(),
                false, null, errorCode, message, attempts);
    }

    /** Retries performed before the final outcome. */
    public int retries() {
        return Math.max(0, attempts - 1);
    }
}

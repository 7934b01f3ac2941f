package com.statementradar.extraction;

import com.statementradar.domain.ExtractionErrorCode;
import com.statementradar.domain.ExtractionResult;
import com.statementradar.domain.StatementType;

/**
 * One entry of the failure manifest reported alongside a run.
 */
public record ExtractionFailure(
        int pageNum,
        StatementType statementType,
        ExtractionErrorCode errorCode,
        String message,
        int attempts
) {

    public static ExtractionFailure from(ExtractionResult result) {
        return new ExtractionFailure(result.getPageNum(), result.getStatementType(),
                result.getErrorCode(), result.getErrorMessage(), result.getAttempts());
    }
}

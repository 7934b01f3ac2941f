package com.statementradar.extraction;

import com.statementradar.domain.ExtractionErrorCode;
import lombok.Getter;

/**
 * Thrown when a page extraction fails. The error code decides whether the call is retried.
 */
@Getter
public class ExtractionException extends RuntimeException {

    private final ExtractionErrorCode errorCode;

    public ExtractionException(ExtractionErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ExtractionException(ExtractionErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}

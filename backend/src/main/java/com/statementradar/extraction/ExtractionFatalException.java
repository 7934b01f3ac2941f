package com.statementradar.extraction;

import com.statementradar.domain.ExtractionErrorCode;

/**
 * Non-retryable extraction failure: missing input, empty or malformed response, service error.
 */
public class ExtractionFatalException extends ExtractionException {

    public ExtractionFatalException(ExtractionErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ExtractionFatalException(ExtractionErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}

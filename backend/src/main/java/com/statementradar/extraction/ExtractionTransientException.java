package com.statementradar.extraction;

import com.statementradar.domain.ExtractionErrorCode;

/**
 * Rate-limit class failure from the vision service or the local limiter; retried with backoff.
 */
public class ExtractionTransientException extends ExtractionException {

    public ExtractionTransientException(String message) {
        super(ExtractionErrorCode.RATE_LIMITED, message);
    }

    public ExtractionTransientException(String message, Throwable cause) {
        super(ExtractionErrorCode.RATE_LIMITED, message, cause);
    }
}

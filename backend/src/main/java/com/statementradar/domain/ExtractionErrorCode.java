package com.statementradar.domain;

/**
 * Why a page extraction failed. Only {@link #RATE_LIMITED} is retried.
 */
public enum ExtractionErrorCode {
    RATE_LIMITED,
    RETRIES_EXHAUSTED,
    MISSING_IMAGE,
    TEXT_TOO_SHORT,
    EMPTY_RESPONSE,
    MALFORMED_RESPONSE,
    SERVICE_ERROR,
    INTERRUPTED;

    public boolean isRetryable() {
        return this == RATE_LIMITED;
    }
}

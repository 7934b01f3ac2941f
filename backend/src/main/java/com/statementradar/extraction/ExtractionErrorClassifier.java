package com.statementradar.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.statementradar.domain.ExtractionErrorCode;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Locale;

/**
 * Decides whether a failure from the extraction path is retryable (rate-limit class) or fatal.
 */
@Component
public class ExtractionErrorClassifier {

    /** Anthropic "overloaded" status; treated like 429. */
    static final int HTTP_OVERLOADED = 529;

    private static final int MAX_CAUSE_DEPTH = 8;

    public ExtractionException classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ExtractionException e) {
                return e;
            }
            if (current instanceof RequestNotPermitted) {
                return new ExtractionTransientException("Local extraction rate limit reached", current);
            }
            if (current instanceof WebClientResponseException w) {
                int status = w.getStatusCode().value();
                if (status == 429 || status == HTTP_OVERLOADED || isRateLimited(w.getResponseBodyAsString())) {
                    return new ExtractionTransientException("Vision service rate limited (HTTP " + status + ")", w);
                }
                return new ExtractionFatalException(ExtractionErrorCode.SERVICE_ERROR,
                        "Vision service returned HTTP " + status, w);
            }
            if (current instanceof JsonProcessingException) {
                return new ExtractionFatalException(ExtractionErrorCode.MALFORMED_RESPONSE,
                        "Vision service response is not valid JSON: " + current.getMessage(), current);
            }
            if (isRateLimited(current.getMessage())) {
                return new ExtractionTransientException(current.getMessage(), current);
            }
            current = current.getCause();
        }
        String message = error == null ? "unknown error" : error.getMessage();
        return new ExtractionFatalException(ExtractionErrorCode.SERVICE_ERROR,
                message != null ? message : error.getClass().getSimpleName(), error);
    }

    static boolean isRateLimited(String message) {
        if (message == null) {
            return false;
        }
        String m = message.toLowerCase(Locale.ROOT);
        return m.contains("429")
                || m.contains("too many requests")
                || m.contains("rate limit")
                || m.contains("rate_limit")
                || m.contains("overloaded");
    }
}

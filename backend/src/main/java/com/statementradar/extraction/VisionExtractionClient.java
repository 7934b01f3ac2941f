package com.statementradar.extraction;

import com.statementradar.domain.ExtractedStatement;
import com.statementradar.domain.PageImage;

/**
 * Remote vision-capable extraction service. Implementations throw {@link ExtractionTransientException}
 * for rate limiting and {@link ExtractionFatalException} for anything that must not be retried;
 * other runtime exceptions are classified by {@link ExtractionErrorClassifier}.
 */
public interface VisionExtractionClient {

    ExtractedStatement extract(PageImage image, String statementTypeHint, String rawText);
}

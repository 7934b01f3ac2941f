package com.statementradar.domain;

import java.util.List;
import java.util.Map;

/**
 * Classification outcome for one page. {@code statementType} is null when the page was skipped
 * (text too short to score); {@code skipReason} is null otherwise.
 */
public record ClassificationScore(
        int pageNum,
        StatementType statementType,
        double score,
        double numberDensityPct,
        int financialNumberCount,
        boolean classified,
        Map<StatementType, Double> typeScores,
        List<String> matchedPhrases,
        String skipReason
) {

    /** Score at which confidence saturates to 1.0. */
    public static final double FULL_CONFIDENCE_SCORE = 20.0;

    public static ClassificationScore skipped(int pageNum, String reason) {
        return new ClassificationScore(pageNum, null, 0.0, 0.0, 0, false, Map.of(), List.of(), reason);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    /** min(score / 20, 1), never negative. */
    public double confidence() {
        if (score <= 0) {
            return 0.0;
        }
        return Math.min(score / FULL_CONFIDENCE_SCORE, 1.0);
    }
}

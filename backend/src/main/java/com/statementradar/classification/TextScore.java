package com.statementradar.classification;

import com.statementradar.domain.StatementType;

import java.util.List;
import java.util.Map;

/**
 * Scores of one page text against every statement type. Pure function of the text, so it is cacheable.
 */
public record TextScore(
        Map<StatementType, Double> typeScores,
        double numberDensityPct,
        int financialNumberCount,
        Map<StatementType, List<String>> matchedPhrases
) {

    /** Highest scoring type; the first in declaration order wins a tie. */
    public StatementType winningType() {
        StatementType best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (StatementType type : StatementType.values()) {
            double s = typeScores.getOrDefault(type, Double.NEGATIVE_INFINITY);
            if (s > bestScore) {
                best = type;
                bestScore = s;
            }
        }
        return best;
    }

    public double maxScore() {
        StatementType winner = winningType();
        return winner == null ? 0.0 : typeScores.get(winner);
    }
}

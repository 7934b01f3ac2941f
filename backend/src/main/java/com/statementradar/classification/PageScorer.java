package com.statementradar.classification;

import com.statementradar.config.CaffeineConfig;
import com.statementradar.domain.StatementType;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores page text against the statement pattern catalog plus the number-density heuristic.
 */
@Component
public class PageScorer {

    /**
     * score[T] = 5 * title matches + 2 * line-item matches + 1 * supporting matches + density score.
     */
    @Cacheable(cacheNames = CaffeineConfig.PAGE_SCORE_CACHE, key = "#text")
    public TextScore score(String text) {
        String safe = text == null ? "" : text;
        int numberCount = NumberDensityCalculator.financialNumbers(safe).size();
        double density = NumberDensityCalculator.densityPct(numberCount, NumberDensityCalculator.wordCount(safe));
        double densityScore = NumberDensityCalculator.densityScore(density);

        List<String> supportingPhrases = new ArrayList<>();
        int supportingMatches = countMatches(StatementPatternCatalog.supporting(), safe, supportingPhrases);
        double supportingScore = supportingMatches * StatementPatternCatalog.SUPPORTING_WEIGHT;

        Map<StatementType, Double> scores = new EnumMap<>(StatementType.class);
        Map<StatementType, List<String>> phrases = new EnumMap<>(StatementType.class);
        for (StatementType type : StatementType.values()) {
            List<String> matched = new ArrayList<>();
            int titles = countMatches(StatementPatternCatalog.titles(type), safe, matched);
            int lines = countMatches(StatementPatternCatalog.lineItems(type), safe, matched);
            double total = titles * StatementPatternCatalog.TITLE_WEIGHT
                    + lines * StatementPatternCatalog.LINE_ITEM_WEIGHT
                    + supportingScore
                    + densityScore;
            scores.put(type, total);
            matched.addAll(supportingPhrases);
            phrases.put(type, distinct(matched));
        }
        return new TextScore(Collections.unmodifiableMap(scores), density, numberCount,
                Collections.unmodifiableMap(phrases));
    }

    private static int countMatches(List<Pattern> patterns, String text, List<String> matched) {
        int count = 0;
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                count++;
                matched.add(m.group().toLowerCase());
            }
        }
        return count;
    }

    private static List<String> distinct(List<String> phrases) {
        Set<String> unique = new LinkedHashSet<>(phrases);
        return List.copyOf(unique);
    }
}

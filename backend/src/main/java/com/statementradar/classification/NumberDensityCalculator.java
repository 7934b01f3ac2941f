package com.statementradar.classification;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Measures how many financial-looking numbers a page holds relative to its word count,
 * and maps that density onto a score contribution.
 */
public final class NumberDensityCalculator {

    private static final List<Pattern> FINANCIAL_NUMBERS = List.of(
            // currency-prefixed amounts: $1,234 ₱500 €12.50
            Pattern.compile("[$₱€£¥¢][\\d,]+\\.?\\d*"),
            Pattern.compile("\\b\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?\\b"),
            Pattern.compile("\\b\\d{4,}(?:\\.\\d+)?\\b"),
            // parenthesized negatives
            Pattern.compile("\\(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?\\)"),
            Pattern.compile("\\(\\d{4,}(?:\\.\\d+)?\\)"),
            Pattern.compile("\\b\\d+\\.?\\d*%"));

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NumberDensityCalculator() {
    }

    /** Distinct financial-looking number tokens, in order of first appearance per pattern. */
    public static Set<String> financialNumbers(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        for (Pattern p : FINANCIAL_NUMBERS) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                found.add(m.group());
            }
        }
        return found;
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.trim()).length;
    }

    /** Financial numbers per 100 words. */
    public static double densityPct(int numberCount, int wordCount) {
        return (double) numberCount / Math.max(wordCount, 1) * 100.0;
    }

    public static double densityScore(double densityPct) {
        if (densityPct >= 30) {
            return 6.0;
        }
        if (densityPct >= 20) {
            return 4.0;
        }
        if (densityPct >= 15) {
            return 2.5;
        }
        if (densityPct >= 10) {
            return 1.5;
        }
        if (densityPct >= 7) {
            return 0.5;
        }
        if (densityPct >= 5) {
            return 0.0;
        }
        if (densityPct >= 3) {
            return -1.0;
        }
        return -3.0;
    }
}

package com.statementradar.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One extracted field value. {@code yearValues} is keyed by relative year
 * ({@code base_year}, {@code year_1}, ...); {@code source} and {@code sourcePage} record provenance.
 */
public record LineItem(
        BigDecimal value,
        double confidence,
        Map<String, BigDecimal> yearValues,
        String source,
        Integer sourcePage
) {

    public static final String BASE_YEAR = "base_year";

    public LineItem {
        yearValues = yearValues == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(yearValues));
    }

    public static LineItem of(BigDecimal value, double confidence) {
        return new LineItem(value, confidence, Map.of(), null, null);
    }

    /** Number of relative-year columns holding a non-null value. */
    public int populatedYearCount() {
        int count = 0;
        for (BigDecimal v : yearValues.values()) {
            if (v != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Primary value: {@code value} if present, otherwise the base-year value.
     */
    public BigDecimal effectiveValue() {
        return value != null ? value : yearValues.get(BASE_YEAR);
    }

    /** True when both items carry the same numbers, compared numerically (1.0 equals 1.00). */
    public boolean sameValueAs(LineItem other) {
        if (!numericallyEqual(effectiveValue(), other.effectiveValue())) {
            return false;
        }
        for (Map.Entry<String, BigDecimal> e : yearValues.entrySet()) {
            BigDecimal theirs = other.yearValues.get(e.getKey());
            if (theirs != null && !numericallyEqual(e.getValue(), theirs)) {
                return false;
            }
        }
        return true;
    }

    public LineItem withSource(String newSource) {
        return new LineItem(value, confidence, yearValues, newSource, sourcePage);
    }

    public LineItem withSourcePage(Integer page) {
        return new LineItem(value, confidence, yearValues, source, page);
    }

    private static boolean numericallyEqual(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return Objects.equals(a, b);
        }
        return a.compareTo(b) == 0;
    }
}

package com.statementradar.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal output of a run: the merged line-item tree plus metadata and consolidation bookkeeping.
 * {@code yearsDetected} is most-recent-first and {@code baseYear} is never null (empty when unknown).
 */
public record ConsolidatedStatement(
        String companyName,
        String period,
        String currency,
        List<String> yearsDetected,
        String baseYear,
        Map<String, Map<String, LineItem>> lineItems,
        Map<String, LineItem> summaryMetrics,
        ConsolidationInfo consolidationInfo
) {

    public ConsolidatedStatement {
        yearsDetected = yearsDetected == null ? List.of() : List.copyOf(yearsDetected);
        baseYear = baseYear == null ? "" : baseYear;
        lineItems = deepCopy(lineItems);
        summaryMetrics = summaryMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(summaryMetrics));
    }

    public LineItem find(String category, String field) {
        Map<String, LineItem> fields = lineItems.get(category);
        return fields == null ? null : fields.get(field);
    }

    private static Map<String, Map<String, LineItem>> deepCopy(Map<String, Map<String, LineItem>> tree) {
        if (tree == null) {
            return Map.of();
        }
        Map<String, Map<String, LineItem>> copy = new LinkedHashMap<>();
        tree.forEach((category, fields) ->
                copy.put(category, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        return Collections.unmodifiableMap(copy);
    }
}

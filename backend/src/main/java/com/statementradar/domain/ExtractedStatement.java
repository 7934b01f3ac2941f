package com.statementradar.domain;

import java.util.List;
import java.util.Map;

/**
 * Structured data the vision service returned for one page.
 * {@code lineItems} is category -> field -> item.
 */
public record ExtractedStatement(
        String companyName,
        String period,
        String currency,
        List<String> yearsDetected,
        String baseYear,
        Map<String, Map<String, LineItem>> lineItems,
        Map<String, LineItem> summaryMetrics,
        String notes
) {

    public ExtractedStatement {
        yearsDetected = yearsDetected == null ? List.of() : List.copyOf(yearsDetected);
        lineItems = lineItems == null ? Map.of() : lineItems;
        summaryMetrics = summaryMetrics == null ? Map.of() : summaryMetrics;
    }

    public int lineItemCount() {
        return lineItems.values().stream().mapToInt(Map::size).sum();
    }
}

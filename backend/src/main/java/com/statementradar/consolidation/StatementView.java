package com.statementradar.consolidation;

import com.statementradar.domain.LineItem;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged line items and summary metrics of a single statement type, used to check arithmetic identities.
 */
public class StatementView {

    private final Map<String, Map<String, LineItem>> lineItems = new LinkedHashMap<>();
    private final Map<String, LineItem> summaryMetrics = new LinkedHashMap<>();

    public Map<String, Map<String, LineItem>> lineItems() {
        return lineItems;
    }

    public Map<String, LineItem> summaryMetrics() {
        return summaryMetrics;
    }

    /**
     * Value of the first candidate field found in any category, falling back to summary metrics.
     * Candidates are tried in order.
     */
    public BigDecimal find(List<String> candidates) {
        for (String field : candidates) {
            for (Map<String, LineItem> fields : lineItems.values()) {
                BigDecimal v = valueOf(fields.get(field));
                if (v != null) {
                    return v;
                }
            }
        }
        for (String field : candidates) {
            BigDecimal v = valueOf(summaryMetrics.get(field));
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    private static BigDecimal valueOf(LineItem item) {
        return item == null ? null : item.effectiveValue();
    }
}

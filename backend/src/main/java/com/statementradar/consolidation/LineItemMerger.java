package com.statementradar.consolidation;

import com.statementradar.domain.LineItem;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges line items from several pages into one tree, counting duplicates and conflicts.
 * For a field seen more than once the kept item always has the highest confidence seen;
 * equal confidence keeps the item with more populated year columns, then the earlier page.
 * Not thread-safe; one instance per consolidation.
 */
@Getter
public class LineItemMerger {

    private int duplicatesRemoved;
    private int conflictsResolved;

    public void mergeTree(Map<String, Map<String, LineItem>> target,
                          Map<String, Map<String, LineItem>> source,
                          int sourcePage) {
        source.forEach((category, fields) ->
                mergeFields(target.computeIfAbsent(category, k -> new LinkedHashMap<>()), fields, sourcePage));
    }

    public void mergeFields(Map<String, LineItem> target, Map<String, LineItem> source, int sourcePage) {
        source.forEach((field, item) -> merge(target, field, stamp(item, sourcePage)));
    }

    /**
     * Merges one item into {@code target}. Returns true when the candidate was kept.
     */
    boolean merge(Map<String, LineItem> target, String field, LineItem candidate) {
        LineItem existing = target.get(field);
        if (existing == null) {
            target.put(field, candidate);
            return true;
        }
        if (existing.sameValueAs(candidate)) {
            duplicatesRemoved++;
        } else {
            conflictsResolved++;
        }
        if (prefers(candidate, existing)) {
            target.put(field, candidate);
            return true;
        }
        return false;
    }

    static boolean prefers(LineItem candidate, LineItem existing) {
        int byConfidence = Double.compare(candidate.confidence(), existing.confidence());
        if (byConfidence != 0) {
            return byConfidence > 0;
        }
        return candidate.populatedYearCount() > existing.populatedYearCount();
    }

    private static LineItem stamp(LineItem item, int sourcePage) {
        return item.sourcePage() == null ? item.withSourcePage(sourcePage) : item;
    }

    static boolean hasValue(LineItem item) {
        if (item == null) {
            return false;
        }
        BigDecimal v = item.effectiveValue();
        return v != null;
    }
}

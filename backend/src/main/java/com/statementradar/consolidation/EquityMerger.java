package com.statementradar.consolidation;

import com.statementradar.domain.LineItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds the ending balances of a statement of changes in equity into the balance sheet's equity section.
 * Movement items (dividends, issuances, opening balances, period changes) are never copied.
 */
@Component
public class EquityMerger {

    public static final String EQUITY_CATEGORY = "equity";
    public static final String SOURCE_TAG = "Statement of Equity";

    private static final Map<String, String> FIELD_MAPPING = Map.ofEntries(
            Map.entry("share_capital", "share_capital"),
            Map.entry("capital_stock", "share_capital"),
            Map.entry("common_stock", "share_capital"),
            Map.entry("preferred_stock", "preferred_stock"),
            Map.entry("retained_earnings", "retained_earnings"),
            Map.entry("accumulated_other_comprehensive_income", "accumulated_other_comprehensive_income"),
            Map.entry("additional_paid_in_capital", "additional_paid_in_capital"),
            Map.entry("treasury_stock", "treasury_stock"),
            Map.entry("total_equity", "total_equity"),
            Map.entry("total_shareholders_equity", "total_equity"),
            Map.entry("total_stockholders_equity", "total_equity"));

    private static final Set<String> EXCLUDED_FIELDS = Set.of(
            "dividends_paid",
            "dividend_payments",
            "cash_dividends",
            "stock_issuance",
            "share_issuance",
            "stock_repurchase",
            "beginning_balance",
            "ending_balance",
            "net_income_for_period",
            "comprehensive_income",
            "foreign_currency_translation");

    private static final List<String> EXCLUDED_PREFIXES = List.of("beginning_", "change_", "movement_");
    private static final String EXCLUDED_INFIX = "_during_";

    /**
     * Returns a new equity map; neither argument is modified. Balance sheet entries are kept as they are.
     * An equity-statement entry overwrites one only when it is absent or valueless, or has strictly lower
     * confidence. Movement fields are only ever excluded on the equity-statement side.
     */
    public EquityMergeResult merge(Map<String, LineItem> balanceSheetEquity, Map<String, LineItem> equityStatement) {
        Map<String, LineItem> merged = new LinkedHashMap<>(balanceSheetEquity);
        List<String> mergedFields = new ArrayList<>();
        List<String> excludedFields = new ArrayList<>();
        equityStatement.forEach((field, item) -> {
            if (item == null || item.effectiveValue() == null) {
                return;
            }
            String target = mapFieldName(field);
            if (isExcluded(field) || isExcluded(target)) {
                excludedFields.add(field);
                return;
            }
            LineItem existing = merged.get(target);
            if (!LineItemMerger.hasValue(existing) || existing.confidence() < item.confidence()) {
                merged.put(target, item.withSource(SOURCE_TAG));
                mergedFields.add(target);
            }
        });
        return new EquityMergeResult(merged, mergedFields, excludedFields);
    }

    public static String mapFieldName(String field) {
        return FIELD_MAPPING.getOrDefault(field, field);
    }

    public static boolean isExcluded(String field) {
        if (EXCLUDED_FIELDS.contains(field)) {
            return true;
        }
        for (String prefix : EXCLUDED_PREFIXES) {
            if (field.startsWith(prefix)) {
                return true;
            }
        }
        return field.contains(EXCLUDED_INFIX);
    }

    public record EquityMergeResult(Map<String, LineItem> equity, List<String> mergedFields, List<String> excludedFields) {
    }
}

package com.statementradar.export;

import com.statementradar.domain.ConfidenceLevel;
import com.statementradar.domain.ConsolidatedStatement;
import com.statementradar.domain.LineItem;
import com.statementradar.domain.StatementType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens a consolidated statement into template rows
 * {@code Category, Subcategory, Field, Confidence, Confidence_Score, Value_Year_1..4}.
 * Category is the statement a line-item category belongs to and Subcategory is that category itself.
 * base_year and year_1..year_3 fill Value_Year_1..4; an item without year columns puts its value in Value_Year_1.
 */
public final class TemplateRowMapper {

    public static final List<String> HEADER = List.of(
            "Category", "Subcategory", "Field", "Confidence", "Confidence_Score",
            "Value_Year_1", "Value_Year_2", "Value_Year_3", "Value_Year_4");

    static final List<String> YEAR_KEYS = List.of(LineItem.BASE_YEAR, "year_1", "year_2", "year_3");
    static final String SUMMARY_CATEGORY = "Summary Metrics";
    static final String OTHER_CATEGORY = "Other";

    private static final List<String> BALANCE_SHEET_KEYS = List.of("asset", "liabilit", "equity");
    private static final List<String> INCOME_STATEMENT_KEYS = List.of(
            "revenue", "sales", "expense", "cost", "income", "profit", "earnings", "results");
    private static final List<String> CASH_FLOW_KEYS = List.of("activities", "investing", "financing", "cash_flow");

    private TemplateRowMapper() {
    }

    public static List<List<String>> rows(ConsolidatedStatement statement) {
        List<List<String>> rows = new ArrayList<>();
        statement.lineItems().forEach((category, fields) ->
                fields.forEach((field, item) ->
                        rows.add(row(statementOf(category), humanize(category), field, item))));
        statement.summaryMetrics().forEach((field, item) -> rows.add(row(SUMMARY_CATEGORY, "", field, item)));
        return rows;
    }

    static List<String> row(String category, String subcategory, String field, LineItem item) {
        List<String> row = new ArrayList<>(HEADER.size());
        row.add(category);
        row.add(subcategory);
        row.add(humanize(field));
        row.add(ConfidenceLevel.of(item.confidence()).label());
        row.add(String.format(Locale.ROOT, "%.2f", item.confidence()));
        row.addAll(yearValues(item));
        return List.copyOf(row);
    }

    private static List<String> yearValues(LineItem item) {
        List<String> values = new ArrayList<>(YEAR_KEYS.size());
        Map<String, BigDecimal> years = item.yearValues();
        boolean any = false;
        for (String key : YEAR_KEYS) {
            BigDecimal v = years.get(key);
            values.add(format(v));
            any |= v != null;
        }
        if (!any && item.value() != null) {
            values.set(0, format(item.value()));
        }
        return values;
    }

    private static String format(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    /** Statement name for a line-item category key, e.g. "current_assets" is on the Balance Sheet. */
    static String statementOf(String categoryKey) {
        String key = categoryKey.toLowerCase(Locale.ROOT);
        if (containsAny(key, CASH_FLOW_KEYS)) {
            return StatementType.CASH_FLOW.displayName();
        }
        if (containsAny(key, BALANCE_SHEET_KEYS)) {
            return StatementType.BALANCE_SHEET.displayName();
        }
        if (containsAny(key, INCOME_STATEMENT_KEYS)) {
            return StatementType.INCOME_STATEMENT.displayName();
        }
        return OTHER_CATEGORY;
    }

    private static boolean containsAny(String key, List<String> fragments) {
        for (String fragment : fragments) {
            if (key.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /** "cash_and_equivalents" becomes "Cash And Equivalents". */
    static String humanize(String key) {
        StringBuilder out = new StringBuilder();
        for (String part : key.split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return out.toString();
    }
}

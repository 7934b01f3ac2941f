package com.statementradar.classification;

import com.statementradar.domain.StatementType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Phrase patterns used to score a page against each statement type.
 * Titles weigh 5 per match, line items 2, supporting indicators 1 and are shared by all types.
 * Phrases match anywhere in the text, so "revenue" also counts inside "revenues".
 */
public final class StatementPatternCatalog {

    public static final double TITLE_WEIGHT = 5.0;
    public static final double LINE_ITEM_WEIGHT = 2.0;
    public static final double SUPPORTING_WEIGHT = 1.0;

    private static final Map<StatementType, List<Pattern>> TITLES = new EnumMap<>(StatementType.class);
    private static final Map<StatementType, List<Pattern>> LINE_ITEMS = new EnumMap<>(StatementType.class);
    private static final List<Pattern> SUPPORTING;

    static {
        TITLES.put(StatementType.BALANCE_SHEET, compile(
                "statement of financial position",
                "balance sheet",
                "statement of position",
                "financial position"));
        TITLES.put(StatementType.INCOME_STATEMENT, compile(
                "statement of comprehensive income",
                "income statement",
                "profit and loss",
                "statement of operations",
                "statement of earnings",
                "comprehensive income"));
        TITLES.put(StatementType.CASH_FLOW, compile(
                "statement of cash flows",
                "cash flow statement",
                "statement of cash flow",
                "cash flows"));
        TITLES.put(StatementType.EQUITY, compile(
                "statement of changes in equity",
                "statement of equity",
                "changes in equity",
                "equity statement",
                "statement of stockholders.? equity"));

        LINE_ITEMS.put(StatementType.BALANCE_SHEET, compile(
                "current assets",
                "non.?current assets",
                "total assets",
                "current liabilities",
                "non.?current liabilities",
                "total liabilities",
                "shareholders.? equity",
                "retained earnings",
                "share capital",
                "cash and cash equivalents",
                "accounts receivable",
                "inventory",
                "property.? plant.? equipment",
                "accounts payable",
                "long.?term debt"));
        LINE_ITEMS.put(StatementType.INCOME_STATEMENT, compile(
                "revenue",
                "net sales",
                "gross profit",
                "operating income",
                "net income",
                "earnings per share",
                "cost of goods sold",
                "operating expenses",
                "interest expense",
                "income tax",
                "other comprehensive income",
                "basic earnings per share"));
        LINE_ITEMS.put(StatementType.CASH_FLOW, compile(
                "cash flows from operating activities",
                "cash flows from investing activities",
                "cash flows from financing activities",
                "net increase.? in cash",
                "depreciation and amortization",
                "changes in working capital",
                "capital expenditures",
                "dividends paid",
                "proceeds from borrowings"));
        LINE_ITEMS.put(StatementType.EQUITY, compile(
                "beginning balance",
                "ending balance",
                "comprehensive income",
                "dividends declared",
                "share issuance",
                "treasury shares",
                "appropriated",
                "unappropriated",
                "retained earnings"));

        SUPPORTING = compile(
                "with comparative figures",
                "see notes to",
                "notes to financial statements",
                "audited",
                "unaudited",
                "management.?s discussion",
                "for the year ended",
                "as of",
                "december 31",
                "march 31",
                "amounts in",
                "thousands",
                "millions",
                "philippine peso",
                "us dollars",
                "consolidated",
                "parent company");
    }

    private StatementPatternCatalog() {
    }

    public static List<Pattern> titles(StatementType type) {
        return TITLES.get(type);
    }

    public static List<Pattern> lineItems(StatementType type) {
        return LINE_ITEMS.get(type);
    }

    public static List<Pattern> supporting() {
        return SUPPORTING;
    }

    private static List<Pattern> compile(String... phrases) {
        return java.util.Arrays.stream(phrases)
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }
}

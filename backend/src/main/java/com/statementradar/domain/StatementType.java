package com.statementradar.domain;

/**
 * Financial statement a page can be classified as.
 * Declaration order is the tie-break order when two types score equally.
 */
public enum StatementType {
    BALANCE_SHEET("balance_sheet", "Balance Sheet"),
    INCOME_STATEMENT("income_statement", "Income Statement"),
    CASH_FLOW("cash_flow", "Cash Flow Statement"),
    EQUITY("equity", "Statement of Equity");

    private final String hint;
    private final String displayName;

    StatementType(String hint, String displayName) {
        this.hint = hint;
        this.displayName = displayName;
    }

    /** Snake-case name sent to the extraction service as the statement type hint. */
    public String hint() {
        return hint;
    }

    public String displayName() {
        return displayName;
    }
}

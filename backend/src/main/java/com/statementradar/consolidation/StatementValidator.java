package com.statementradar.consolidation;

import com.statementradar.consolidation.config.ConsolidationProperties;
import com.statementradar.domain.StatementType;
import com.statementradar.domain.ValidationCheck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the accounting identities that can be evaluated from the merged statements.
 * An identity whose inputs are missing is not checked and produces no entry.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StatementValidator {

    public static final String BALANCE_SHEET_EQUATION = "assets_equal_liabilities_plus_equity";
    public static final String INCOME_STATEMENT_EQUATION = "revenue_minus_expenses_equals_net_income";
    public static final String CASH_FLOW_EQUATION = "cash_flow_sections_equal_net_change_in_cash";
    public static final String NET_INCOME_CONSISTENCY = "net_income_consistent_across_statements";

    static final List<String> TOTAL_ASSETS = List.of("total_assets");
    static final List<String> TOTAL_LIABILITIES = List.of("total_liabilities");
    static final List<String> TOTAL_EQUITY = List.of(
            "total_equity", "total_shareholders_equity", "total_stockholders_equity");
    static final List<String> TOTAL_LIABILITIES_AND_EQUITY = List.of(
            "total_liabilities_and_equity", "total_liabilities_and_shareholders_equity",
            "total_liabilities_and_stockholders_equity");
    static final List<String> REVENUE = List.of(
            "total_revenue", "total_revenues", "revenue", "revenues", "net_sales", "total_net_sales", "sales");
    static final List<String> EXPENSES = List.of(
            "total_expenses", "total_costs_and_expenses", "total_cost_and_expenses");
    static final List<String> NET_INCOME = List.of(
            "net_income", "net_income_loss", "net_profit", "net_earnings", "profit_for_the_year");
    static final List<String> OPERATING_CASH = List.of(
            "net_cash_from_operating_activities", "net_cash_provided_by_operating_activities",
            "net_cash_used_in_operating_activities", "net_cash_from_operations", "operating_cash_flow");
    static final List<String> INVESTING_CASH = List.of(
            "net_cash_from_investing_activities", "net_cash_used_in_investing_activities",
            "net_cash_provided_by_investing_activities", "investing_cash_flow");
    static final List<String> FINANCING_CASH = List.of(
            "net_cash_from_financing_activities", "net_cash_used_in_financing_activities",
            "net_cash_provided_by_financing_activities", "financing_cash_flow");
    static final List<String> NET_CHANGE_IN_CASH = List.of(
            "net_change_in_cash", "net_increase_in_cash", "net_decrease_in_cash",
            "net_increase_decrease_in_cash", "net_change_in_cash_and_cash_equivalents",
            "net_increase_in_cash_and_cash_equivalents");

    private final ConsolidationProperties properties;

    public List<ValidationCheck> validate(Map<StatementType, StatementView> views) {
        List<ValidationCheck> checks = new ArrayList<>();
        StatementView balanceSheet = views.get(StatementType.BALANCE_SHEET);
        StatementView income = views.get(StatementType.INCOME_STATEMENT);
        StatementView cashFlow = views.get(StatementType.CASH_FLOW);

        if (balanceSheet != null) {
            addIfChecked(checks, checkBalanceSheet(balanceSheet));
        }
        if (income != null) {
            addIfChecked(checks, checkIncomeStatement(income));
        }
        if (cashFlow != null) {
            addIfChecked(checks, checkCashFlow(cashFlow));
        }
        if (income != null && cashFlow != null) {
            addIfChecked(checks, checkNetIncomeConsistency(income, cashFlow));
        }
        for (ValidationCheck check : checks) {
            if (!check.passed()) {
                log.warn("Validation failed: {} ({})", check.name(), check.detail());
            }
        }
        return checks;
    }

    ValidationCheck checkBalanceSheet(StatementView view) {
        BigDecimal assets = view.find(TOTAL_ASSETS);
        if (assets == null) {
            return null;
        }
        BigDecimal liabilities = view.find(TOTAL_LIABILITIES);
        BigDecimal equity = view.find(TOTAL_EQUITY);
        BigDecimal rhs;
        if (liabilities != null && equity != null) {
            rhs = liabilities.add(equity);
        } else {
            rhs = view.find(TOTAL_LIABILITIES_AND_EQUITY);
        }
        if (rhs == null) {
            return null;
        }
        return compare(BALANCE_SHEET_EQUATION, assets, rhs, "total assets", "liabilities + equity");
    }

    ValidationCheck checkIncomeStatement(StatementView view) {
        BigDecimal revenue = view.find(REVENUE);
        BigDecimal expenses = view.find(EXPENSES);
        BigDecimal netIncome = view.find(NET_INCOME);
        if (revenue == null || expenses == null || netIncome == null) {
            return null;
        }
        // expenses may be reported negative
        return compare(INCOME_STATEMENT_EQUATION, revenue.subtract(expenses.abs()), netIncome,
                "revenue - expenses", "net income");
    }

    ValidationCheck checkCashFlow(StatementView view) {
        BigDecimal operating = view.find(OPERATING_CASH);
        BigDecimal investing = view.find(INVESTING_CASH);
        BigDecimal financing = view.find(FINANCING_CASH);
        BigDecimal netChange = view.find(NET_CHANGE_IN_CASH);
        if (operating == null || investing == null || financing == null || netChange == null) {
            return null;
        }
        return compare(CASH_FLOW_EQUATION, operating.add(investing).add(financing), netChange,
                "operating + investing + financing", "net change in cash");
    }

    ValidationCheck checkNetIncomeConsistency(StatementView income, StatementView cashFlow) {
        BigDecimal fromIncome = income.find(NET_INCOME);
        BigDecimal fromCashFlow = cashFlow.find(NET_INCOME);
        if (fromIncome == null || fromCashFlow == null) {
            return null;
        }
        return compare(NET_INCOME_CONSISTENCY, fromIncome, fromCashFlow,
                "income statement net income", "cash flow net income");
    }

    boolean approximatelyEqual(BigDecimal a, BigDecimal b) {
        double diff = a.subtract(b).abs().doubleValue();
        double scale = Math.max(a.abs().doubleValue(), b.abs().doubleValue());
        return diff <= Math.max(properties.getAbsoluteTolerance(), properties.getRelativeTolerance() * scale);
    }

    private ValidationCheck compare(String name, BigDecimal left, BigDecimal right, String leftLabel, String rightLabel) {
        String detail = leftLabel + " = " + left.toPlainString() + ", " + rightLabel + " = " + right.toPlainString();
        return approximatelyEqual(left, right)
                ? ValidationCheck.passed(name, detail)
                : ValidationCheck.failed(name, detail);
    }

    private static void addIfChecked(List<ValidationCheck> checks, ValidationCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }
}

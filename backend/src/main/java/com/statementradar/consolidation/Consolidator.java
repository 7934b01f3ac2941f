package com.statementradar.consolidation;

import com.statementradar.domain.ConsolidatedStatement;
import com.statementradar.domain.ConsolidationInfo;
import com.statementradar.domain.ExtractedStatement;
import com.statementradar.domain.ExtractionResult;
import com.statementradar.domain.LineItem;
import com.statementradar.domain.StatementType;
import com.statementradar.domain.ValidationCheck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Merges the successful page extractions of a run into one {@link ConsolidatedStatement}.
 * Pages are processed in page-number order, so the output only depends on the inputs.
 * When the run has a balance sheet, statement-of-equity pages contribute their ending balances to its
 * equity section through {@link EquityMerger} and their other categories are not copied. Without a
 * balance sheet they are consolidated like any other page.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Consolidator {

    private final EquityMerger equityMerger;
    private final StatementValidator statementValidator;

    public ConsolidatedStatement consolidate(List<ExtractionResult> results) {
        List<ExtractionResult> successes = results.stream()
                .filter(ExtractionResult::isSuccess)
                .sorted(Comparator.comparingInt(ExtractionResult::getPageNum))
                .toList();
        if (successes.isEmpty()) {
            throw new IllegalArgumentException("Nothing to consolidate: no successful extraction results");
        }

        boolean hasBalanceSheet = successes.stream()
                .anyMatch(r -> r.getStatementType() == StatementType.BALANCE_SHEET);
        LineItemMerger merger = new LineItemMerger();
        LineItemMerger viewMerger = new LineItemMerger();
        Map<String, Map<String, LineItem>> lineItems = new LinkedHashMap<>();
        Map<String, LineItem> summaryMetrics = new LinkedHashMap<>();
        Map<StatementType, StatementView> views = new EnumMap<>(StatementType.class);
        Map<String, LineItem> equityStatementEquity = new LinkedHashMap<>();
        List<Integer> equityPages = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        for (ExtractionResult result : successes) {
            ExtractedStatement data = result.getData();
            int page = result.getPageNum();
            StatementType type = result.getStatementType();

            if (type != null) {
                StatementView view = views.computeIfAbsent(type, t -> new StatementView());
                viewMerger.mergeTree(view.lineItems(), data.lineItems(), page);
                viewMerger.mergeFields(view.summaryMetrics(), data.summaryMetrics(), page);
            }
            merger.mergeFields(summaryMetrics, data.summaryMetrics(), page);

            if (type == StatementType.EQUITY && hasBalanceSheet) {
                equityPages.add(page);
                merger.mergeFields(equityStatementEquity,
                        data.lineItems().getOrDefault(EquityMerger.EQUITY_CATEGORY, Map.of()), page);
            } else {
                merger.mergeTree(lineItems, data.lineItems(), page);
            }
            if (data.notes() != null) {
                notes.add("Page " + page + ": " + data.notes());
            }
        }

        if (!equityPages.isEmpty()) {
            EquityMerger.EquityMergeResult equity = equityMerger.merge(
                    lineItems.getOrDefault(EquityMerger.EQUITY_CATEGORY, Map.of()), equityStatementEquity);
            if (!equity.equity().isEmpty()) {
                lineItems.put(EquityMerger.EQUITY_CATEGORY, new LinkedHashMap<>(equity.equity()));
                views.computeIfAbsent(StatementType.BALANCE_SHEET, t -> new StatementView())
                        .lineItems().put(EquityMerger.EQUITY_CATEGORY, new LinkedHashMap<>(equity.equity()));
            }
            notes.add("Statement of Equity (pages " + equityPages + ") merged into balance sheet equity: "
                    + equity.mergedFields().size() + " fields updated"
                    + (equity.excludedFields().isEmpty() ? "" : ", movement fields excluded " + equity.excludedFields()));
        }

        List<ValidationCheck> checks = statementValidator.validate(views);
        List<String> years = mergeYears(successes);
        ConsolidationInfo info = new ConsolidationInfo(
                successes.stream().map(ExtractionResult::getPageNum).toList(),
                merger.getDuplicatesRemoved(),
                merger.getConflictsResolved(),
                checks,
                notes);

        log.info("Consolidated {} pages: {} duplicates removed, {} conflicts resolved, {}/{} checks passed",
                successes.size(), info.duplicatesRemoved(), info.conflictsResolved(),
                checks.size() - info.failedChecks().size(), checks.size());

        return new ConsolidatedStatement(
                firstPresent(successes, ExtractedStatement::companyName),
                firstPresent(successes, ExtractedStatement::period),
                firstPresent(successes, ExtractedStatement::currency),
                years,
                years.isEmpty() ? "" : years.get(0),
                lineItems,
                summaryMetrics,
                info);
    }

    /** Union of detected years across pages, most recent first. */
    static List<String> mergeYears(List<ExtractionResult> successes) {
        Set<String> years = new TreeSet<>(Comparator.reverseOrder());
        for (ExtractionResult r : successes) {
            years.addAll(r.getData().yearsDetected());
            if (r.getData().baseYear() != null) {
                years.add(r.getData().baseYear());
            }
        }
        return List.copyOf(years);
    }

    private static String firstPresent(List<ExtractionResult> successes,
                                       Function<ExtractedStatement, String> getter) {
        for (ExtractionResult r : successes) {
            String value = getter.apply(r.getData());
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}

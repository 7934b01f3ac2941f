package com.statementradar.domain;

import java.util.List;

/**
 * Bookkeeping attached to a consolidated statement.
 */
public record ConsolidationInfo(
        List<Integer> sourcePages,
        int duplicatesRemoved,
        int conflictsResolved,
        List<ValidationCheck> validationResults,
        List<String> notes
) {

    public ConsolidationInfo {
        sourcePages = List.copyOf(sourcePages);
        validationResults = List.copyOf(validationResults);
        notes = List.copyOf(notes);
    }

    public List<ValidationCheck> failedChecks() {
        return validationResults.stream().filter(c -> !c.passed()).toList();
    }
}

package com.statementradar.export;

import com.statementradar.domain.ConsolidatedStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the fixed year-mapping row written before the data rows of a template export:
 * {@code Date, Year, Year, "", 0.0} followed by four year labels, most recent first, padded with "".
 */
public final class YearMappingHeader {

    public static final int YEAR_COLUMNS = 4;

    private YearMappingHeader() {
    }

    public static List<String> row(ConsolidatedStatement statement) {
        return row(statement.yearsDetected());
    }

    public static List<String> row(List<String> yearsMostRecentFirst) {
        List<String> row = new ArrayList<>(List.of("Date", "Year", "Year", "", "0.0"));
        for (int i = 0; i < YEAR_COLUMNS; i++) {
            row.add(i < yearsMostRecentFirst.size() ? yearsMostRecentFirst.get(i) : "");
        }
        return List.copyOf(row);
    }
}

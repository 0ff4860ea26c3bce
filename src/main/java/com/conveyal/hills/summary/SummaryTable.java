package com.conveyal.hills.summary;

import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.Measure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary statistics of one measure for one category under one grouping mode, rows sorted by group key. A stationary
 * table has exactly one row.
 */
public class SummaryTable {

    public final StatisticsMode mode;

    public final CategoryKey category;

    public final Measure measure;

    /** Width of the report bins the statistics were computed over. */
    public final int binMinutes;

    /** Column names in output order, percentile columns last. */
    public final List<String> columns;

    private final List<SummaryRow> rows;

    private final Map<GroupKey, SummaryRow> rowsByKey = new LinkedHashMap<>();

    SummaryTable (StatisticsMode mode, CategoryKey category, Measure measure, int binMinutes,
                  List<String> columns, List<SummaryRow> rows) {
        this.mode = mode;
        this.category = category;
        this.measure = measure;
        this.binMinutes = binMinutes;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        for (SummaryRow row : rows) {
            rowsByKey.put(row.key, row);
        }
    }

    public List<SummaryRow> rows () {
        return rows;
    }

    public int size () {
        return rows.size();
    }

    public SummaryRow row (GroupKey key) {
        return rowsByKey.get(key);
    }

    /** The row for a day of week (Monday is 0) and bin of day in a nonstationary table, or null if absent. */
    public SummaryRow row (int dayOfWeek, int binOfDay) {
        for (SummaryRow row : rows) {
            if (row.key.dayOfWeek == dayOfWeek && row.key.binOfDay == binOfDay) {
                return row;
            }
        }
        return null;
    }

    /** The single row of a stationary table. */
    public SummaryRow stationaryRow () {
        if (mode != StatisticsMode.STATIONARY || rows.size() != 1) {
            throw new IllegalStateException("Not a stationary table: " + mode + " with " + rows.size() + " rows.");
        }
        return rows.get(0);
    }

}

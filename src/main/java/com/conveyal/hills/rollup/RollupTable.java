package com.conveyal.hills.rollup;

import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.Measure;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The "by datetime" table for one category: one row per report bin across the analysis window, sorted by datetime.
 * Immutable once built.
 */
public class RollupTable {

    public final CategoryKey category;

    public final int binMinutes;

    private final List<RollupRow> rows;

    private final Map<LocalDateTime, RollupRow> rowsByDatetime = new HashMap<>();

    RollupTable (CategoryKey category, int binMinutes, List<RollupRow> rows) {
        this.category = category;
        this.binMinutes = binMinutes;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        for (RollupRow row : rows) {
            rowsByDatetime.put(row.datetime, row);
        }
    }

    public List<RollupRow> rows () {
        return rows;
    }

    public int size () {
        return rows.size();
    }

    /** The row for the report bin beginning at the given instant, or null if there is none. */
    public RollupRow row (LocalDateTime datetime) {
        return rowsByDatetime.get(datetime);
    }

    /** Value of the measure in the bin beginning at the given instant, zero if the instant is not a bin start. */
    public double value (Measure measure, LocalDateTime datetime) {
        RollupRow row = row(datetime);
        return row == null ? 0 : row.get(measure);
    }

    public double[] values (Measure measure) {
        double[] values = new double[rows.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = rows.get(i).get(measure);
        }
        return values;
    }

    public double total (Measure measure) {
        double sum = 0;
        for (RollupRow row : rows) {
            sum += row.get(measure);
        }
        return sum;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RollupTable that = (RollupTable) o;
        return binMinutes == that.binMinutes && category.equals(that.category) && rows.equals(that.rows);
    }

    @Override
    public int hashCode () {
        return rows.hashCode();
    }

}

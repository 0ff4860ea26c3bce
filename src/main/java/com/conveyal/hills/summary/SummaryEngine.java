package com.conveyal.hills.summary;

import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.Measure;
import com.conveyal.hills.rollup.RollupRow;
import com.conveyal.hills.rollup.RollupTable;
import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TDoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Groups the rows of rolled-up tables and computes descriptive statistics of every measure within each group.
 * Nonstationary grouping is by (category, day of week, bin of day) and stationary grouping by category alone.
 */
public class SummaryEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SummaryEngine.class);

    private final List<Double> percentiles;

    private final List<String> columns;

    public SummaryEngine (List<Double> percentiles) {
        for (double p : percentiles) {
            checkArgument(p >= 0 && p <= 1, "Percentile %s is outside [0, 1].", p);
        }
        this.percentiles = ImmutableList.copyOf(percentiles);
        this.columns = SummaryStatistics.columns(percentiles);
    }

    /** Summarize one category's rollup table under one grouping mode, giving one table per measure. */
    public Map<Measure, SummaryTable> summarize (RollupTable table, StatisticsMode mode) {
        Map<Measure, SummaryTable> tables = new EnumMap<>(Measure.class);
        for (Measure measure : Measure.values()) {
            // TreeMap keeps the groups sorted by key.
            Map<GroupKey, TDoubleArrayList> groups = new TreeMap<>();
            for (RollupRow row : table.rows()) {
                groups.computeIfAbsent(GroupKey.of(mode, row), k -> new TDoubleArrayList()).add(row.get(measure));
            }
            List<SummaryRow> rows = new ArrayList<>(groups.size());
            for (Map.Entry<GroupKey, TDoubleArrayList> entry : groups.entrySet()) {
                SummaryStatistics stats = SummaryStatistics.of(entry.getValue().toArray(), percentiles);
                rows.add(new SummaryRow(entry.getKey(), stats));
            }
            tables.put(measure, new SummaryTable(mode, table.category, measure, table.binMinutes, columns, rows));
        }
        LOG.debug("cat {} {} summary has {} groups", table.category, mode.label(),
                tables.get(Measure.OCCUPANCY).size());
        return tables;
    }

    /**
     * Summarize every category under each requested mode.
     * @return mode -> category -> measure -> table, modes and categories in sorted order.
     */
    public Map<StatisticsMode, Map<CategoryKey, Map<Measure, SummaryTable>>> summarizeAll (
            Collection<RollupTable> tables, boolean nonstationary, boolean stationary) {
        Map<StatisticsMode, Map<CategoryKey, Map<Measure, SummaryTable>>> result = new EnumMap<>(StatisticsMode.class);
        for (StatisticsMode mode : StatisticsMode.values()) {
            if (mode == StatisticsMode.NONSTATIONARY && !nonstationary) continue;
            if (mode == StatisticsMode.STATIONARY && !stationary) continue;
            Map<CategoryKey, Map<Measure, SummaryTable>> byCategory = new TreeMap<>();
            for (RollupTable table : tables) {
                byCategory.put(table.category, summarize(table, mode));
            }
            result.put(mode, byCategory);
        }
        LOG.info("Computed {} summaries for {} categories", result.keySet(), tables.size());
        return result;
    }

    public List<Double> percentiles () {
        return percentiles;
    }

    public List<String> columns () {
        return columns;
    }

}

package com.conveyal.hills.analysis;

import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.HillsException;
import com.conveyal.hills.model.Measure;
import com.conveyal.hills.rollup.RollupTable;
import com.conveyal.hills.summary.ImpliedOperatingHours;
import com.conveyal.hills.summary.StatisticsMode;
import com.conveyal.hills.summary.SummaryStatistics;
import com.conveyal.hills.summary.SummaryTable;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * The outputs of one analysis run. All maps iterate in sorted category order, the synthetic total last.
 */
public class HillsResult {

    public final AnalysisParameters parameters;

    /** One table per category at the report bin width. */
    public final Map<CategoryKey, RollupTable> byDatetime;

    /** One table per category at the fine bin width, empty unless the high-resolution table was requested. */
    public final Map<CategoryKey, RollupTable> highResolution;

    /** mode -> category -> measure -> summary table. */
    public final Map<StatisticsMode, Map<CategoryKey, Map<Measure, SummaryTable>>> summaries;

    public final Map<CategoryKey, SummaryStatistics> lengthOfStay;

    public final AnalysisDiagnostics diagnostics;

    HillsResult (AnalysisParameters parameters,
                 Map<CategoryKey, RollupTable> byDatetime,
                 Map<CategoryKey, RollupTable> highResolution,
                 Map<StatisticsMode, Map<CategoryKey, Map<Measure, SummaryTable>>> summaries,
                 Map<CategoryKey, SummaryStatistics> lengthOfStay,
                 AnalysisDiagnostics diagnostics) {
        this.parameters = parameters;
        this.byDatetime = Collections.unmodifiableMap(byDatetime);
        this.highResolution = Collections.unmodifiableMap(highResolution);
        this.summaries = Collections.unmodifiableMap(summaries);
        this.lengthOfStay = Collections.unmodifiableMap(lengthOfStay);
        this.diagnostics = diagnostics;
    }

    public Set<CategoryKey> categories () {
        return byDatetime.keySet();
    }

    public RollupTable byDatetime (CategoryKey category) {
        RollupTable table = byDatetime.get(category);
        if (table == null) {
            throw new HillsException("No results for category " + category + ".");
        }
        return table;
    }

    public SummaryTable summary (StatisticsMode mode, CategoryKey category, Measure measure) {
        Map<CategoryKey, Map<Measure, SummaryTable>> byCategory = summaries.get(mode);
        if (byCategory == null) {
            throw new HillsException(mode.label() + " statistics were not computed.");
        }
        Map<Measure, SummaryTable> byMeasure = byCategory.get(category);
        if (byMeasure == null) {
            throw new HillsException("No results for category " + category + ".");
        }
        return byMeasure.get(measure);
    }

    /** Operating hours implied by the mean nonstationary occupancy of the category. */
    public ImpliedOperatingHours operatingHours (CategoryKey category) {
        return ImpliedOperatingHours.compute(summary(StatisticsMode.NONSTATIONARY, category, Measure.OCCUPANCY));
    }

    public ImpliedOperatingHours operatingHours (CategoryKey category, String statistic, double threshold) {
        return ImpliedOperatingHours.compute(
                summary(StatisticsMode.NONSTATIONARY, category, Measure.OCCUPANCY), statistic, threshold);
    }

}

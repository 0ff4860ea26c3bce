package com.conveyal.hills.summary;

import com.conveyal.hills.binning.RecordClassifier;
import com.conveyal.hills.model.AnalysisWindow;
import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.LengthOfStayUnit;
import com.conveyal.hills.model.StopRecord;
import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TDoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stationary statistics of the length of stay (exit minus entry) of the stays that overlap the analysis window,
 * expressed in a chosen time unit. Stays that run backwards or never touch the window are left out.
 */
public class LengthOfStaySummarizer {

    private static final Logger LOG = LoggerFactory.getLogger(LengthOfStaySummarizer.class);

    private final AnalysisWindow window;

    private final LengthOfStayUnit unit;

    private final List<Double> percentiles;

    public LengthOfStaySummarizer (AnalysisWindow window, LengthOfStayUnit unit, List<Double> percentiles) {
        this.window = window;
        this.unit = unit;
        this.percentiles = ImmutableList.copyOf(percentiles);
    }

    public SummaryStatistics summarize (Collection<StopRecord> records) {
        TDoubleArrayList lengths = new TDoubleArrayList(records.size());
        for (StopRecord record : records) {
            if (RecordClassifier.classify(record.entry, record.exit, window).isAccumulated()) {
                lengths.add(unit.convert(Duration.between(record.entry, record.exit)));
            }
        }
        return SummaryStatistics.of(lengths.toArray(), percentiles);
    }

    /**
     * Statistics for each partition, plus the synthetic total over all of them when requested. A partition already keyed
     * as the total is summarized as is.
     */
    public Map<CategoryKey, SummaryStatistics> summarizeAll (Map<CategoryKey, List<StopRecord>> partitions,
                                                             boolean includeTotal) {
        Map<CategoryKey, SummaryStatistics> result = new TreeMap<>();
        List<StopRecord> all = new ArrayList<>();
        for (Map.Entry<CategoryKey, List<StopRecord>> entry : partitions.entrySet()) {
            result.put(entry.getKey(), summarize(entry.getValue()));
            all.addAll(entry.getValue());
        }
        if (includeTotal && !result.containsKey(CategoryKey.TOTAL)) {
            result.put(CategoryKey.TOTAL, summarize(all));
        }
        LOG.info("Computed length of stay in {} for {} categories", unit.name().toLowerCase(), result.size());
        return result;
    }

    public LengthOfStayUnit unit () {
        return unit;
    }

}

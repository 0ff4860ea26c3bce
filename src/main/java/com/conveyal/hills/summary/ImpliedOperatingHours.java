package com.conveyal.hills.summary;

import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.Measure;
import com.conveyal.hills.util.TimeUtils;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Operating hours inferred from a nonstationary occupancy summary. A bin counts as open when the chosen statistic is at
 * least the threshold fraction of that statistic's maximum over the whole week. For each day the hours run from the
 * start of the first open bin to the end of the last open bin. Days without any open bin are closed.
 */
public class ImpliedOperatingHours {

    public static final String DEFAULT_STATISTIC = "mean";

    public static final double DEFAULT_THRESHOLD = 0.2;

    public final CategoryKey category;

    public final String statistic;

    public final double threshold;

    /** Seven entries, Monday first. */
    public final List<Day> days;

    private ImpliedOperatingHours (CategoryKey category, String statistic, double threshold, List<Day> days) {
        this.category = category;
        this.statistic = statistic;
        this.threshold = threshold;
        this.days = Collections.unmodifiableList(days);
    }

    public static class Day {

        /** Monday is 0. */
        public final int dayOfWeek;

        public final String dowName;

        public final boolean open;

        /** First and last open bin of day, -1 when closed. */
        public final int firstBin;

        public final int lastBin;

        /** HH:mm of the start of the first open bin and the end of the last one, null when closed. */
        public final String opens;

        public final String closes;

        Day (int dayOfWeek, int firstBin, int lastBin, int binMinutes) {
            this.dayOfWeek = dayOfWeek;
            this.dowName = DayOfWeek.of(dayOfWeek + 1).getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
            this.open = firstBin >= 0;
            this.firstBin = firstBin;
            this.lastBin = lastBin;
            this.opens = open ? TimeUtils.minutesToString(firstBin * binMinutes) : null;
            this.closes = open ? TimeUtils.minutesToString((lastBin + 1) * binMinutes) : null;
        }

        @Override
        public String toString () {
            return open ? String.format("%s %s-%s", dowName, opens, closes) : dowName + " closed";
        }

    }

    public static ImpliedOperatingHours compute (SummaryTable occupancy, String statistic, double threshold) {
        checkArgument(occupancy.mode == StatisticsMode.NONSTATIONARY && occupancy.measure == Measure.OCCUPANCY,
                "Operating hours need a nonstationary occupancy summary.");
        checkArgument(threshold >= 0 && threshold <= 1, "Threshold %s is outside [0, 1].", threshold);
        double weeklyMax = Double.NEGATIVE_INFINITY;
        for (SummaryRow row : occupancy.rows()) {
            double value = row.get(statistic);
            if (value > weeklyMax) weeklyMax = value;
        }
        List<Day> days = new ArrayList<>(7);
        for (int dow = 0; dow < 7; dow++) {
            int first = -1;
            int last = -1;
            if (weeklyMax > 0) {
                for (SummaryRow row : occupancy.rows()) {
                    if (row.key.dayOfWeek != dow) continue;
                    // Comparisons against NaN are false, so undefined statistics never open a bin.
                    if (row.get(statistic) >= threshold * weeklyMax) {
                        if (first < 0 || row.key.binOfDay < first) first = row.key.binOfDay;
                        if (row.key.binOfDay > last) last = row.key.binOfDay;
                    }
                }
            }
            days.add(new Day(dow, first, last, occupancy.binMinutes));
        }
        return new ImpliedOperatingHours(occupancy.category, statistic, threshold, days);
    }

    public static ImpliedOperatingHours compute (SummaryTable occupancy) {
        return compute(occupancy, DEFAULT_STATISTIC, DEFAULT_THRESHOLD);
    }

    @Override
    public String toString () {
        return category + " " + days;
    }

}

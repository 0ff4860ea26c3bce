package com.conveyal.hills.analysis;

import com.conveyal.hills.model.AnalysisWindow;
import com.conveyal.hills.model.EdgeBinMode;
import com.conveyal.hills.model.HillsException;
import com.conveyal.hills.model.LengthOfStayUnit;
import com.conveyal.hills.util.TimeUtils;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Everything that controls one analysis run. Instances are immutable and can only be obtained from a {@link Builder},
 * which validates them, so a constructed instance is always usable.
 */
public class AnalysisParameters {

    public static final List<Double> DEFAULT_PERCENTILES = ImmutableList.of(0.25, 0.5, 0.75, 0.95, 0.99);

    public final String scenarioName;

    public final AnalysisWindow window;

    /** Width of the bins in which results are reported. Must divide a day evenly. */
    public final int reportBinMinutes;

    /** Width of the fine accumulation bins. Must divide the report bin width. */
    public final int highresBinMinutes;

    public final EdgeBinMode edgeBinMode;

    /** Whether to return the by-datetime table at the fine resolution as well as at the report resolution. */
    public final boolean keepHighResolution;

    /** Whether a missing departure is replaced with the window end instead of dropping the record. */
    public final boolean adjustCensoredDepartures;

    public final Set<String> categoriesToExclude;

    /** Fractions in [0, 1]. */
    public final List<Double> percentiles;

    /** Whether to produce the synthetic total over all categories in a categorized run. */
    public final boolean totals;

    public final boolean nonstationary;

    public final boolean stationary;

    public final LengthOfStayUnit losUnit;

    /** Number of worker threads for per-category accumulation. One runs everything on the calling thread. */
    public final int threads;

    private AnalysisParameters (Builder builder) {
        this.scenarioName = builder.scenarioName;
        this.window = builder.window;
        this.reportBinMinutes = builder.reportBinMinutes;
        this.highresBinMinutes = builder.highresBinMinutes;
        this.edgeBinMode = builder.edgeBinMode;
        this.keepHighResolution = builder.keepHighResolution;
        this.adjustCensoredDepartures = builder.adjustCensoredDepartures;
        this.categoriesToExclude = ImmutableSet.copyOf(builder.categoriesToExclude);
        this.percentiles = ImmutableList.copyOf(builder.percentiles);
        this.totals = builder.totals;
        this.nonstationary = builder.nonstationary;
        this.stationary = builder.stationary;
        this.losUnit = builder.losUnit;
        this.threads = builder.threads;
    }

    /**
     * Width of the grid on which stays are actually accumulated. Fractional edges are exact at any resolution, so
     * unless the fine table is wanted or whole-bin edges would be distorted by the coarser grid, accumulation happens
     * directly at the report width.
     */
    public int effectiveFineBinMinutes () {
        if (edgeBinMode == EdgeBinMode.FRACTIONAL && !keepHighResolution) {
            return reportBinMinutes;
        }
        return highresBinMinutes;
    }

    /** Throw a HillsException describing the first problem found, if any. */
    public void validate () {
        if (window == null) {
            throw new HillsException("Analysis start and end must be specified.");
        }
        if (reportBinMinutes <= 0) {
            throw new HillsException("Report bin size must be positive, got " + reportBinMinutes + " minutes.");
        }
        if (highresBinMinutes <= 0) {
            throw new HillsException("High resolution bin size must be positive, got " + highresBinMinutes + " minutes.");
        }
        if (TimeUtils.MINUTES_PER_DAY % reportBinMinutes != 0) {
            throw new HillsException(String.format(
                    "Report bin size of %d minutes does not divide evenly into 1440 minutes.", reportBinMinutes));
        }
        if (highresBinMinutes > reportBinMinutes) {
            throw new HillsException(String.format(
                    "High resolution bin size (%d) must be no larger than report bin size (%d).",
                    highresBinMinutes, reportBinMinutes));
        }
        if (reportBinMinutes % highresBinMinutes != 0) {
            throw new HillsException(String.format(
                    "Report bin size (%d) must be a multiple of high resolution bin size (%d).",
                    reportBinMinutes, highresBinMinutes));
        }
        for (Double p : percentiles) {
            if (p == null || !(p >= 0 && p <= 1)) {
                throw new HillsException("Percentiles must be between 0 and 1, got " + p + ".");
            }
        }
        if (threads < 1) {
            throw new HillsException("Thread count must be at least 1, got " + threads + ".");
        }
        if (edgeBinMode == null || losUnit == null) {
            throw new HillsException("Edge bin mode and length of stay units must be specified.");
        }
    }

    public static Builder builder () {
        return new Builder();
    }

    public Builder toBuilder () {
        return new Builder()
                .scenarioName(scenarioName)
                .window(window)
                .reportBinMinutes(reportBinMinutes)
                .highresBinMinutes(highresBinMinutes)
                .edgeBinMode(edgeBinMode)
                .keepHighResolution(keepHighResolution)
                .adjustCensoredDepartures(adjustCensoredDepartures)
                .categoriesToExclude(categoriesToExclude)
                .percentiles(percentiles)
                .totals(totals)
                .nonstationary(nonstationary)
                .stationary(stationary)
                .losUnit(losUnit)
                .threads(threads);
    }

    @Override
    public String toString () {
        return String.format("scenario %s, window %s, report bins %d min, fine bins %d min, edge bins %s, " +
                        "excluded %s, percentiles %s, totals %s, threads %d", scenarioName, window, reportBinMinutes,
                effectiveFineBinMinutes(), edgeBinMode, categoriesToExclude, percentiles, totals, threads);
    }

    public static class Builder {

        private String scenarioName = "scenario";
        private AnalysisWindow window;
        private LocalDate startDate;
        private LocalDate endDate;
        private int reportBinMinutes = 60;
        private int highresBinMinutes = 5;
        private EdgeBinMode edgeBinMode = EdgeBinMode.FRACTIONAL;
        private boolean keepHighResolution = false;
        private boolean adjustCensoredDepartures = false;
        private Collection<String> categoriesToExclude = ImmutableSet.of();
        private List<Double> percentiles = DEFAULT_PERCENTILES;
        private boolean totals = true;
        private boolean nonstationary = true;
        private boolean stationary = true;
        private LengthOfStayUnit losUnit = LengthOfStayUnit.HOURS;
        private int threads = 1;

        public Builder scenarioName (String scenarioName) {
            this.scenarioName = scenarioName;
            return this;
        }

        public Builder window (AnalysisWindow window) {
            this.window = window;
            return this;
        }

        public Builder window (LocalDateTime start, LocalDateTime end) {
            return window(new AnalysisWindow(start, end));
        }

        /** Whole days from the start of startDate through the end of endDate. */
        public Builder dates (LocalDate startDate, LocalDate endDate) {
            this.startDate = startDate;
            this.endDate = endDate;
            return this;
        }

        public Builder reportBinMinutes (int reportBinMinutes) {
            this.reportBinMinutes = reportBinMinutes;
            return this;
        }

        public Builder highresBinMinutes (int highresBinMinutes) {
            this.highresBinMinutes = highresBinMinutes;
            return this;
        }

        public Builder edgeBinMode (EdgeBinMode edgeBinMode) {
            this.edgeBinMode = edgeBinMode;
            return this;
        }

        public Builder keepHighResolution (boolean keepHighResolution) {
            this.keepHighResolution = keepHighResolution;
            return this;
        }

        public Builder adjustCensoredDepartures (boolean adjustCensoredDepartures) {
            this.adjustCensoredDepartures = adjustCensoredDepartures;
            return this;
        }

        public Builder categoriesToExclude (Collection<String> categoriesToExclude) {
            this.categoriesToExclude = categoriesToExclude;
            return this;
        }

        public Builder percentiles (List<Double> percentiles) {
            this.percentiles = percentiles;
            return this;
        }

        public Builder totals (boolean totals) {
            this.totals = totals;
            return this;
        }

        public Builder nonstationary (boolean nonstationary) {
            this.nonstationary = nonstationary;
            return this;
        }

        public Builder stationary (boolean stationary) {
            this.stationary = stationary;
            return this;
        }

        public Builder losUnit (LengthOfStayUnit losUnit) {
            this.losUnit = losUnit;
            return this;
        }

        public Builder threads (int threads) {
            this.threads = threads;
            return this;
        }

        /** @throws HillsException if the parameters are inconsistent. */
        public AnalysisParameters build () {
            if (startDate != null || endDate != null) {
                if (startDate == null || endDate == null) {
                    throw new HillsException("Both start and end dates must be specified.");
                }
                if (endDate.isBefore(startDate)) {
                    throw new HillsException(String.format("End date %s is before start date %s.", endDate, startDate));
                }
                window = AnalysisWindow.ofDates(startDate, endDate);
            }
            if (percentiles == null || categoriesToExclude == null) {
                throw new HillsException("Percentiles and excluded categories may be empty but not null.");
            }
            for (Double p : percentiles) {
                if (p == null) throw new HillsException("Percentiles must not contain null.");
            }
            AnalysisParameters parameters = new AnalysisParameters(this);
            parameters.validate();
            return parameters;
        }

    }

}

package com.conveyal.hills.binning;

import com.conveyal.hills.model.AnalysisWindow;
import com.conveyal.hills.model.Measure;
import com.conveyal.hills.model.StopRecord;
import com.conveyal.hills.util.TimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Cross-checks the accumulated matrix of a category against totals computed independently from its raw records.
 * Failed checks are warnings: they usually point at boundary or weighting problems in the data but never stop a run.
 *
 * Expected occupancy is the weighted time each stay spends on the grid, that is its interval intersected with
 * [window start, end of last bin). For stays entirely inside the window this is simply weight * (exit - entry).
 */
public class ConservationChecker {

    private static final Logger LOG = LoggerFactory.getLogger(ConservationChecker.class);

    /** Binned occupancy may differ from the directly computed value by this relative amount before a warning. */
    public static final double OCCUPANCY_TOLERANCE = 0.02;

    /** Hours of slack allowed between the analysis window and the span of the data before warning of a mismatch. */
    public static final double DATE_RANGE_TOLERANCE_HOURS = 48.0;

    private final AnalysisWindow window;

    private final int binMinutes;

    public ConservationChecker (AnalysisWindow window, int binMinutes) {
        this.window = window;
        this.binMinutes = binMinutes;
    }

    public ConservationResult check (FineGridMatrix matrix, Collection<StopRecord> records) {
        String category = matrix.category.toString();
        LocalDateTime gridEnd = window.gridEnd(binMinutes);
        double binSeconds = binMinutes * 60.0;
        long arrivalsExpected = 0;
        long departuresExpected = 0;
        double occupancyExpected = 0;
        for (StopRecord record : records) {
            if (withinInclusive(record.entry)) {
                arrivalsExpected += 1;
            }
            if (withinInclusive(record.exit)) {
                departuresExpected += 1;
            }
            if (!record.exit.isBefore(record.entry)) {
                LocalDateTime from = record.entry.isAfter(window.start) ? record.entry : window.start;
                LocalDateTime to = record.exit.isBefore(gridEnd) ? record.exit : gridEnd;
                if (to.isAfter(from)) {
                    occupancyExpected += record.weight * TimeUtils.secondsBetween(from, to) / binSeconds;
                }
            }
        }
        double arrivalsBinned = matrix.total(Measure.ARRIVALS);
        double departuresBinned = matrix.total(Measure.DEPARTURES);
        double occupancyBinned = matrix.total(Measure.OCCUPANCY);

        LOG.info("cat {} num_arrivals_hm {} num_arrivals_stops {}", category, (long) arrivalsBinned, arrivalsExpected);
        LOG.info("cat {} num_departures_hm {} num_departures_stops {}", category, (long) departuresBinned, departuresExpected);
        LOG.info("cat {} tot_occ_hm {} tot_occ_stops {}", category,
                String.format("%.2f", occupancyBinned), String.format("%.2f", occupancyExpected));

        List<String> warnings = new ArrayList<>();
        if (arrivalsBinned != arrivalsExpected) {
            warnings.add(String.format("cat %s binned arrivals (%.0f) not equal to arrivals in stop data (%d)",
                    category, arrivalsBinned, arrivalsExpected));
        }
        if (departuresBinned != departuresExpected) {
            warnings.add(String.format("cat %s binned departures (%.0f) not equal to departures in stop data (%d)",
                    category, departuresBinned, departuresExpected));
        }
        double relativeError = Double.NaN;
        if (occupancyExpected > 0) {
            relativeError = Math.abs(occupancyBinned - occupancyExpected) / occupancyExpected;
            if (relativeError > OCCUPANCY_TOLERANCE) {
                warnings.add(String.format("cat %s weighted occupancy differs by more than %.2f (%.4f)",
                        category, OCCUPANCY_TOLERANCE, relativeError));
            }
        } else if (occupancyBinned > 0) {
            warnings.add(String.format("cat %s has binned occupancy %.4f but no occupied time in stop data",
                    category, occupancyBinned));
        }
        for (String warning : warnings) {
            LOG.warn(warning);
        }
        return new ConservationResult(category, arrivalsBinned, arrivalsExpected, departuresBinned, departuresExpected,
                occupancyBinned, occupancyExpected, relativeError, warnings);
    }

    /**
     * Warn when the analysis window and the span of the stop data disagree by more than the tolerance in either
     * direction: the window beginning long before the first arrival or ending long after the last departure (usually
     * the wrong dates were supplied), or the data extending far outside the window. Returns the warnings, which are
     * also logged.
     */
    public List<String> checkDateRanges (Collection<StopRecord> records) {
        List<String> warnings = new ArrayList<>();
        LocalDateTime minEntry = null;
        LocalDateTime maxExit = null;
        for (StopRecord record : records) {
            if (minEntry == null || record.entry.isBefore(minEntry)) {
                minEntry = record.entry;
            }
            if (maxExit == null || record.exit.isAfter(maxExit)) {
                maxExit = record.exit;
            }
        }
        if (minEntry == null) {
            return warnings;
        }
        LOG.info("min of intime: {}, max of outtime: {}", minEntry, maxExit);
        double earlyHours = TimeUtils.hoursBetween(window.start, minEntry);
        double lateHours = TimeUtils.hoursBetween(maxExit, window.end);
        if (earlyHours > DATE_RANGE_TOLERANCE_HOURS) {
            warnings.add(String.format("Analysis starts %.2f hours before first arrival", earlyHours));
        }
        if (lateHours > DATE_RANGE_TOLERANCE_HOURS) {
            warnings.add(String.format("Analysis ends %.2f hours after last departure", lateHours));
        }
        if (-earlyHours > DATE_RANGE_TOLERANCE_HOURS) {
            warnings.add(String.format("First arrival is %.2f hours before start of analysis", -earlyHours));
        }
        if (-lateHours > DATE_RANGE_TOLERANCE_HOURS) {
            warnings.add(String.format("Last departure is %.2f hours after end of analysis", -lateHours));
        }
        for (String warning : warnings) {
            LOG.warn(warning);
        }
        return warnings;
    }

    private boolean withinInclusive (LocalDateTime instant) {
        return !instant.isBefore(window.start) && !instant.isAfter(window.end);
    }

}

package com.conveyal.hills.rollup;

import com.conveyal.hills.binning.FineGridMatrix;
import com.conveyal.hills.binning.TimeBinIndexer;
import com.conveyal.hills.model.Measure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Rolls a fine grid matrix up to the coarser report bin width and attaches calendar attributes. Fine bins are grouped
 * by (date, report bin of day). Arrivals and departures are summed over each group. Occupancy is averaged: it is an
 * instantaneous level sampled at fine resolution, so the mean of the samples approximates the time-weighted occupancy
 * level over the report bin.
 *
 * Fine bins follow each other in time, so the members of each group are contiguous and a single pass suffices.
 */
public class RollupAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(RollupAggregator.class);

    private final int reportBinMinutes;

    public RollupAggregator (int reportBinMinutes) {
        checkArgument(reportBinMinutes > 0, "Report bin width must be positive.");
        this.reportBinMinutes = reportBinMinutes;
    }

    public RollupTable rollup (FineGridMatrix matrix) {
        checkArgument(reportBinMinutes % matrix.binMinutes == 0,
                "Report bin width %s is not a multiple of fine bin width %s.", reportBinMinutes, matrix.binMinutes);
        int ratio = reportBinMinutes / matrix.binMinutes;
        double[] arrivals = matrix.values(Measure.ARRIVALS);
        double[] departures = matrix.values(Measure.DEPARTURES);
        double[] occupancy = matrix.values(Measure.OCCUPANCY);

        List<RollupRow> rows = new ArrayList<>();
        LocalDate groupDate = null;
        int groupBin = -1;
        double arrSum = 0;
        double depSum = 0;
        double occSum = 0;
        int groupSize = 0;
        for (int b = 0; b < matrix.nBins(); b++) {
            LocalDateTime binStart = matrix.binStart(b);
            LocalDate date = binStart.toLocalDate();
            int coarseBinOfDay = TimeBinIndexer.binOfDay(binStart, matrix.binMinutes) / ratio;
            if (groupSize > 0 && (!date.equals(groupDate) || coarseBinOfDay != groupBin)) {
                rows.add(makeRow(matrix, groupDate, groupBin, arrSum, depSum, occSum / groupSize));
                arrSum = depSum = occSum = 0;
                groupSize = 0;
            }
            groupDate = date;
            groupBin = coarseBinOfDay;
            arrSum += arrivals[b];
            depSum += departures[b];
            occSum += occupancy[b];
            groupSize += 1;
        }
        if (groupSize > 0) {
            rows.add(makeRow(matrix, groupDate, groupBin, arrSum, depSum, occSum / groupSize));
        }
        LOG.debug("cat {} rolled {} fine bins of {} minutes into {} report bins of {} minutes",
                matrix.category, matrix.nBins(), matrix.binMinutes, rows.size(), reportBinMinutes);
        return new RollupTable(matrix.category, reportBinMinutes, rows);
    }

    private RollupRow makeRow (FineGridMatrix matrix, LocalDate date, int coarseBinOfDay,
                               double arrivals, double departures, double occupancy) {
        LocalDateTime datetime = date.atStartOfDay().plusMinutes((long) coarseBinOfDay * reportBinMinutes);
        return new RollupRow(matrix.category, datetime, reportBinMinutes, arrivals, departures, occupancy);
    }

}

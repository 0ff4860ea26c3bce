package com.conveyal.hills.binning;

import com.conveyal.hills.model.AnalysisWindow;
import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.EdgeBinMode;
import com.conveyal.hills.model.RecordRelationship;
import com.conveyal.hills.model.StopRecord;
import com.google.common.primitives.Ints;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkState;

/**
 * Scatters the stays of one category into a dense fine grid covering the analysis window. Each accumulated stay adds
 * its clipped occupancy increment into the bins it covers, one arrival to the bin containing its entry instant, and one
 * departure to the bin containing its exit instant.
 *
 * Arrivals are only counted for stays whose true arrival instant lies inside the window (inner and right stays), and
 * departures only for stays whose true departure lies inside the window (inner and left stays). A stay that was
 * already present when the window opened did not arrive during the analysis, even though it contributes occupancy to
 * the first bin. Counting by relationship type rather than by clipped bin keeps this exact in the corner case where a
 * right stay departs after the window end but before the end of the last bin.
 *
 * Instances hold no mutable state, so the same accumulator can process several categories concurrently.
 */
public class BinScatterAccumulator {

    private static final Logger LOG = LoggerFactory.getLogger(BinScatterAccumulator.class);

    private final AnalysisWindow window;

    private final int binMinutes;

    private final int nBins;

    private final EdgeBinMode edgeBinMode;

    public BinScatterAccumulator (AnalysisWindow window, int binMinutes, EdgeBinMode edgeBinMode) {
        this.window = window;
        this.binMinutes = binMinutes;
        this.nBins = window.binCount(binMinutes);
        this.edgeBinMode = edgeBinMode;
    }

    public CategoryAccumulation accumulate (CategoryKey category, List<StopRecord> records) {
        FineGridMatrix matrix = new FineGridMatrix(category, window.start, binMinutes, nBins);
        OccupancyIncrementBuilder builder = new OccupancyIncrementBuilder(window.start, binMinutes, edgeBinMode);
        BoundaryAdjuster adjuster = new BoundaryAdjuster(nBins);
        TIntList arrivalBins = new TIntArrayList();
        TIntList departureBins = new TIntArrayList();

        for (StopRecord record : records) {
            RecordRelationship relationship = RecordClassifier.classify(record.entry, record.exit, window);
            adjuster.count(relationship);
            if (!relationship.isAccumulated()) {
                continue;
            }
            OccupancyIncrement increment = adjuster.clip(
                    builder.buildWithinGrid(record.entry, record.exit, record.weight, relationship, nBins));
            scatter(matrix.occupancy, increment);
            if (relationship.arrivesInWindow()) {
                arrivalBins.add(Ints.checkedCast(increment.rawEntryBin));
            }
            if (relationship.departsInWindow()) {
                departureBins.add(Ints.checkedCast(increment.rawExitBin));
            }
        }
        histogram(matrix.arrivals, arrivalBins);
        histogram(matrix.departures, departureBins);

        CategoryAccumulation accumulation = new CategoryAccumulation(matrix, adjuster.relationshipCounts());
        LOG.info("cat {} record relationships {}", category, accumulation.relationshipCounts);
        if (LOG.isDebugEnabled() && !arrivalBins.isEmpty()) {
            LOG.debug("cat {} min of entry bin = {}, max of exit bin = {}, nBins = {}",
                    category, arrivalBins.min(), departureBins.isEmpty() ? "n/a" : departureBins.max(), nBins);
        }
        return accumulation;
    }

    /** Element-wise add of the increment into the occupancy array, starting at the increment's entry bin. */
    private static void scatter (double[] occupancy, OccupancyIncrement increment) {
        int pos = increment.entryBin;
        checkState(pos >= 0 && pos + increment.values.length <= occupancy.length,
                "Increment at bin %s of length %s overruns grid of %s bins.",
                pos, increment.values.length, occupancy.length);
        for (int i = 0; i < increment.values.length; i++) {
            occupancy[pos + i] += increment.values[i];
        }
    }

    private static void histogram (double[] counts, TIntList bins) {
        for (int i = 0; i < bins.size(); i++) {
            int bin = bins.get(i);
            checkState(bin >= 0 && bin < counts.length, "Event bin %s outside grid of %s bins.", bin, counts.length);
            counts[bin] += 1;
        }
    }

    /**
     * Element-wise sum of the category matrices to produce the synthetic total. The reduction happens after every
     * category has been accumulated, in the order supplied.
     */
    public static FineGridMatrix sumCategories (List<FineGridMatrix> categoryMatrices) {
        return FineGridMatrix.sum(CategoryKey.TOTAL, categoryMatrices);
    }

    public int nBins () {
        return nBins;
    }

    public int binMinutes () {
        return binMinutes;
    }

}

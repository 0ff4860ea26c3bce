package com.conveyal.hills.binning;

import com.conveyal.hills.model.EdgeBinMode;
import com.conveyal.hills.model.RecordRelationship;
import com.conveyal.hills.util.TimeUtils;
import com.google.common.primitives.Ints;

import java.time.LocalDateTime;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Builds the vector of per-bin occupancy contributions for a single stay: a fraction of the weight in the first and
 * last bins touched, and the full weight in every bin in between, which the stay occupies completely.
 *
 * Bin indexes are computed against the fine grid without clipping to the window. The plain build method returns the
 * vector over every bin the stay touches, which the BoundaryAdjuster trims afterward. buildWithinGrid only allocates the
 * bins of a grid of known size, so a stay with an entry or exit far from the window costs no more than one covering
 * the whole grid.
 */
public class OccupancyIncrementBuilder {

    private final LocalDateTime origin;

    private final int binMinutes;

    private final long binNanos;

    private final EdgeBinMode edgeBinMode;

    public OccupancyIncrementBuilder (LocalDateTime origin, int binMinutes, EdgeBinMode edgeBinMode) {
        checkArgument(binMinutes > 0, "Bin width must be positive.");
        this.origin = origin;
        this.binMinutes = binMinutes;
        this.binNanos = binMinutes * 60L * 1_000_000_000L;
        this.edgeBinMode = edgeBinMode;
    }

    /**
     * The fraction of the entry bin occupied. The occupied span ends at the earlier of the exit and the bin's right edge,
     * so when the stay begins and ends in the same bin this alone equals (exit - entry) / binWidth.
     */
    public double entryFraction (LocalDateTime entry, LocalDateTime exit, long entryBin) {
        if (edgeBinMode == EdgeBinMode.WHOLE_BIN) {
            return 1.0;
        }
        LocalDateTime rightEdge = TimeBinIndexer.binStart(origin, entryBin + 1, binMinutes);
        LocalDateTime spanEnd = exit.isBefore(rightEdge) ? exit : rightEdge;
        double fraction = (double) TimeUtils.nanosBetween(entry, spanEnd) / binNanos;
        checkState(fraction >= 0 && fraction <= 1,
                "Entry bin fraction %s outside [0,1] for stay %s -> %s.", fraction, entry, exit);
        return fraction;
    }

    /** The fraction of the exit bin occupied. Only meaningful when the stay touches more than one bin. */
    public double exitFraction (LocalDateTime entry, LocalDateTime exit, long exitBin) {
        if (edgeBinMode == EdgeBinMode.WHOLE_BIN) {
            return 1.0;
        }
        LocalDateTime leftEdge = TimeBinIndexer.binStart(origin, exitBin, binMinutes);
        LocalDateTime spanStart = entry.isAfter(leftEdge) ? entry : leftEdge;
        double fraction = (double) TimeUtils.nanosBetween(spanStart, exit) / binNanos;
        checkState(fraction >= 0 && fraction <= 1,
                "Exit bin fraction %s outside [0,1] for stay %s -> %s.", fraction, entry, exit);
        return fraction;
    }

    /**
     * Build the unclipped increment for one stay. The stay must not be backwards: the caller classifies records first
     * and only builds increments for the relationship types that are accumulated.
     */
    public OccupancyIncrement build (LocalDateTime entry, LocalDateTime exit, double weight,
                                     RecordRelationship relationship) {
        return build(entry, exit, weight, relationship, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    /**
     * Build the increment for one stay restricted to bins 0 through nBins - 1. The edge fractions are still computed on
     * the bins the entry and exit actually fall in, and are only present when those bins are on the grid.
     */
    public OccupancyIncrement buildWithinGrid (LocalDateTime entry, LocalDateTime exit, double weight,
                                               RecordRelationship relationship, int nBins) {
        checkArgument(nBins > 0, "Grid must contain at least one bin.");
        return build(entry, exit, weight, relationship, 0, nBins - 1);
    }

    private OccupancyIncrement build (LocalDateTime entry, LocalDateTime exit, double weight,
                                      RecordRelationship relationship, long minBin, long maxBin) {
        checkArgument(!exit.isBefore(entry), "Cannot build an occupancy increment for a backwards stay.");
        long rawEntryBin = TimeBinIndexer.binIndex(entry, origin, binMinutes);
        long rawExitBin = TimeBinIndexer.binIndex(exit, origin, binMinutes);
        long from = Math.max(rawEntryBin, minBin);
        long to = Math.min(rawExitBin, maxBin);
        checkArgument(from <= to, "Stay %s -> %s does not touch bins %s through %s.", entry, exit, minBin, maxBin);
        checkArgument(to - from < Integer.MAX_VALUE, "Stay %s -> %s covers too many bins to build.", entry, exit);
        double[] values = new double[(int) (to - from + 1)];
        Arrays.fill(values, weight);
        if (rawExitBin <= maxBin && rawExitBin > rawEntryBin) {
            values[values.length - 1] = exitFraction(entry, exit, rawExitBin) * weight;
        }
        if (rawEntryBin >= minBin) {
            values[0] = entryFraction(entry, exit, rawEntryBin) * weight;
        }
        return new OccupancyIncrement(relationship, rawEntryBin, rawExitBin,
                Ints.checkedCast(from), Ints.checkedCast(to), values);
    }

    public int binMinutes () {
        return binMinutes;
    }

}

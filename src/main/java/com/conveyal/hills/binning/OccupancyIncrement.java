package com.conveyal.hills.binning;

import com.conveyal.hills.model.RecordRelationship;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The occupancy one stay contributes to a contiguous run of bins, starting at entryBin. The raw bins are those the
 * entry and exit instants actually fall in, before any clipping to the analysis window; entryBin and exitBin are the
 * bins the values array currently covers. For a stay that is entirely inside the window the two pairs are equal. Raw
 * bins may lie arbitrarily far outside the grid, for instance for open stays recorded with an exit of 9999-12-31.
 */
public class OccupancyIncrement {

    public final RecordRelationship relationship;

    public final long rawEntryBin;

    public final long rawExitBin;

    public final int entryBin;

    public final int exitBin;

    /** Per-bin occupancy contributions, one element for each bin from entryBin through exitBin inclusive. */
    final double[] values;

    OccupancyIncrement (RecordRelationship relationship, long rawEntryBin, long rawExitBin,
                        int entryBin, int exitBin, double[] values) {
        checkArgument(values.length == exitBin - entryBin + 1,
                "Increment of length %s does not match bins %s through %s.", values.length, entryBin, exitBin);
        this.relationship = relationship;
        this.rawEntryBin = rawEntryBin;
        this.rawExitBin = rawExitBin;
        this.entryBin = entryBin;
        this.exitBin = exitBin;
        this.values = values;
    }

    public int length () {
        return values.length;
    }

    /** The contribution to the i-th bin covered, counting from entryBin. */
    public double value (int i) {
        return values[i];
    }

    /** The total occupancy in bin units carried by this increment. */
    public double sum () {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }

    public double[] valuesCopy () {
        return values.clone();
    }

}

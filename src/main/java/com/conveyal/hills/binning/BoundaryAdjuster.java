package com.conveyal.hills.binning;

import com.conveyal.hills.model.RecordRelationship;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Clips occupancy increments for stays that begin before or end after the analysis window, re-basing their bins into
 * [0, nBins - 1]. The portion of a stay outside the window is dropped rather than piled up in the edge bins.
 * Also tallies how many records of each relationship type it has seen, including the backwards and none records that
 * never reach the clipping step.
 *
 * One instance serves one category and is not shared between threads.
 */
public class BoundaryAdjuster {

    private final int nBins;

    private final Map<RecordRelationship, Integer> counts = new EnumMap<>(RecordRelationship.class);

    public BoundaryAdjuster (int nBins) {
        checkArgument(nBins > 0, "Grid must contain at least one bin.");
        this.nBins = nBins;
    }

    /** Record that a stay of the given type was seen. Call once per record, whether or not it is accumulated. */
    public void count (RecordRelationship relationship) {
        counts.merge(relationship, 1, Integer::sum);
    }

    /**
     * Clip the increment to the grid according to its relationship type. Inner increments are returned unchanged.
     * Left increments lose the elements before bin zero, right increments lose the elements after the last bin, and
     * outer increments lose both.
     */
    public OccupancyIncrement clip (OccupancyIncrement increment) {
        RecordRelationship relationship = increment.relationship;
        checkArgument(relationship.isAccumulated(), "Records of type %s are not accumulated.", relationship.label());
        int entryBin = increment.entryBin;
        int exitBin = increment.exitBin;
        int from = 0;
        int to = increment.values.length;
        if (relationship == RecordRelationship.LEFT || relationship == RecordRelationship.OUTER) {
            // Drop the elements covering the time before the window start.
            from = Math.max(0, -entryBin);
            entryBin = Math.max(0, entryBin);
        }
        if (relationship == RecordRelationship.RIGHT || relationship == RecordRelationship.OUTER) {
            // Drop the elements covering the time after the last bin of the grid.
            int overhang = Math.max(0, exitBin - (nBins - 1));
            to -= overhang;
            exitBin = Math.min(exitBin, nBins - 1);
        }
        checkState(entryBin >= 0 && exitBin < nBins && entryBin <= exitBin,
                "Clipped bins %s through %s do not fit in a grid of %s bins.", entryBin, exitBin, nBins);
        if (from == 0 && to == increment.values.length) {
            return increment;
        }
        double[] clipped = Arrays.copyOfRange(increment.values, from, to);
        return new OccupancyIncrement(relationship, increment.rawEntryBin, increment.rawExitBin,
                entryBin, exitBin, clipped);
    }

    /** The number of records of the given type seen so far. */
    public int countOf (RecordRelationship relationship) {
        return counts.getOrDefault(relationship, 0);
    }

    /** A copy of the tally of records seen so far, keyed by relationship type. Types never seen are absent. */
    public Map<RecordRelationship, Integer> relationshipCounts () {
        Map<RecordRelationship, Integer> copy = new EnumMap<>(RecordRelationship.class);
        copy.putAll(counts);
        return copy;
    }

}

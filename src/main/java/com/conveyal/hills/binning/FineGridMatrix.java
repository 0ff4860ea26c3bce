package com.conveyal.hills.binning;

import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.Measure;

import java.time.LocalDateTime;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Arrivals, departures and occupancy for one category on the fine accumulation grid: three parallel arrays with one
 * element per bin, bin zero beginning at the analysis window start. The arrays are filled in place during a single
 * accumulation pass by the BinScatterAccumulator and must not be modified after that. Outside this package they are
 * only exposed through copies.
 */
public class FineGridMatrix {

    public final CategoryKey category;

    public final LocalDateTime origin;

    public final int binMinutes;

    final double[] arrivals;

    final double[] departures;

    final double[] occupancy;

    FineGridMatrix (CategoryKey category, LocalDateTime origin, int binMinutes, int nBins) {
        checkArgument(nBins > 0, "Grid must contain at least one bin.");
        this.category = category;
        this.origin = origin;
        this.binMinutes = binMinutes;
        this.arrivals = new double[nBins];
        this.departures = new double[nBins];
        this.occupancy = new double[nBins];
    }

    public int nBins () {
        return occupancy.length;
    }

    public LocalDateTime binStart (int bin) {
        return TimeBinIndexer.binStart(origin, bin, binMinutes);
    }

    public double value (Measure measure, int bin) {
        return array(measure)[bin];
    }

    /** A copy of the values of the given measure, one per bin. */
    public double[] values (Measure measure) {
        return array(measure).clone();
    }

    public double total (Measure measure) {
        double sum = 0;
        for (double v : array(measure)) {
            sum += v;
        }
        return sum;
    }

    double[] array (Measure measure) {
        switch (measure) {
            case ARRIVALS: return arrivals;
            case DEPARTURES: return departures;
            case OCCUPANCY: return occupancy;
            default: throw new IllegalArgumentException("Unknown measure " + measure);
        }
    }

    /**
     * Element-wise sum of several matrices on the same grid. The parts are added in the order given, so callers that
     * need reproducible floating point results should supply them in a fixed order.
     */
    public static FineGridMatrix sum (CategoryKey category, List<FineGridMatrix> parts) {
        checkArgument(!parts.isEmpty(), "Cannot sum an empty list of matrices.");
        FineGridMatrix first = parts.get(0);
        FineGridMatrix total = new FineGridMatrix(category, first.origin, first.binMinutes, first.nBins());
        for (FineGridMatrix part : parts) {
            checkArgument(part.origin.equals(first.origin) && part.binMinutes == first.binMinutes
                    && part.nBins() == first.nBins(), "All matrices in a sum must share the same grid.");
            for (Measure measure : Measure.values()) {
                double[] source = part.array(measure);
                double[] target = total.array(measure);
                for (int b = 0; b < target.length; b++) {
                    target[b] += source[b];
                }
            }
        }
        return total;
    }

}

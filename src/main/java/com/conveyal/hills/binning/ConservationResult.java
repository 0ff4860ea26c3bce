package com.conveyal.hills.binning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binned totals for one category side by side with the same totals computed directly from the stop records, along with
 * any warnings raised by the comparison. Occupancy is expressed in bin units (occupied time divided by bin width).
 */
public class ConservationResult {

    public final String category;

    public final double arrivalsBinned;

    public final long arrivalsExpected;

    public final double departuresBinned;

    public final long departuresExpected;

    public final double occupancyBinned;

    public final double occupancyExpected;

    /** Relative difference of binned and expected occupancy, or NaN when nothing was expected. */
    public final double occupancyRelativeError;

    public final List<String> warnings;

    ConservationResult (String category, double arrivalsBinned, long arrivalsExpected,
                        double departuresBinned, long departuresExpected,
                        double occupancyBinned, double occupancyExpected, double occupancyRelativeError,
                        List<String> warnings) {
        this.category = category;
        this.arrivalsBinned = arrivalsBinned;
        this.arrivalsExpected = arrivalsExpected;
        this.departuresBinned = departuresBinned;
        this.departuresExpected = departuresExpected;
        this.occupancyBinned = occupancyBinned;
        this.occupancyExpected = occupancyExpected;
        this.occupancyRelativeError = occupancyRelativeError;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public boolean passed () {
        return warnings.isEmpty();
    }

}

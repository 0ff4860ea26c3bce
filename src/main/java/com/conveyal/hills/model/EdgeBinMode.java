package com.conveyal.hills.model;

/**
 * How occupancy is credited in the first and last bin touched by a stay. FRACTIONAL credits the fraction of the bin
 * actually occupied. WHOLE_BIN credits the entire bin, which is coarser but matches some legacy reporting conventions.
 */
public enum EdgeBinMode {

    FRACTIONAL, WHOLE_BIN;

    /** Accepts the enum names in any case, plus the numeric codes 1 (fractional) and 2 (whole bin). */
    public static EdgeBinMode parse (String value) {
        String normalized = value.trim().toLowerCase().replace('-', '_');
        switch (normalized) {
            case "1":
            case "fractional":
                return FRACTIONAL;
            case "2":
            case "whole_bin":
            case "wholebin":
            case "entire":
                return WHOLE_BIN;
            default:
                throw new HillsException("Unrecognized edge bin mode: " + value);
        }
    }

}

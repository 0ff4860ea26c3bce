package com.conveyal.hills.summary;

/** How rolled-up rows are grouped before statistics are computed. */
public enum StatisticsMode {

    /** One group per category, day of week and bin of day, capturing the weekly pattern. */
    NONSTATIONARY,

    /** One group per category spanning the whole analysis window. */
    STATIONARY;

    public String label () {
        return name().toLowerCase();
    }

}

package com.conveyal.hills.model;

/**
 * How a stop record's interval overlaps the analysis window. Only the first four types contribute to occupancy.
 *
 * <pre>
 *   inner:        |-----window-----|        left:          |-----window-----|
 *                    |--stay--|                       |--stay--|
 *
 *   right:        |-----window-----|        outer:     |-----window-----|
 *                              |--stay--|           |--------stay---------|
 * </pre>
 *
 * A backwards record has its exit before its entry. A none record does not overlap the window at all.
 */
public enum RecordRelationship {

    INNER, LEFT, RIGHT, OUTER, BACKWARDS, NONE;

    /** True if records of this type contribute occupancy to the binned matrix. */
    public boolean isAccumulated () {
        return this == INNER || this == LEFT || this == RIGHT || this == OUTER;
    }

    /** True if the arrival instant of records of this type lies within the analysis window. */
    public boolean arrivesInWindow () {
        return this == INNER || this == RIGHT;
    }

    /** True if the departure instant of records of this type lies within the analysis window. */
    public boolean departsInWindow () {
        return this == INNER || this == LEFT;
    }

    /** Lower case name as used in log messages and exported diagnostics. */
    public String label () {
        return name().toLowerCase();
    }

}

package com.conveyal.hills.model;

/** The three quantities tracked for every time bin. */
public enum Measure {

    OCCUPANCY("occupancy"), ARRIVALS("arrivals"), DEPARTURES("departures");

    public final String columnName;

    Measure (String columnName) {
        this.columnName = columnName;
    }

}

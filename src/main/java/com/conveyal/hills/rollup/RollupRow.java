package com.conveyal.hills.rollup;

import com.conveyal.hills.binning.TimeBinIndexer;
import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.Measure;
import com.conveyal.hills.util.TimeUtils;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Arrivals, departures and occupancy for one category in one report bin, with the calendar attributes of the bin's
 * starting instant.
 */
public class RollupRow {

    public final CategoryKey category;

    public final LocalDateTime datetime;

    public final double arrivals;

    public final double departures;

    public final double occupancy;

    /** Monday is 0. */
    public final int dayOfWeek;

    public final String dowName;

    public final int binOfDay;

    public final String binOfDayStr;

    public final int binOfWeek;

    public RollupRow (CategoryKey category, LocalDateTime datetime, int binMinutes,
                      double arrivals, double departures, double occupancy) {
        this.category = category;
        this.datetime = datetime;
        this.arrivals = arrivals;
        this.departures = departures;
        this.occupancy = occupancy;
        this.dayOfWeek = TimeUtils.dayOfWeek(datetime);
        this.dowName = TimeUtils.dayOfWeekName(datetime);
        this.binOfDay = TimeBinIndexer.binOfDay(datetime, binMinutes);
        this.binOfDayStr = TimeUtils.minutesToString(TimeUtils.minuteOfDay(datetime));
        this.binOfWeek = TimeBinIndexer.binOfWeek(datetime, binMinutes);
    }

    public double get (Measure measure) {
        switch (measure) {
            case ARRIVALS: return arrivals;
            case DEPARTURES: return departures;
            case OCCUPANCY: return occupancy;
            default: throw new IllegalArgumentException("Unknown measure " + measure);
        }
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RollupRow that = (RollupRow) o;
        return Double.compare(arrivals, that.arrivals) == 0
                && Double.compare(departures, that.departures) == 0
                && Double.compare(occupancy, that.occupancy) == 0
                && binOfWeek == that.binOfWeek
                && category.equals(that.category)
                && datetime.equals(that.datetime);
    }

    @Override
    public int hashCode () {
        return Objects.hash(category, datetime, arrivals, departures, occupancy);
    }

    @Override
    public String toString () {
        return String.format("%s %s arr=%.4f dep=%.4f occ=%.4f", category, datetime, arrivals, departures, occupancy);
    }

}

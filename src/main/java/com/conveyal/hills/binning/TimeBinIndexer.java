package com.conveyal.hills.binning;

import com.conveyal.hills.util.TimeUtils;

import java.time.Duration;
import java.time.LocalDateTime;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Pure arithmetic mapping timestamps to integer bin indexes. Bins are closed on the left: an instant exactly on a bin
 * boundary belongs to the bin starting at that boundary.
 */
public abstract class TimeBinIndexer {

    /**
     * The index of the bin containing the given instant, counting bins of the given width from the origin. No clamping
     * is performed: instants before the origin give negative indexes and instants far after it give indexes past the
     * end of any grid. Callers must detect and clip these.
     */
    public static long binIndex (LocalDateTime instant, LocalDateTime origin, int binMinutes) {
        checkArgument(binMinutes > 0, "Bin width must be positive.");
        // Duration.getSeconds() is floored for negative durations, with the positive nanosecond part held separately.
        long seconds = Duration.between(origin, instant).getSeconds();
        return Math.floorDiv(seconds, binMinutes * 60L);
    }

    /** The instant at which the bin with the given index begins. */
    public static LocalDateTime binStart (LocalDateTime origin, long bin, int binMinutes) {
        return origin.plusMinutes(bin * binMinutes);
    }

    /** Index of the bin within its day: minutes since midnight integer-divided by the bin width. */
    public static int binOfDay (LocalDateTime instant, int binMinutes) {
        checkArgument(binMinutes > 0, "Bin width must be positive.");
        return TimeUtils.minuteOfDay(instant) / binMinutes;
    }

    /** Index of the bin within its week, weeks beginning at midnight on Monday. */
    public static int binOfWeek (LocalDateTime instant, int binMinutes) {
        checkArgument(binMinutes > 0, "Bin width must be positive.");
        int minutes = TimeUtils.dayOfWeek(instant) * TimeUtils.MINUTES_PER_DAY + TimeUtils.minuteOfDay(instant);
        return minutes / binMinutes;
    }

}

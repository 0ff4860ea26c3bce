package com.conveyal.hills.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * The closed-open time range [start, end) over which occupancy statistics are computed. The start is the origin of all
 * bin index arithmetic. The number of bins covering the window at a given width is floor((end - start) / width) + 1,
 * so the last bin extends slightly past the end unless the end falls one second short of a bin boundary, which is
 * exactly what {@link #ofDates(LocalDate, LocalDate)} arranges.
 */
public class AnalysisWindow {

    public final LocalDateTime start;

    public final LocalDateTime end;

    public AnalysisWindow (LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new HillsException("Analysis window start and end must both be specified.");
        }
        if (!end.isAfter(start)) {
            throw new HillsException(String.format("End of analysis (%s) must be after start of analysis (%s).", end, start));
        }
        this.start = start;
        this.end = end;
    }

    /**
     * A window covering whole days, from midnight at the start of the first date to the last second of the last date.
     * The two dates may be the same, giving a one-day window.
     */
    public static AnalysisWindow ofDates (LocalDate startDate, LocalDate endDate) {
        return new AnalysisWindow(startDate.atStartOfDay(), endDate.atStartOfDay().plusSeconds(86399));
    }

    /** Number of bins of the given width needed to cover the window, starting at the window start. */
    public int binCount (int binMinutes) {
        long seconds = Duration.between(start, end).getSeconds();
        return Math.toIntExact(Math.floorDiv(seconds, binMinutes * 60L) + 1);
    }

    /** The instant at which the last of the {@link #binCount(int)} bins ends. This is at or after the window end. */
    public LocalDateTime gridEnd (int binMinutes) {
        return start.plusMinutes((long) binCount(binMinutes) * binMinutes);
    }

    /** True if the instant lies within the closed-open window. */
    public boolean contains (LocalDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public String toString () {
        return String.format("[%s, %s)", start, end);
    }

}

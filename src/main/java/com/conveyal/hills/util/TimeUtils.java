package com.conveyal.hills.util;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.TextStyle;
import java.util.Locale;

public abstract class TimeUtils {

    public static final int MINUTES_PER_DAY = 1440;

    /** Format minutes after midnight as HH:mm. 1440 is rendered as 24:00 so a bin ending at midnight reads naturally. */
    public static String minutesToString (int minutesOfDay) {
        int min = minutesOfDay % 60;
        int hour = minutesOfDay / 60;
        return String.format("%02d:%02d", hour, min);
    }

    /** Minutes elapsed since midnight, ignoring seconds. */
    public static int minuteOfDay (LocalDateTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    /** Monday-based day of week, 0 for Monday through 6 for Sunday. */
    public static int dayOfWeek (LocalDateTime time) {
        return time.getDayOfWeek().getValue() - 1;
    }

    /** Three letter English day name, e.g. Mon. */
    public static String dayOfWeekName (LocalDateTime time) {
        return time.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    /** Nanoseconds from one instant to another, negative if the second precedes the first. */
    public static long nanosBetween (LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toNanos();
    }

    /** Fractional seconds from one instant to another, negative if the second precedes the first. */
    public static double secondsBetween (LocalDateTime from, LocalDateTime to) {
        Duration duration = Duration.between(from, to);
        return duration.getSeconds() + duration.getNano() / 1e9;
    }

    /** Fractional hours from one instant to another. */
    public static double hoursBetween (LocalDateTime from, LocalDateTime to) {
        return secondsBetween(from, to) / 3600;
    }

}

package com.conveyal.hills.model;

import java.time.Duration;

/** Time unit in which lengths of stay are reported. */
public enum LengthOfStayUnit {

    DAYS(86400), HOURS(3600), MINUTES(60), SECONDS(1);

    public final int secondsPerUnit;

    LengthOfStayUnit (int secondsPerUnit) {
        this.secondsPerUnit = secondsPerUnit;
    }

    /** Convert a duration to a fractional number of this unit. */
    public double convert (Duration duration) {
        double seconds = duration.getSeconds() + duration.getNano() / 1e9;
        return seconds / secondsPerUnit;
    }

    public static LengthOfStayUnit parse (String value) {
        switch (value.trim().toLowerCase()) {
            case "days":
            case "day":
                return DAYS;
            case "hours":
            case "hour":
            case "hr":
            case "h":
                return HOURS;
            case "minutes":
            case "minute":
            case "min":
            case "m":
                return MINUTES;
            case "seconds":
            case "second":
            case "sec":
                return SECONDS;
            default:
                throw new HillsException(value + " is not a valid time unit code.");
        }
    }

}

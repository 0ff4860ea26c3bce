package com.conveyal.hills.model;

import java.time.LocalDateTime;

/**
 * One entity's stay: the instant it arrived, the instant it departed, and optionally the category it belongs to and the
 * weight it contributes to occupancy. No ordering is enforced between entry and exit. A record whose exit precedes its
 * entry is a legal input that will be classified as backwards and excluded from accumulation.
 *
 * The entry or exit may be null when the source data had no timestamp. Such records are filtered or adjusted before
 * they reach the binning engine.
 */
public class StopRecord {

    public static final double DEFAULT_WEIGHT = 1.0;

    public final LocalDateTime entry;

    public final LocalDateTime exit;

    /** Null when the record is not categorized. */
    public final String category;

    public final double weight;

    public StopRecord (LocalDateTime entry, LocalDateTime exit, String category, double weight) {
        this.entry = entry;
        this.exit = exit;
        this.category = category;
        this.weight = weight;
    }

    public StopRecord (LocalDateTime entry, LocalDateTime exit, String category) {
        this(entry, exit, category, DEFAULT_WEIGHT);
    }

    public StopRecord (LocalDateTime entry, LocalDateTime exit) {
        this(entry, exit, null, DEFAULT_WEIGHT);
    }

    public boolean hasCategory () {
        return category != null && !category.isEmpty();
    }

    /** @return a copy of this record with its exit replaced, used when filling in censored departures. */
    public StopRecord withExit (LocalDateTime newExit) {
        return new StopRecord(entry, newExit, category, weight);
    }

    @Override
    public String toString () {
        return String.format("StopRecord[%s -> %s, category=%s, weight=%s]", entry, exit, category, weight);
    }

}

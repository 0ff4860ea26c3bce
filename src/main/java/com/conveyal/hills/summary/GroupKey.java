package com.conveyal.hills.summary;

import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.rollup.RollupRow;

import java.util.Comparator;
import java.util.Objects;

/**
 * Composite grouping key for summary statistics. Nonstationary keys carry the day of week and bin of day, stationary
 * keys carry only the category and hold -1 in the calendar fields.
 */
public final class GroupKey implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator
            .comparing((GroupKey k) -> k.category)
            .thenComparingInt(k -> k.dayOfWeek)
            .thenComparingInt(k -> k.binOfDay);

    public final CategoryKey category;

    public final int dayOfWeek;

    public final String dowName;

    public final int binOfDay;

    public final String binOfDayStr;

    private GroupKey (CategoryKey category, int dayOfWeek, String dowName, int binOfDay, String binOfDayStr) {
        this.category = category;
        this.dayOfWeek = dayOfWeek;
        this.dowName = dowName;
        this.binOfDay = binOfDay;
        this.binOfDayStr = binOfDayStr;
    }

    public static GroupKey nonstationary (RollupRow row) {
        return new GroupKey(row.category, row.dayOfWeek, row.dowName, row.binOfDay, row.binOfDayStr);
    }

    public static GroupKey stationary (CategoryKey category) {
        return new GroupKey(category, -1, null, -1, null);
    }

    public static GroupKey of (StatisticsMode mode, RollupRow row) {
        return mode == StatisticsMode.NONSTATIONARY ? nonstationary(row) : stationary(row.category);
    }

    public boolean isStationary () {
        return dayOfWeek < 0;
    }

    @Override
    public int compareTo (GroupKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GroupKey that = (GroupKey) o;
        return dayOfWeek == that.dayOfWeek && binOfDay == that.binOfDay && category.equals(that.category);
    }

    @Override
    public int hashCode () {
        return Objects.hash(category, dayOfWeek, binOfDay);
    }

    @Override
    public String toString () {
        if (isStationary()) return category.toString();
        return String.format("%s %s %s", category, dowName, binOfDayStr);
    }

}

package com.conveyal.hills.model;

import java.util.Objects;

/**
 * Identifies one partition of the stop records. Real categories come from the data. The synthetic {@link #TOTAL} key
 * holds either the sum of all categories or, when the data carries no categories at all, the single implicit
 * partition containing every record. Keeping the synthetic flag separate from the name means a real category that
 * happens to be called "total" can never collide with the synthetic one.
 *
 * Keys sort with real categories first in name order, followed by the synthetic total.
 */
public final class CategoryKey implements Comparable<CategoryKey> {

    public static final CategoryKey TOTAL = new CategoryKey("total", true);

    public final String name;

    public final boolean synthetic;

    private CategoryKey (String name, boolean synthetic) {
        this.name = Objects.requireNonNull(name);
        this.synthetic = synthetic;
    }

    public static CategoryKey of (String name) {
        return new CategoryKey(name, false);
    }

    @Override
    public int compareTo (CategoryKey other) {
        if (synthetic != other.synthetic) {
            return synthetic ? 1 : -1;
        }
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CategoryKey that = (CategoryKey) o;
        return synthetic == that.synthetic && name.equals(that.name);
    }

    @Override
    public int hashCode () {
        return Objects.hash(name, synthetic);
    }

    @Override
    public String toString () {
        return name;
    }

}

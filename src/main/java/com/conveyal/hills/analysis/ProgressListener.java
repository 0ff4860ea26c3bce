package com.conveyal.hills.analysis;

/**
 * Simple callbacks allowing a long running analysis to report on its progress. Implementations must be fast and
 * thread safe, as increment may be called from several worker threads.
 */
public interface ProgressListener {

    /**
     * Call this method once at the beginning of a new task, specifying how many sub-units of work will be performed.
     * If totalElements is zero or negative, any previously set total number of elements remains unchanged.
     */
    void beginTask(String description, int totalElements);

    /** Call this method to report that N units of work have been performed. */
    void increment(int n);

    /** Call this method to report that one unit of work has been performed. */
    default void increment () {
        increment(1);
    }

}

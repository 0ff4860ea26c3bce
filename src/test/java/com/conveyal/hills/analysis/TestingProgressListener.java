package com.conveyal.hills.analysis;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A ProgressListener for use in tests, which checks that a task was begun and that every element was reported done.
 * Increments may arrive from worker threads.
 */
public class TestingProgressListener implements ProgressListener {

    private volatile String description;
    private final AtomicInteger taskCount = new AtomicInteger();
    private volatile int totalElements = 0;
    private final AtomicInteger elementsCompleted = new AtomicInteger();

    @Override
    public void beginTask (String description, int totalElements) {
        this.description = description;
        this.totalElements = totalElements;
        taskCount.incrementAndGet();
    }

    @Override
    public void increment (int n) {
        elementsCompleted.addAndGet(n);
    }

    public void assertUsedCorrectly (int expectedElements) {
        assertNotNull(description);
        assertTrue(taskCount.get() > 0);
        assertEquals(expectedElements, totalElements);
        assertEquals(totalElements, elementsCompleted.get());
    }

}

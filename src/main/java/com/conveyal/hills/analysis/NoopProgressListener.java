package com.conveyal.hills.analysis;

/**
 * For callers that do not follow progress, to avoid littering the pipeline with null checks we have this trivial
 * ProgressListener implementation that does nothing.
 */
public class NoopProgressListener implements ProgressListener {

    @Override
    public void beginTask(String description, int totalElements) { }

    @Override
    public void increment() { }

    @Override
    public void increment (int n) { }

}

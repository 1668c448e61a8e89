package com.hcltech.composable.common.metrics;

/**
 * Minimal façade for emitting numeric metrics.
 * <p>Counters and histograms share the same low-cardinality naming space.</p>
 */
public interface Metrics {

    /** Increment a named counter by 1. */
    void increment(String name);

    /** Record a value in a histogram (depths, sizes). */
    void histogram(String name, long value);

    Metrics nullMetrics = new NullMetrics();
}

class NullMetrics implements Metrics {

    @Override
    public void increment(String name) {
    }

    @Override
    public void histogram(String name, long value) {
    }
}

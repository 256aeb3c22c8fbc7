package com.dimosr.metrics;

import com.dimosr.metrics.core.MetricValue;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

public final class CounterSnapshot implements MetricValue {
    public static final String COUNT = "count";

    private final long count;

    public CounterSnapshot(final long count) {
        this.count = count;
    }

    public long count() {
        return count;
    }

    @Override
    public Map<String, Double> facets() {
        return ImmutableMap.of(COUNT, (double) count);
    }

    @Override
    public String toString() {
        return "CounterSnapshot{count=" + count + "}";
    }
}

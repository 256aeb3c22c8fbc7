package com.dimosr.metrics;

import com.dimosr.metrics.core.MetricValue;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

public final class GaugeSnapshot implements MetricValue {
    public static final String VALUE = "value";

    private final double value;

    public GaugeSnapshot(final double value) {
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    public Map<String, Double> facets() {
        return ImmutableMap.of(VALUE, value);
    }

    @Override
    public String toString() {
        return "GaugeSnapshot{value=" + value + "}";
    }
}

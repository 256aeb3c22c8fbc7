package com.dimosr.metrics;

import com.dimosr.metrics.core.Metric;
import com.google.common.util.concurrent.AtomicDouble;

/**
 * A gauge holding the last value that was set
 */
public class Gauge implements Metric {
    private final AtomicDouble value = new AtomicDouble(0.0);

    public void set(final double newValue) {
        value.set(newValue);
    }

    public double value() {
        return value.get();
    }

    @Override
    public GaugeSnapshot export() {
        return new GaugeSnapshot(value.get());
    }
}

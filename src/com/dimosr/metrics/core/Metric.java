package com.dimosr.metrics.core;

/**
 * Anything that can be exported by a reporter as a named, point-in-time value
 */
public interface Metric {
    MetricValue export();
}

package com.dimosr.metrics.core;

import com.dimosr.metrics.MeterSnapshot;

/**
 * A meter measures the rate at which a set of events occur,
 * just like the Unix load averages visible in top
 */
public interface Meter extends Metric {
    /**
     * Marks the occurrence of the given number of events
     * @param value the number of events, must not be negative
     */
    void mark(long value);

    default void mark() {
        mark(1);
    }

    /**
     * @return the number of events that have been marked
     */
    long count();

    /**
     * @return the mean rate (events per second) since the meter was created
     */
    double meanRate();

    /**
     * @return the one-minute exponentially-weighted moving average rate (events per second)
     */
    double m01rate();

    /**
     * @return the five-minute exponentially-weighted moving average rate (events per second)
     */
    double m05rate();

    /**
     * @return the fifteen-minute exponentially-weighted moving average rate (events per second)
     */
    double m15rate();

    MeterSnapshot snapshot();

    @Override
    default MetricValue export() {
        return snapshot();
    }
}

package com.dimosr.metrics;

import com.dimosr.metrics.core.MetricValue;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A point-in-time copy of the state of a meter
 */
public final class MeterSnapshot implements MetricValue {
    public static final String COUNT = "count";
    public static final String MEAN_RATE = "meanRate";
    public static final String M1_RATE = "m1";
    public static final String M5_RATE = "m5";
    public static final String M15_RATE = "m15";

    private final long count;
    private final double m01rate;
    private final double m05rate;
    private final double m15rate;
    private final double meanRate;

    public MeterSnapshot(final long count,
                         final double m01rate,
                         final double m05rate,
                         final double m15rate,
                         final double meanRate) {
        this.count = count;
        this.m01rate = m01rate;
        this.m05rate = m05rate;
        this.m15rate = m15rate;
        this.meanRate = meanRate;
    }

    public long count() {
        return count;
    }

    public double m01rate() {
        return m01rate;
    }

    public double m05rate() {
        return m05rate;
    }

    public double m15rate() {
        return m15rate;
    }

    public double meanRate() {
        return meanRate;
    }

    @Override
    public Map<String, Double> facets() {
        return ImmutableMap.of(
                COUNT, (double) count,
                MEAN_RATE, meanRate,
                M1_RATE, m01rate,
                M5_RATE, m05rate,
                M15_RATE, m15rate);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("count", count)
                .add("m01rate", m01rate)
                .add("m05rate", m05rate)
                .add("m15rate", m15rate)
                .add("meanRate", meanRate)
                .toString();
    }
}

package com.dimosr.metrics;

import com.dimosr.metrics.core.Metric;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A counter that can be incremented and decremented by any number of threads
 * The value is a 64-bit signed integer, which wraps around on overflow
 */
public class Counter implements Metric {
    private final AtomicLong count = new AtomicLong(0);

    public void inc() {
        inc(1);
    }

    public void inc(final long n) {
        count.addAndGet(n);
    }

    public void dec() {
        dec(1);
    }

    public void dec(final long n) {
        count.addAndGet(-n);
    }

    public long count() {
        return count.get();
    }

    public void clear() {
        count.set(0);
    }

    @Override
    public CounterSnapshot export() {
        return new CounterSnapshot(count.get());
    }
}

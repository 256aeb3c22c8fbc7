package com.dimosr.metrics;

import com.dimosr.metrics.core.Clock;
import com.dimosr.metrics.core.Meter;
import com.dimosr.metrics.util.SystemClock;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A Meter that keeps a 1, 5 and 15-minute moving average of the rate of events
 *
 * The moving averages are decayed lazily: every call that marks events or reads a rate first
 * checks how many tick intervals have passed since the last tick and replays them.
 * No lock is taken; concurrent callers race on a compare-and-set of the last tick timestamp
 * and only the winner performs the ticks owed for the elapsed interval.
 *
 * The event counter is a 64-bit signed value, which wraps around on overflow.
 */
public class StdMeter implements Meter {
    private static final long TICK_INTERVAL = EWMA.TICK_INTERVAL_SECONDS;

    /**
     * One day of ticks: by then even the fifteen-minute rate has decayed by a factor below 1e-41,
     * so replaying more ticks than that would not change any rate noticeably
     */
    @VisibleForTesting
    static final long MAX_REPLAYED_TICKS = TimeUnit.DAYS.toSeconds(1) / TICK_INTERVAL;

    private final Clock clock;
    private final long birthTimestamp;
    private final AtomicLong lastTickTimestamp;

    private final AtomicLong count = new AtomicLong(0);
    private final EWMA m01rate = EWMA.oneMinute();
    private final EWMA m05rate = EWMA.fiveMinute();
    private final EWMA m15rate = EWMA.fifteenMinute();

    public StdMeter() {
        this(new SystemClock());
    }

    /**
     * @param clock the clock used to measure the elapsed intervals, it has to be non-decreasing
     */
    public StdMeter(final Clock clock) {
        this.clock = clock;
        this.birthTimestamp = clock.now();
        this.lastTickTimestamp = new AtomicLong(birthTimestamp);
    }

    @Override
    public void mark(final long value) {
        Preconditions.checkArgument(value >= 0, "A meter can only be marked with non-negative values, but it was: %s", value);
        tickIfNecessary();
        count.addAndGet(value);
        m01rate.update(value);
        m05rate.update(value);
        m15rate.update(value);
    }

    @Override
    public long count() {
        return count.get();
    }

    @Override
    public double meanRate() {
        final long currentCount = count.get();
        if (currentCount == 0) {
            return 0.0;
        }

        final long elapsed = clock.now() - birthTimestamp;
        if (elapsed <= 0) {
            return 0.0;
        }
        return (double) currentCount / elapsed;
    }

    @Override
    public double m01rate() {
        tickIfNecessary();
        return m01rate.rate();
    }

    @Override
    public double m05rate() {
        tickIfNecessary();
        return m05rate.rate();
    }

    @Override
    public double m15rate() {
        tickIfNecessary();
        return m15rate.rate();
    }

    @Override
    public MeterSnapshot snapshot() {
        tickIfNecessary();
        return new MeterSnapshot(count(), m01rate.rate(), m05rate.rate(), m15rate.rate(), meanRate());
    }

    /**
     * Catches up with the ticks owed since the last tick
     *
     * Only the caller whose compare-and-set succeeds performs the ticks, at most MAX_REPLAYED_TICKS of them
     * after a long idle period. The clock never goes backwards, so an observed timestamp cannot reappear
     * and the compare-and-set has no ABA problem.
     */
    private void tickIfNecessary() {
        final long now = clock.now();
        final long lastTick = lastTickTimestamp.get();
        final long elapsed = now - lastTick;

        if (elapsed > TICK_INTERVAL) {
            final long newTick = now - elapsed % TICK_INTERVAL;
            if (lastTickTimestamp.compareAndSet(lastTick, newTick)) {
                final long ticksOwed = Math.min(elapsed / TICK_INTERVAL, MAX_REPLAYED_TICKS);
                for (long i = 0; i < ticksOwed; i++) {
                    m01rate.tick();
                    m05rate.tick();
                    m15rate.tick();
                }
            }
        }
    }
}

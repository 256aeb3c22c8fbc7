package com.dimosr.metrics.util;

import com.dimosr.metrics.core.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A Clock backed by a java.time.Clock, truncated to epoch seconds
 *
 * The returned values never go backwards, even if the wall clock does (e.g. after an NTP adjustment).
 * If the underlying clock fails, the last value that was successfully read is returned instead,
 * or the current time of the system, if no value has been read yet.
 */
public class SystemClock implements Clock {
    private static final Logger log = LoggerFactory.getLogger(SystemClock.class);

    private static final long NO_VALUE = Long.MIN_VALUE;

    private final java.time.Clock clock;
    private final AtomicLong lastKnownGood;

    public SystemClock() {
        this(java.time.Clock.systemUTC());
    }

    /**
     * @param clock the underlying clock, whose instants are read with seconds precision
     */
    public SystemClock(final java.time.Clock clock) {
        this.clock = clock;
        this.lastKnownGood = new AtomicLong(NO_VALUE);
    }

    @Override
    public long now() {
        final long seconds;
        try {
            seconds = clock.instant().getEpochSecond();
        } catch (RuntimeException e) {
            final long lastKnown = lastKnownGood.get();
            if (lastKnown == NO_VALUE) {
                final long fallback = lastKnownGood.accumulateAndGet(System.currentTimeMillis() / 1000, Math::max);
                log.warn("Failed to read the underlying clock before any successful read, using system time {}", fallback, e);
                return fallback;
            }
            log.warn("Failed to read the underlying clock, using last known value {}", lastKnown, e);
            return lastKnown;
        }
        return lastKnownGood.accumulateAndGet(seconds, Math::max);
    }
}

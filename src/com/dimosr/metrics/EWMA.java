package com.dimosr.metrics;

import com.google.common.base.Preconditions;

import java.util.concurrent.atomic.LongAdder;

/**
 * An exponentially-weighted moving average of a rate, decayed once per tick
 *
 * Events are accumulated through {@link #update(long)} and folded into the rate
 * every time {@link #tick()} is called, which must happen every {@link #TICK_INTERVAL_SECONDS} seconds.
 * This is the recurrence used by the Unix load averages.
 *
 * @see <a href="http://www.teamquest.com/pdfs/whitepaper/ldavg1.pdf">UNIX Load Average Part 1: How It Works</a>
 */
public class EWMA {
    public static final int TICK_INTERVAL_SECONDS = 5;

    private static final double SECONDS_PER_MINUTE = 60.0;

    private final double alpha;
    private final LongAdder uncounted = new LongAdder();

    private volatile boolean initialized = false;
    private volatile double rate = 0.0;

    EWMA(final double alpha) {
        this.alpha = alpha;
    }

    /**
     * Creates an EWMA averaging over the given window
     * @param minutes the averaging window in minutes (e.g. 1, 5 or 15)
     */
    public static EWMA forWindow(final int minutes) {
        Preconditions.checkArgument(minutes > 0, "The averaging window has to be positive, but it was: %s", minutes);
        return new EWMA(1 - Math.exp(-TICK_INTERVAL_SECONDS / SECONDS_PER_MINUTE / minutes));
    }

    public static EWMA oneMinute() {
        return forWindow(1);
    }

    public static EWMA fiveMinute() {
        return forWindow(5);
    }

    public static EWMA fifteenMinute() {
        return forWindow(15);
    }

    /**
     * Accounts for new events, which will be taken into account on the next tick
     * @param n the number of events, must not be negative
     */
    public void update(final long n) {
        Preconditions.checkArgument(n >= 0, "The number of events cannot be negative, but it was: %s", n);
        uncounted.add(n);
    }

    public void tick() {
        final double instantRate = uncounted.sumThenReset() / (double) TICK_INTERVAL_SECONDS;
        if (initialized) {
            rate += alpha * (instantRate - rate);
        } else {
            rate = instantRate;
            initialized = true;
        }
    }

    /**
     * @return the rate in events per second, or zero if no tick has happened yet
     */
    public double rate() {
        return rate;
    }

    public double alpha() {
        return alpha;
    }
}

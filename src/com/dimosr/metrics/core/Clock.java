package com.dimosr.metrics.core;

/**
 * A source of time with seconds precision
 *
 * Implementations must never go backwards: successive calls return non-decreasing values.
 * The lock-free tick catch-up of the meters relies on this
 */
@FunctionalInterface
public interface Clock {
    long now();
}

package com.dimosr.metrics;

import com.dimosr.metrics.core.Clock;
import com.dimosr.metrics.core.Metric;
import com.dimosr.metrics.exceptions.NameAlreadyRegisteredException;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * The directory of named metrics, which are discovered and exported by the reporters
 *
 * The registry can be used by multiple threads concurrently.
 * A name can be registered only once: registering a metric under a name that is already taken
 * fails with a NameAlreadyRegisteredException and leaves the existing metric in place.
 * Metrics stay registered until they are explicitly removed.
 *
 * Names are used as paths by the reporters, so they cannot be empty or contain whitespace.
 */
public class MetricRegistry {
    private static final Logger log = LoggerFactory.getLogger(MetricRegistry.class);

    private final ConcurrentMap<String, Metric> metrics = new ConcurrentHashMap<>();

    /**
     * Registers the given metric under the given name
     *
     * @param name the unique name of the metric
     * @param metric the metric to register
     * @return the registered metric
     * @throws NameAlreadyRegisteredException if a metric is already registered under this name
     */
    public <T extends Metric> T register(final String name, final T metric) {
        checkName(name);
        Preconditions.checkNotNull(metric, "metric");

        final Metric existing = metrics.putIfAbsent(name, metric);
        if (existing != null) {
            throw new NameAlreadyRegisteredException(String.format("A metric is already registered under the name: %s", name));
        }
        log.debug("Registered {} under {}", metric.getClass().getSimpleName(), name);
        return metric;
    }

    public StdMeter meter(final String name) {
        return register(name, new StdMeter());
    }

    /**
     * Creates and registers a meter, which will use the provided clock
     */
    public StdMeter meter(final String name, final Clock clock) {
        return register(name, new StdMeter(clock));
    }

    public Counter counter(final String name) {
        return register(name, new Counter());
    }

    public Gauge gauge(final String name) {
        return register(name, new Gauge());
    }

    public Optional<Metric> get(final String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    /**
     * @return true if a metric was registered under this name and has been removed
     */
    public boolean remove(final String name) {
        final boolean removed = metrics.remove(name) != null;
        if (removed) {
            log.debug("Removed metric {}", name);
        }
        return removed;
    }

    public ImmutableSortedSet<String> names() {
        return ImmutableSortedSet.copyOf(metrics.keySet());
    }

    /**
     * Iterates over the registered metrics, ordered by name
     *
     * The iteration is performed over a copy of the registry, so registrations and removals
     * happening during the iteration are not visible. The values of the metrics themselves are not copied.
     */
    public Iterator<Map.Entry<String, Metric>> each() {
        return ImmutableSortedMap.copyOf(metrics).entrySet().iterator();
    }

    public int size() {
        return metrics.size();
    }

    private static void checkName(final String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "The metric name cannot be empty");
        Preconditions.checkArgument(CharMatcher.whitespace().matchesNoneOf(name),
                "The metric name cannot contain whitespace, but it was: '%s'", name);
    }
}

package com.dimosr.metrics.carbon;

import com.dimosr.metrics.MetricRegistry;
import com.dimosr.metrics.core.Clock;
import com.dimosr.metrics.core.Metric;
import com.dimosr.metrics.exceptions.SendFailedException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically exports all the metrics of a registry to a Carbon collector
 *
 * On every interval, each registered metric is exported and every facet of its snapshot is sent
 * as one line, under the path {@code <prefix>.<metric name>.<facet>}. All the lines of a batch
 * share the same timestamp.
 *
 * Delivery is best-effort: if a batch cannot be sent, it is dropped and the next interval
 * will try again with a new connection. Failures are logged and never stop the reporter.
 *
 * Use {@link CarbonReporterBuilder} to construct a reporter.
 */
public class CarbonReporter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(CarbonReporter.class);

    private final MetricRegistry registry;
    private final CarbonSender sender;
    private final Clock clock;
    private final String prefix;
    private final Duration interval;
    private final Duration shutdownTimeout;
    private final ScheduledExecutorService scheduler;

    private volatile int consecutiveFailures = 0;

    CarbonReporter(final MetricRegistry registry,
                   final CarbonSender sender,
                   final Clock clock,
                   final String prefix,
                   final Duration interval,
                   final Duration shutdownTimeout) {
        this.registry = registry;
        this.sender = sender;
        this.clock = clock;
        this.prefix = prefix;
        this.interval = interval;
        this.shutdownTimeout = shutdownTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("carbon-reporter-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Starts reporting on every interval, the first report happens after one interval has passed
     */
    public void start() {
        log.info("Reporting metrics to {} every {}", sender.collector(), interval);
        scheduler.scheduleAtFixedRate(this::reportSafely, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops reporting, waiting for an in-flight report to complete, and closes the connection to the collector
     */
    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight report did not complete within {}, interrupting it", shutdownTimeout);
                scheduler.shutdownNow();
                if (!scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Reporting thread did not stop after being interrupted, closing the connection anyway");
                }
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            sender.close();
            log.info("Stopped reporting metrics to {}", sender.collector());
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Exports the current state of all the registered metrics and sends it to the collector
     *
     * A batch that cannot be sent is dropped.
     */
    public void report() {
        final List<CarbonLine> batch = collect(clock.now());
        if (batch.isEmpty()) {
            log.debug("No metrics to report");
            return;
        }

        try {
            sender.send(batch);
            if (consecutiveFailures > 0) {
                log.info("Reporting to {} recovered after {} failed attempts", sender.collector(), consecutiveFailures);
            }
            consecutiveFailures = 0;
        } catch (SendFailedException e) {
            consecutiveFailures++;
            log.warn("Dropping batch of {} lines, {} consecutive failures reporting to {}",
                    batch.size(), consecutiveFailures, sender.collector(), e);
        }
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    @VisibleForTesting
    List<CarbonLine> collect(final long timestamp) {
        final ImmutableList.Builder<CarbonLine> batch = ImmutableList.builder();
        final Iterator<Map.Entry<String, Metric>> metrics = registry.each();
        while (metrics.hasNext()) {
            final Map.Entry<String, Metric> entry = metrics.next();
            try {
                batch.addAll(linesOf(entry.getKey(), entry.getValue(), timestamp));
            } catch (RuntimeException e) {
                log.warn("Skipping metric {}, it could not be exported", entry.getKey(), e);
            }
        }
        return batch.build();
    }

    /**
     * A metric either contributes all its lines to the batch or none of them
     */
    private List<CarbonLine> linesOf(final String name, final Metric metric, final long timestamp) {
        final String basePath = prefix + name;
        final ImmutableList.Builder<CarbonLine> lines = ImmutableList.builder();
        for (Map.Entry<String, Double> facet : metric.export().facets().entrySet()) {
            final Double value = facet.getValue();
            if (value != null && Double.isFinite(value)) {
                lines.add(new CarbonLine(basePath + '.' + facet.getKey(), value, timestamp));
            } else {
                log.debug("Skipping missing or non-finite value of {}.{}", basePath, facet.getKey());
            }
        }
        return lines.build();
    }

    /**
     * An exception escaping a scheduled task would cancel all its next executions
     */
    private void reportSafely() {
        try {
            report();
        } catch (RuntimeException e) {
            log.warn("Unexpected failure while reporting metrics to {}", sender.collector(), e);
        }
    }
}

package com.dimosr.metrics.carbon;

import com.dimosr.metrics.MetricRegistry;
import com.dimosr.metrics.core.Clock;
import com.dimosr.metrics.util.SystemClock;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.net.HostAndPort;

import javax.net.SocketFactory;
import java.time.Duration;

/**
 * A builder used to configure a reporter, exporting the metrics of a registry to a Carbon collector
 *
 * The available settings and their defaults are the following:
 * - collector: the host and port of the collector (default port: 2003), required
 * - prefix: prepended to the name of every metric, e.g. "app.host1" (default: no prefix)
 * - interval: the period between two reports (default: 1 minute, minimum: 1 second)
 * - connect timeout: the maximum time to wait for a connection (default: 5 seconds)
 * - write timeout: the maximum time to wait for a batch to be written (default: 5 seconds)
 *
 * Neither timeout can be longer than the interval, so that a stuck collector
 * cannot delay the reporter by more than one interval.
 */
public class CarbonReporterBuilder {
    public static final int DEFAULT_CARBON_PORT = 2003;

    private static final Duration MINIMUM_INTERVAL = Duration.ofSeconds(1);

    private final MetricRegistry registry;

    private HostAndPort collector;
    private String prefix = "";
    private Duration interval = Duration.ofMinutes(1);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration writeTimeout = Duration.ofSeconds(5);
    private Clock clock = new SystemClock();
    private SocketFactory socketFactory = SocketFactory.getDefault();

    private CarbonReporterBuilder(final MetricRegistry registry) {
        this.registry = registry;
    }

    public static CarbonReporterBuilder forRegistry(final MetricRegistry registry) {
        return new CarbonReporterBuilder(Preconditions.checkNotNull(registry, "registry"));
    }

    public CarbonReporterBuilder withCollector(final HostAndPort collector) {
        this.collector = collector.withDefaultPort(DEFAULT_CARBON_PORT);
        return this;
    }

    /**
     * @param collector the collector in the form "host:port" or "host"
     */
    public CarbonReporterBuilder withCollector(final String collector) {
        return withCollector(HostAndPort.fromString(collector));
    }

    /**
     * @param prefix a dot-delimited prefix for all the paths, trailing dots are ignored
     */
    public CarbonReporterBuilder withPrefix(final String prefix) {
        Preconditions.checkArgument(prefix != null && CharMatcher.whitespace().matchesNoneOf(prefix),
                "The prefix cannot contain whitespace, but it was: '%s'", prefix);
        this.prefix = CharMatcher.is('.').trimTrailingFrom(prefix);
        return this;
    }

    public CarbonReporterBuilder withInterval(final Duration interval) {
        this.interval = interval;
        return this;
    }

    public CarbonReporterBuilder withConnectTimeout(final Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public CarbonReporterBuilder withWriteTimeout(final Duration writeTimeout) {
        this.writeTimeout = writeTimeout;
        return this;
    }

    /**
     * @param clock the clock used to timestamp the batches
     */
    public CarbonReporterBuilder withClock(final Clock clock) {
        this.clock = clock;
        return this;
    }

    public CarbonReporterBuilder withSocketFactory(final SocketFactory socketFactory) {
        this.socketFactory = socketFactory;
        return this;
    }

    public CarbonReporter build() {
        Preconditions.checkState(collector != null, "A collector has to be provided");
        Preconditions.checkArgument(interval.compareTo(MINIMUM_INTERVAL) >= 0,
                "The interval has to be at least %s, but it was: %s", MINIMUM_INTERVAL, interval);
        checkTimeout("connect", connectTimeout);
        checkTimeout("write", writeTimeout);

        final CarbonSender sender = new CarbonSender(collector, socketFactory, connectTimeout, writeTimeout);
        return new CarbonReporter(registry, sender, clock, pathPrefix(), interval, connectTimeout.plus(writeTimeout));
    }

    private void checkTimeout(final String name, final Duration timeout) {
        Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(),
                "The %s timeout has to be positive, but it was: %s", name, timeout);
        Preconditions.checkArgument(timeout.compareTo(interval) <= 0,
                "The %s timeout cannot be longer than the interval %s, but it was: %s", name, interval, timeout);
    }

    private String pathPrefix() {
        return Strings.isNullOrEmpty(prefix) ? "" : prefix + '.';
    }
}

package com.dimosr.metrics.core;

import java.util.Map;

/**
 * An immutable snapshot of a metric
 *
 * Each facet is a numeric value that is reported under its own path,
 * formed by appending the facet name to the name of the metric (e.g. "requests.m1")
 */
public interface MetricValue {
    Map<String, Double> facets();
}

package com.mimecast.sharedqueue.metrics;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

/**
 * Global access to the metric registry for listener threads.
 */
public final class MetricsRegistry {
    private static volatile PrometheusMeterRegistry prometheusRegistry;

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Register the metric registry.
     *
     * @param prom Prometheus registry, null to disable metrics.
     */
    public static void register(PrometheusMeterRegistry prom) {
        prometheusRegistry = prom;
    }

    /**
     * Get the Prometheus registry.
     *
     * @return Prometheus registry or null.
     */
    public static PrometheusMeterRegistry getPrometheusRegistry() {
        return prometheusRegistry;
    }
}

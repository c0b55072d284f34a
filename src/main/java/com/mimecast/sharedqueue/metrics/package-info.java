/**
 * Micrometer metrics for the shared queue listener.
 *
 * <p>Counters are registered lazily on the Prometheus registry held by
 * {@link com.mimecast.sharedqueue.metrics.MetricsRegistry}.
 * <br>With no registry set every increment is a no-op.
 */
package com.mimecast.sharedqueue.metrics;

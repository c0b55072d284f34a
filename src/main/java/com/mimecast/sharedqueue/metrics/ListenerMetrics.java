package com.mimecast.sharedqueue.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Shared queue listener Micrometer metrics.
 *
 * <p>Counts message outcomes, poisoned messages by destination tier and transport errors.
 * <p>Metrics are best effort and never interfere with message processing.
 */
public final class ListenerMetrics {
    private static final Logger log = LogManager.getLogger(ListenerMetrics.class);

    public static final String MESSAGES_PROCESSED = "shared.queue.messages.processed";
    public static final String MESSAGES_POISONED = "shared.queue.messages.poisoned";
    public static final String TRANSPORT_ERRORS = "shared.queue.transport.errors";

    /**
     * Private constructor for utility class.
     */
    private ListenerMetrics() {
    }

    /**
     * Increment the processed counter.
     *
     * @param outcome Outcome, lower case trigger result status.
     */
    public static void incrementProcessed(String outcome) {
        increment(MESSAGES_PROCESSED, "Number of shared queue messages processed", "outcome", outcome);
    }

    /**
     * Increment the poisoned counter.
     *
     * @param destination Destination tier, consumer or default.
     */
    public static void incrementPoisoned(String destination) {
        increment(MESSAGES_POISONED, "Number of messages moved to a poison queue", "destination", destination);
    }

    /**
     * Increment the transport error counter.
     *
     * @param operation Failed operation.
     */
    public static void incrementTransportError(String operation) {
        increment(TRANSPORT_ERRORS, "Number of failed queue transport operations", "operation", operation);
    }

    private static void increment(String name, String description, String tagKey, String tagValue) {
        try {
            MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry)
                        .increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", name, e.getMessage());
        }
    }
}

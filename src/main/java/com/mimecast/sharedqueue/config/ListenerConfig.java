package com.mimecast.sharedqueue.config;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Shared queue listener configuration.
 *
 * <p>This class provides type safe access to the {@code listener.json5} configuration.
 * <p>Values are not validated here, see {@link #toSettings()}.
 *
 * @see ListenerSettings
 */
public class ListenerConfig extends ConfigFoundation {

    /**
     * Constructs a new ListenerConfig instance.
     */
    public ListenerConfig() {
        super();
    }

    /**
     * Constructs a new ListenerConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ListenerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ListenerConfig instance from file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ListenerConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets minimum polling interval.
     *
     * @return Duration.
     */
    public Duration getMinimumPollingInterval() {
        return Duration.ofMillis(getLongProperty("minimumPollingIntervalMillis", ListenerSettings.DEFAULT_MINIMUM_POLLING_INTERVAL.toMillis()));
    }

    /**
     * Gets maximum polling interval.
     *
     * @return Duration.
     */
    public Duration getMaximumPollingInterval() {
        return Duration.ofMillis(getLongProperty("maximumPollingIntervalMillis", ListenerSettings.DEFAULT_MAXIMUM_POLLING_INTERVAL.toMillis()));
    }

    /**
     * Gets batch size.
     *
     * @return Messages fetched per poll.
     */
    public int getBatchSize() {
        return getIntProperty("batchSize", ListenerSettings.DEFAULT_BATCH_SIZE);
    }

    /**
     * Gets new batch threshold.
     * <p>A new batch is fetched once in-flight messages drop to this number.
     *
     * @return Threshold, half the batch size if not configured.
     */
    public int getNewBatchThreshold() {
        return getIntProperty("newBatchThreshold", getBatchSize() / 2);
    }

    /**
     * Gets max dequeue count.
     *
     * @return Poison threshold.
     */
    public int getMaxDequeueCount() {
        return getIntProperty("maxDequeueCount", ListenerSettings.DEFAULT_MAX_DEQUEUE_COUNT);
    }

    /**
     * Gets visibility timeout applied when releasing a failed message.
     *
     * @return Duration.
     */
    public Duration getVisibilityTimeout() {
        return Duration.ofMillis(getLongProperty("visibilityTimeoutMillis", 0L));
    }

    /**
     * Gets drain timeout.
     *
     * @return Duration in-flight messages are given on stop.
     */
    public Duration getDrainTimeout() {
        return Duration.ofMillis(getLongProperty("drainTimeoutMillis", ListenerSettings.DEFAULT_DRAIN_TIMEOUT.toMillis()));
    }

    /**
     * Gets handler timeout.
     *
     * @return Duration a handler may run before it counts as failed.
     */
    public Duration getHandlerTimeout() {
        return Duration.ofMillis(getLongProperty("handlerTimeoutMillis", ListenerSettings.DEFAULT_HANDLER_TIMEOUT.toMillis()));
    }

    /**
     * Gets minimum pool size.
     *
     * @return Worker pool min size.
     */
    public int getMinimumPoolSize() {
        return getIntProperty("minimumPoolSize", 1);
    }

    /**
     * Gets maximum pool size.
     *
     * @return Worker pool max size, the batch size if not configured.
     */
    public int getMaximumPoolSize() {
        return getIntProperty("maximumPoolSize", getBatchSize());
    }

    /**
     * Gets thread keep alive time.
     *
     * @return Time in seconds.
     */
    public int getThreadKeepAliveTime() {
        return getIntProperty("threadKeepAliveTime", 60);
    }

    /**
     * Gets poison queue name.
     *
     * @return Queue name used for both the default and per consumer poison queues.
     */
    public String getPoisonQueueName() {
        return getStringProperty("poisonQueueName", ListenerSettings.DEFAULT_POISON_QUEUE_NAME);
    }

    /**
     * Validates and converts to settings.
     *
     * @return ListenerSettings instance.
     * @throws ConfigurationException On any invalid value.
     */
    public ListenerSettings toSettings() {
        return ListenerSettings.builder()
                .minimumPollingInterval(getMinimumPollingInterval())
                .maximumPollingInterval(getMaximumPollingInterval())
                .batchSize(getBatchSize())
                .newBatchThreshold(getNewBatchThreshold())
                .maxDequeueCount(getMaxDequeueCount())
                .visibilityTimeout(getVisibilityTimeout())
                .drainTimeout(getDrainTimeout())
                .handlerTimeout(getHandlerTimeout())
                .minimumPoolSize(getMinimumPoolSize())
                .maximumPoolSize(getMaximumPoolSize())
                .threadKeepAliveTime(getThreadKeepAliveTime())
                .poisonQueueName(getPoisonQueueName())
                .build();
    }
}

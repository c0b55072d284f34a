package com.mimecast.sharedqueue.config;

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;

/**
 * Validated, immutable listener settings.
 *
 * <p>Built through {@link Builder} which fails fast with {@link ConfigurationException}.
 */
public final class ListenerSettings {

    public static final Duration DEFAULT_MINIMUM_POLLING_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAXIMUM_POLLING_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_HANDLER_TIMEOUT = Duration.ofMinutes(10);
    public static final int DEFAULT_BATCH_SIZE = 16;
    public static final int MAX_BATCH_SIZE = 32;
    public static final int DEFAULT_MAX_DEQUEUE_COUNT = 5;
    public static final String DEFAULT_POISON_QUEUE_NAME = "shared-trigger-poison";

    private final Duration minimumPollingInterval;
    private final Duration maximumPollingInterval;
    private final int batchSize;
    private final int newBatchThreshold;
    private final int maxDequeueCount;
    private final Duration visibilityTimeout;
    private final Duration drainTimeout;
    private final Duration handlerTimeout;
    private final int minimumPoolSize;
    private final int maximumPoolSize;
    private final int threadKeepAliveTime;
    private final String poisonQueueName;

    private ListenerSettings(Builder builder) {
        this.minimumPollingInterval = builder.minimumPollingInterval;
        this.maximumPollingInterval = builder.maximumPollingInterval;
        this.batchSize = builder.batchSize;
        this.newBatchThreshold = builder.newBatchThreshold != null ? builder.newBatchThreshold : builder.batchSize / 2;
        this.maxDequeueCount = builder.maxDequeueCount;
        this.visibilityTimeout = builder.visibilityTimeout;
        this.drainTimeout = builder.drainTimeout;
        this.handlerTimeout = builder.handlerTimeout;
        this.minimumPoolSize = builder.minimumPoolSize;
        this.maximumPoolSize = builder.maximumPoolSize != null ? builder.maximumPoolSize : builder.batchSize;
        this.threadKeepAliveTime = builder.threadKeepAliveTime;
        this.poisonQueueName = builder.poisonQueueName;
    }

    /**
     * Gets a new builder primed with defaults.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Duration getMinimumPollingInterval() {
        return minimumPollingInterval;
    }

    public Duration getMaximumPollingInterval() {
        return maximumPollingInterval;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getNewBatchThreshold() {
        return newBatchThreshold;
    }

    public int getMaxDequeueCount() {
        return maxDequeueCount;
    }

    public Duration getVisibilityTimeout() {
        return visibilityTimeout;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    /**
     * Gets the time a handler may run before it counts as failed.
     *
     * @return Duration.
     */
    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public int getMinimumPoolSize() {
        return minimumPoolSize;
    }

    public int getMaximumPoolSize() {
        return maximumPoolSize;
    }

    public int getThreadKeepAliveTime() {
        return threadKeepAliveTime;
    }

    public String getPoisonQueueName() {
        return poisonQueueName;
    }

    @Override
    public String toString() {
        return "ListenerSettings{" +
                "minimumPollingInterval=" + minimumPollingInterval +
                ", maximumPollingInterval=" + maximumPollingInterval +
                ", batchSize=" + batchSize +
                ", newBatchThreshold=" + newBatchThreshold +
                ", maxDequeueCount=" + maxDequeueCount +
                ", visibilityTimeout=" + visibilityTimeout +
                ", drainTimeout=" + drainTimeout +
                ", handlerTimeout=" + handlerTimeout +
                ", poolSize=" + minimumPoolSize + "-" + maximumPoolSize +
                ", poisonQueueName='" + poisonQueueName + '\'' +
                '}';
    }

    /**
     * ListenerSettings builder.
     */
    public static final class Builder {
        private Duration minimumPollingInterval = DEFAULT_MINIMUM_POLLING_INTERVAL;
        private Duration maximumPollingInterval = DEFAULT_MAXIMUM_POLLING_INTERVAL;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Integer newBatchThreshold;
        private int maxDequeueCount = DEFAULT_MAX_DEQUEUE_COUNT;
        private Duration visibilityTimeout = Duration.ZERO;
        private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
        private Duration handlerTimeout = DEFAULT_HANDLER_TIMEOUT;
        private int minimumPoolSize = 1;
        private Integer maximumPoolSize;
        private int threadKeepAliveTime = 60;
        private String poisonQueueName = DEFAULT_POISON_QUEUE_NAME;

        private Builder() {
        }

        public Builder minimumPollingInterval(Duration minimumPollingInterval) {
            this.minimumPollingInterval = minimumPollingInterval;
            return this;
        }

        public Builder maximumPollingInterval(Duration maximumPollingInterval) {
            this.maximumPollingInterval = maximumPollingInterval;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder newBatchThreshold(int newBatchThreshold) {
            this.newBatchThreshold = newBatchThreshold;
            return this;
        }

        public Builder maxDequeueCount(int maxDequeueCount) {
            this.maxDequeueCount = maxDequeueCount;
            return this;
        }

        public Builder visibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder handlerTimeout(Duration handlerTimeout) {
            this.handlerTimeout = handlerTimeout;
            return this;
        }

        public Builder minimumPoolSize(int minimumPoolSize) {
            this.minimumPoolSize = minimumPoolSize;
            return this;
        }

        public Builder maximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
            return this;
        }

        public Builder threadKeepAliveTime(int threadKeepAliveTime) {
            this.threadKeepAliveTime = threadKeepAliveTime;
            return this;
        }

        public Builder poisonQueueName(String poisonQueueName) {
            this.poisonQueueName = poisonQueueName;
            return this;
        }

        /**
         * Validates and builds.
         *
         * @return ListenerSettings instance.
         * @throws ConfigurationException On any invalid value.
         */
        public ListenerSettings build() {
            requirePositive("minimumPollingInterval", minimumPollingInterval);
            requirePositive("maximumPollingInterval", maximumPollingInterval);
            if (minimumPollingInterval.compareTo(maximumPollingInterval) > 0) {
                throw new ConfigurationException("minimumPollingInterval " + minimumPollingInterval
                        + " exceeds maximumPollingInterval " + maximumPollingInterval);
            }

            requirePositive("batchSize", batchSize);
            if (batchSize > MAX_BATCH_SIZE) {
                throw new ConfigurationException("batchSize must not exceed " + MAX_BATCH_SIZE + ": " + batchSize);
            }
            if (newBatchThreshold != null && (newBatchThreshold < 0 || newBatchThreshold > batchSize)) {
                throw new ConfigurationException("newBatchThreshold must be between 0 and batchSize: " + newBatchThreshold);
            }

            requirePositive("maxDequeueCount", maxDequeueCount);
            requirePositive("drainTimeout", drainTimeout);
            requirePositive("handlerTimeout", handlerTimeout);
            if (visibilityTimeout == null || visibilityTimeout.isNegative()) {
                throw new ConfigurationException("visibilityTimeout must not be negative: " + visibilityTimeout);
            }

            if (minimumPoolSize < 0) {
                throw new ConfigurationException("minimumPoolSize must not be negative: " + minimumPoolSize);
            }
            if (maximumPoolSize != null) {
                requirePositive("maximumPoolSize", maximumPoolSize);
            }
            int effectiveMaximumPoolSize = maximumPoolSize != null ? maximumPoolSize : batchSize;
            if (minimumPoolSize > effectiveMaximumPoolSize) {
                throw new ConfigurationException("minimumPoolSize " + minimumPoolSize
                        + " exceeds maximumPoolSize " + effectiveMaximumPoolSize);
            }
            if (threadKeepAliveTime < 0) {
                throw new ConfigurationException("threadKeepAliveTime must not be negative: " + threadKeepAliveTime);
            }

            if (StringUtils.isBlank(poisonQueueName)) {
                throw new ConfigurationException("poisonQueueName must not be blank");
            }

            return new ListenerSettings(this);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new ConfigurationException(name + " must be positive: " + value);
            }
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new ConfigurationException(name + " must be positive: " + value);
            }
        }
    }
}

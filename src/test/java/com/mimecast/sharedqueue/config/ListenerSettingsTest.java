package com.mimecast.sharedqueue.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ListenerSettingsTest {

    @Test
    void testMinimumAboveMaximumRejected() {
        ListenerSettings.Builder builder = ListenerSettings.builder()
                .minimumPollingInterval(Duration.ofSeconds(5))
                .maximumPollingInterval(Duration.ofSeconds(1));

        assertThrows(ConfigurationException.class, builder::build);
    }

    @Test
    void testEqualBoundsAccepted() {
        ListenerSettings settings = ListenerSettings.builder()
                .minimumPollingInterval(Duration.ofSeconds(1))
                .maximumPollingInterval(Duration.ofSeconds(1))
                .build();

        assertEquals(settings.getMinimumPollingInterval(), settings.getMaximumPollingInterval());
    }

    @ParameterizedTest
    @ValueSource(longs = {0L, -1L})
    void testNonPositiveIntervalsRejected(long millis) {
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .minimumPollingInterval(Duration.ofMillis(millis)).build());
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .maximumPollingInterval(Duration.ofMillis(millis)).build());
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .drainTimeout(Duration.ofMillis(millis)).build());
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .handlerTimeout(Duration.ofMillis(millis)).build());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -3, 33})
    void testBatchSizeOutOfRangeRejected(int batchSize) {
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder().batchSize(batchSize).build());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void testNonPositiveMaxDequeueCountRejected(int maxDequeueCount) {
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder().maxDequeueCount(maxDequeueCount).build());
    }

    @Test
    void testNewBatchThresholdAboveBatchSizeRejected() {
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .batchSize(4)
                .newBatchThreshold(5)
                .build());
    }

    @Test
    void testPoolSizesValidated() {
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .minimumPoolSize(8)
                .maximumPoolSize(2)
                .build());
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .maximumPoolSize(0)
                .build());
    }

    @Test
    void testNegativeVisibilityTimeoutRejected() {
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .visibilityTimeout(Duration.ofSeconds(-1))
                .build());
    }

    @Test
    void testBlankPoisonQueueNameRejected() {
        assertThrows(ConfigurationException.class, () -> ListenerSettings.builder()
                .poisonQueueName(" ")
                .build());
    }
}

package com.mimecast.sharedqueue.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ListenerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        ListenerSettings settings = new ListenerConfig().toSettings();

        assertEquals(Duration.ofMillis(100), settings.getMinimumPollingInterval());
        assertEquals(Duration.ofMinutes(1), settings.getMaximumPollingInterval());
        assertEquals(16, settings.getBatchSize());
        assertEquals(8, settings.getNewBatchThreshold());
        assertEquals(5, settings.getMaxDequeueCount());
        assertEquals(Duration.ZERO, settings.getVisibilityTimeout());
        assertEquals(Duration.ofSeconds(30), settings.getDrainTimeout());
        assertEquals(Duration.ofMinutes(10), settings.getHandlerTimeout());
        assertEquals(1, settings.getMinimumPoolSize());
        assertEquals(16, settings.getMaximumPoolSize());
        assertEquals("shared-trigger-poison", settings.getPoisonQueueName());
    }

    @Test
    void testLoadFromJson5File() throws IOException {
        Path file = tempDir.resolve("listener.json5");
        Files.writeString(file, "{\n" +
                "  // Poll fast in tests.\n" +
                "  minimumPollingIntervalMillis: 50,\n" +
                "  maximumPollingIntervalMillis: 2000,\n" +
                "  batchSize: 4,\n" +
                "  maxDequeueCount: 3,\n" +
                "  poisonQueueName: \"orders-poison\"\n" +
                "}\n", StandardCharsets.UTF_8);

        ListenerConfig config = new ListenerConfig(file.toString());
        ListenerSettings settings = config.toSettings();

        assertEquals(Duration.ofMillis(50), settings.getMinimumPollingInterval());
        assertEquals(Duration.ofSeconds(2), settings.getMaximumPollingInterval());
        assertEquals(4, settings.getBatchSize());
        assertEquals(2, settings.getNewBatchThreshold(), "Threshold should default to half the batch size");
        assertEquals(4, settings.getMaximumPoolSize(), "Pool should default to the batch size");
        assertEquals(3, settings.getMaxDequeueCount());
        assertEquals("orders-poison", settings.getPoisonQueueName());
    }

    @Test
    void testShippedConfigMatchesDefaults() throws IOException {
        ListenerSettings shipped = new ListenerConfig("cfg/listener.json5").toSettings();
        ListenerSettings defaults = ListenerSettings.builder().build();

        assertEquals(defaults.toString(), shipped.toString());
    }

    @Test
    void testNumericStringsAreAccepted() {
        Map<String, Object> map = new HashMap<>();
        map.put("batchSize", "8");
        assertEquals(8, new ListenerConfig(map).getBatchSize());

        map.put("batchSize", "eight");
        assertThrows(ConfigurationException.class, () -> new ListenerConfig(map).getBatchSize());
    }

    @Test
    void testInvalidValueFailsFast() {
        Map<String, Object> map = new HashMap<>();
        map.put("maxDequeueCount", 0.0);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new ListenerConfig(map).toSettings());
        assertTrue(e.getMessage().contains("maxDequeueCount"));
    }

    @Test
    void testOutOfRangeIntegerRejected() {
        Map<String, Object> map = new HashMap<>();
        map.put("batchSize", 1e12);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new ListenerConfig(map).toSettings());
        assertTrue(e.getMessage().contains("batchSize"), "Error should name the key");
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    void testOutOfRangeLongRejected() {
        Map<String, Object> map = new HashMap<>();
        map.put("drainTimeoutMillis", 1e30);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new ListenerConfig(map).getDrainTimeout());
        assertTrue(e.getMessage().contains("drainTimeoutMillis"));
    }

    @Test
    void testFractionalValueRejected() {
        Map<String, Object> map = new HashMap<>();
        map.put("maxDequeueCount", 1.5);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new ListenerConfig(map).toSettings());
        assertTrue(e.getMessage().contains("maxDequeueCount"), "Error should name the key");
    }

    @Test
    void testWholeDoubleAccepted() {
        Map<String, Object> map = new HashMap<>();
        map.put("maxDequeueCount", 7.0);
        map.put("handlerTimeoutMillis", 2500.0);

        ListenerSettings settings = new ListenerConfig(map).toSettings();

        assertEquals(7, settings.getMaxDequeueCount());
        assertEquals(Duration.ofMillis(2500), settings.getHandlerTimeout());
    }

    @Test
    void testNonPositiveHandlerTimeoutRejected() {
        Map<String, Object> map = new HashMap<>();
        map.put("handlerTimeoutMillis", 0.0);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new ListenerConfig(map).toSettings());
        assertTrue(e.getMessage().contains("handlerTimeout"));
    }

    @Test
    void testUnparsableFileFails() throws IOException {
        Path file = tempDir.resolve("broken.json5");
        Files.writeString(file, "{ batchSize: [", StandardCharsets.UTF_8);

        assertThrows(ConfigurationException.class, () -> new ListenerConfig(file.toString()));
    }
}

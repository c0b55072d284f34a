package com.mimecast.sharedqueue.trigger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RegistrationTableTest {

    private static final TriggerHandler NOOP = (payload, context) -> {
    };

    private RegistrationTable table;

    @BeforeEach
    void setUp() {
        table = new RegistrationTable();
    }

    @Test
    void testRegisterAndLookup() {
        Registration registration = new Registration("orders", NOOP, null);
        table.register(registration);

        assertSame(registration, table.lookup("orders").orElseThrow());
        assertEquals(1, table.size());
        assertEquals(Set.of("orders"), table.ids());
    }

    @Test
    void testUnknownLookupIsEmpty() {
        assertTrue(table.lookup("missing").isEmpty());
        assertTrue(table.lookup(null).isEmpty());
    }

    @Test
    void testDuplicateRegistrationRejected() {
        table.register(new Registration("orders", NOOP, null));

        assertThrows(IllegalArgumentException.class, () -> table.register(new Registration("orders", NOOP, null)));
        assertEquals(1, table.size());
    }

    @Test
    void testUnregister() {
        table.register(new Registration("orders", NOOP, null));

        assertTrue(table.unregister("orders"));
        assertFalse(table.unregister("orders"));
        assertTrue(table.lookup("orders").isEmpty());
    }

    @Test
    void testBlankConsumerIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Registration(" ", NOOP, null));
        assertThrows(NullPointerException.class, () -> new Registration("orders", null, null));
    }

    @Test
    void testMissingResolverDefaultsToNone() {
        Registration registration = new Registration("orders", NOOP, null);

        assertTrue(registration.getPoisonDestination().resolveDestination().isEmpty());
    }

    @Test
    void testConcurrentReadersAndWriters() throws Exception {
        table.register(new Registration("stable", NOOP, null));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int w = 0; w < 2; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        String id = "consumer-" + writer + "-" + i;
                        table.register(new Registration(id, NOOP, null));
                        table.unregister(id);
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 6; r++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2000; i++) {
                        assertTrue(table.lookup("stable").isPresent());
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(Set.of("stable"), table.ids());
    }
}

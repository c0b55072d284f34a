package com.mimecast.sharedqueue.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryQueueTransportTest {

    private MutableClock clock;
    private InMemoryQueueTransport queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        queue = new InMemoryQueueTransport("shared", Duration.ofSeconds(30), clock);
    }

    @Test
    void testDequeueIncrementsDequeueCount() throws QueueTransportException {
        QueueMessage enqueued = queue.enqueue("hello");
        assertEquals(0, enqueued.getDequeueCount());

        List<QueueMessage> first = queue.dequeueBatch(10);
        assertEquals(1, first.size());
        assertEquals(1, first.get(0).getDequeueCount());
        assertEquals("hello", first.get(0).getBody());
        assertEquals(enqueued.getMessageId(), first.get(0).getMessageId());

        clock.advance(Duration.ofSeconds(31));
        List<QueueMessage> second = queue.dequeueBatch(10);
        assertEquals(2, second.get(0).getDequeueCount(), "Redelivery should bump the dequeue count");
    }

    @Test
    void testDequeuedMessageIsInvisibleUntilTimeout() throws QueueTransportException {
        queue.enqueue("hello");
        queue.dequeueBatch(10);

        assertTrue(queue.dequeueBatch(10).isEmpty(), "Message should be hidden after dequeue");
        assertNull(queue.peek());
        assertEquals(1, queue.size(), "Hidden message still counts towards size");

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, queue.dequeueBatch(10).size(), "Message should reappear after invisibility");
    }

    @Test
    void testDequeueBatchRespectsMaxAndOrder() throws QueueTransportException {
        for (int i = 0; i < 5; i++) {
            queue.enqueue("m" + i);
        }

        List<QueueMessage> batch = queue.dequeueBatch(3);
        assertEquals(3, batch.size());
        assertEquals("m0", batch.get(0).getBody());
        assertEquals("m2", batch.get(2).getBody());
        assertEquals(2, queue.dequeueBatch(10).size());
    }

    @Test
    void testReleaseMakesMessageVisible() throws QueueTransportException {
        queue.enqueue("hello");
        QueueMessage message = queue.dequeueBatch(1).get(0);

        queue.release(message, Duration.ZERO);
        assertNotNull(queue.peek());

        QueueMessage redelivered = queue.dequeueBatch(1).get(0);
        queue.release(redelivered, Duration.ofSeconds(5));
        assertTrue(queue.dequeueBatch(1).isEmpty());
        clock.advance(Duration.ofSeconds(5));
        assertEquals(3, queue.dequeueBatch(1).get(0).getDequeueCount());
    }

    @Test
    void testDeleteRemovesMessage() throws QueueTransportException {
        queue.enqueue("hello");
        QueueMessage message = queue.dequeueBatch(1).get(0);

        queue.delete(message);
        assertEquals(0, queue.size());
        assertThrows(QueueTransportException.class, () -> queue.delete(message), "Deleting twice should fail");
        assertThrows(QueueTransportException.class, () -> queue.release(message, Duration.ZERO));
    }

    @Test
    void testCopyToLeavesSourceUntouched() throws QueueTransportException {
        InMemoryQueueTransport poison = new InMemoryQueueTransport("poison");
        queue.enqueue("hello");
        QueueMessage message = queue.dequeueBatch(1).get(0);

        queue.copyTo(poison, message);

        assertEquals(1, queue.size());
        assertEquals(1, poison.size());
        assertEquals("hello", poison.snapshot().get(0).getBody());
    }

    @Test
    void testAccountQueues() {
        InMemoryQueueAccount account = new InMemoryQueueAccount("tenant");
        assertTrue(account.getQueue("poison").isPresent());
        assertSame(account.getQueue("poison").get(), account.getQueue("poison").get(), "Queues are shared by name");
        assertSame(account.getQueue("poison").get(), account.getExistingQueue("poison"));
        assertNull(account.getExistingQueue("other"));

        InMemoryQueueAccount restricted = InMemoryQueueAccount.restricted("blob-only");
        assertTrue(restricted.getQueue("poison").isEmpty(), "Restricted account has no queues");
    }
}

package com.mimecast.sharedqueue.queue;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory queue with switchable failures for testing purposes.
 * <p>Tracks operations for test verification.
 */
public class QueueTransportMock extends InMemoryQueueTransport {

    public volatile boolean failDequeue = false;
    public volatile boolean failDelete = false;
    public volatile boolean failCopy = false;
    public volatile boolean failRelease = false;

    public final AtomicInteger dequeueCalls = new AtomicInteger();
    public final AtomicInteger deleteCalls = new AtomicInteger();
    public final AtomicInteger copyCalls = new AtomicInteger();
    public final AtomicInteger releaseCalls = new AtomicInteger();

    /**
     * Constructs a mock queue on the system clock.
     *
     * @param name Queue name.
     */
    public QueueTransportMock(String name) {
        super(name);
    }

    /**
     * Constructs a mock queue.
     *
     * @param name         Queue name.
     * @param invisibility Time a dequeued message stays hidden.
     * @param clock        Clock.
     */
    public QueueTransportMock(String name, Duration invisibility, Clock clock) {
        super(name, invisibility, clock);
    }

    @Override
    public List<QueueMessage> dequeueBatch(int max) throws QueueTransportException {
        dequeueCalls.incrementAndGet();
        if (failDequeue) {
            throw new QueueTransportException("Simulated dequeue failure");
        }
        return super.dequeueBatch(max);
    }

    @Override
    public void delete(QueueMessage message) throws QueueTransportException {
        deleteCalls.incrementAndGet();
        if (failDelete) {
            throw new QueueTransportException("Simulated delete failure");
        }
        super.delete(message);
    }

    @Override
    public void copyTo(QueueTransport destination, QueueMessage message) throws QueueTransportException {
        copyCalls.incrementAndGet();
        if (failCopy) {
            throw new QueueTransportException("Simulated copy failure");
        }
        super.copyTo(destination, message);
    }

    @Override
    public void release(QueueMessage message, Duration visibilityTimeout) throws QueueTransportException {
        releaseCalls.incrementAndGet();
        if (failRelease) {
            throw new QueueTransportException("Simulated release failure");
        }
        super.release(message, visibilityTimeout);
    }
}

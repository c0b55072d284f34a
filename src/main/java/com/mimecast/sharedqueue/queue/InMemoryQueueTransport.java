package com.mimecast.sharedqueue.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory implementation of QueueTransport for testing or embedded use.
 * <p>This implementation does not persist data and is lost on application restart.
 * <p>Dequeued messages are hidden for the invisibility period and reappear unless deleted,
 * <br>which gives the same at-least-once redelivery a hosted queue provides.
 */
public class InMemoryQueueTransport implements QueueTransport {

    /**
     * Default time a dequeued message stays hidden.
     */
    public static final Duration DEFAULT_INVISIBILITY = Duration.ofSeconds(30);

    private final String name;
    private final Duration invisibility;
    private final Clock clock;

    // Insertion ordered, guarded by this.
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Constructs a new InMemoryQueueTransport instance.
     *
     * @param name Queue name.
     */
    public InMemoryQueueTransport(String name) {
        this(name, DEFAULT_INVISIBILITY, Clock.systemUTC());
    }

    /**
     * Constructs a new InMemoryQueueTransport instance.
     *
     * @param name         Queue name.
     * @param invisibility Time a dequeued message stays hidden.
     * @param clock        Clock.
     */
    public InMemoryQueueTransport(String name, Duration invisibility, Clock clock) {
        this.name = name;
        this.invisibility = invisibility;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized QueueMessage enqueue(String body) throws QueueTransportException {
        Instant now = clock.instant();
        Entry entry = new Entry(UUID.randomUUID().toString(), body, now);
        entry.visibleAt = now;
        entries.put(entry.messageId, entry);
        return entry.toMessage();
    }

    @Override
    public synchronized List<QueueMessage> dequeueBatch(int max) throws QueueTransportException {
        List<QueueMessage> batch = new ArrayList<>();
        Instant now = clock.instant();
        for (Entry entry : entries.values()) {
            if (batch.size() >= max) {
                break;
            }
            if (!entry.visibleAt.isAfter(now)) {
                entry.dequeueCount++;
                entry.visibleAt = now.plus(invisibility);
                batch.add(entry.toMessage());
            }
        }
        return batch;
    }

    @Override
    public synchronized void delete(QueueMessage message) throws QueueTransportException {
        Entry entry = entries.get(message.getMessageId());
        if (entry == null) {
            throw new QueueTransportException("Message not found in " + name + ": " + message.getMessageId());
        }
        entries.remove(message.getMessageId());
    }

    @Override
    public synchronized void release(QueueMessage message, Duration visibilityTimeout) throws QueueTransportException {
        Entry entry = entries.get(message.getMessageId());
        if (entry == null) {
            throw new QueueTransportException("Message not found in " + name + ": " + message.getMessageId());
        }
        entry.visibleAt = clock.instant().plus(visibilityTimeout);
    }

    @Override
    public synchronized QueueMessage peek() throws QueueTransportException {
        Instant now = clock.instant();
        for (Entry entry : entries.values()) {
            if (!entry.visibleAt.isAfter(now)) {
                return entry.toMessage();
            }
        }
        return null;
    }

    @Override
    public synchronized long size() {
        return entries.size();
    }

    /**
     * Take a snapshot copy of current messages for read-only inspection.
     *
     * @return List of all messages, visible or not.
     */
    public synchronized List<QueueMessage> snapshot() {
        List<QueueMessage> copy = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            copy.add(entry.toMessage());
        }
        return copy;
    }

    /**
     * Clear all messages from the queue.
     */
    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Queue entry.
     */
    private static final class Entry {
        private final String messageId;
        private final String body;
        private final Instant insertionTime;
        private int dequeueCount;
        private Instant visibleAt;

        private Entry(String messageId, String body, Instant insertionTime) {
            this.messageId = messageId;
            this.body = body;
            this.insertionTime = insertionTime;
        }

        private QueueMessage toMessage() {
            return new QueueMessage(messageId, body, dequeueCount, insertionTime);
        }
    }
}

package com.mimecast.sharedqueue.queue;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory QueueAccount.
 * <p>Queues are created on first reference and shared by name.
 * <p>A restricted account resolves no queues, like a storage account without queue service.
 */
public class InMemoryQueueAccount implements QueueAccount {

    private final String name;
    private final boolean queueCapable;
    private final ConcurrentMap<String, InMemoryQueueTransport> queues = new ConcurrentHashMap<>();

    /**
     * Constructs a new queue capable InMemoryQueueAccount instance.
     *
     * @param name Account name.
     */
    public InMemoryQueueAccount(String name) {
        this(name, true);
    }

    /**
     * Constructs a new InMemoryQueueAccount instance.
     *
     * @param name         Account name.
     * @param queueCapable Whether the account provides queues.
     */
    public InMemoryQueueAccount(String name, boolean queueCapable) {
        this.name = name;
        this.queueCapable = queueCapable;
    }

    /**
     * Gets a restricted account with no queue capability.
     *
     * @param name Account name.
     * @return InMemoryQueueAccount instance.
     */
    public static InMemoryQueueAccount restricted(String name) {
        return new InMemoryQueueAccount(name, false);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<QueueTransport> getQueue(String queueName) {
        if (!queueCapable) {
            return Optional.empty();
        }
        return Optional.of(queues.computeIfAbsent(queueName, InMemoryQueueTransport::new));
    }

    /**
     * Gets a queue as its concrete type for inspection.
     *
     * @param queueName Queue name.
     * @return InMemoryQueueTransport or null if never referenced.
     */
    public InMemoryQueueTransport getExistingQueue(String queueName) {
        return queues.get(queueName);
    }
}

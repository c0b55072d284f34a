package com.mimecast.sharedqueue.queue;

import java.util.Optional;

/**
 * Backend account owning a set of queues.
 * <p>Restricted accounts have no queue capability and resolve no queues at all.
 */
public interface QueueAccount {

    /**
     * Gets the account name.
     *
     * @return Account name.
     */
    String getName();

    /**
     * Gets a queue reference by name.
     *
     * @param queueName Queue name.
     * @return Queue or empty if the account has no queue capability.
     */
    Optional<QueueTransport> getQueue(String queueName);
}

package com.mimecast.sharedqueue.queue;

import java.time.Duration;
import java.util.List;

/**
 * Interface for queue transport implementations.
 * <p>Defines the primitives the shared queue listener needs from a physical queue.
 * <p>Dequeued messages stay in the queue, invisible, until deleted or released.
 * <br>Every dequeue increments the message's dequeue count.
 */
public interface QueueTransport {

    /**
     * Gets the queue name.
     *
     * @return Queue name.
     */
    String getName();

    /**
     * Add a message to the tail of the queue.
     *
     * @param body Message body.
     * @return The enqueued message.
     * @throws QueueTransportException Transport failure.
     */
    QueueMessage enqueue(String body) throws QueueTransportException;

    /**
     * Dequeue up to {@code max} visible messages.
     *
     * @param max Maximum number of messages.
     * @return Messages, empty if none are visible.
     * @throws QueueTransportException Transport failure.
     */
    List<QueueMessage> dequeueBatch(int max) throws QueueTransportException;

    /**
     * Delete a dequeued message.
     *
     * @param message Message.
     * @throws QueueTransportException Transport failure.
     */
    void delete(QueueMessage message) throws QueueTransportException;

    /**
     * Release a dequeued message so it becomes visible again after the given timeout.
     *
     * @param message           Message.
     * @param visibilityTimeout Time until the message is visible again.
     * @throws QueueTransportException Transport failure.
     */
    void release(QueueMessage message, Duration visibilityTimeout) throws QueueTransportException;

    /**
     * Copy a message body onto another queue.
     * <p>The source message is left untouched.
     *
     * @param destination Destination queue.
     * @param message     Message.
     * @throws QueueTransportException Transport failure.
     */
    default void copyTo(QueueTransport destination, QueueMessage message) throws QueueTransportException {
        destination.enqueue(message.getBody());
    }

    /**
     * Peek at the next visible message without dequeuing it.
     *
     * @return Message or null if none visible.
     * @throws QueueTransportException Transport failure.
     */
    QueueMessage peek() throws QueueTransportException;

    /**
     * Get the number of messages, visible or not.
     *
     * @return Size.
     * @throws QueueTransportException Transport failure.
     */
    long size() throws QueueTransportException;
}

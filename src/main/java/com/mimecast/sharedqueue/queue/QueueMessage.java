package com.mimecast.sharedqueue.queue;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Raw queue message as handed out by a {@link QueueTransport}.
 * <p>The dequeue count is owned by the transport and reflects this delivery.
 */
public class QueueMessage implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String messageId;
    private final String body;
    private final int dequeueCount;
    private final Instant insertionTime;

    /**
     * Constructs a new QueueMessage instance.
     *
     * @param messageId     Unique message id.
     * @param body          Message body.
     * @param dequeueCount  Number of times the message was dequeued, this delivery included.
     * @param insertionTime Time the message was first enqueued.
     */
    public QueueMessage(String messageId, String body, int dequeueCount, Instant insertionTime) {
        this.messageId = Objects.requireNonNull(messageId, "messageId");
        this.body = body;
        this.dequeueCount = dequeueCount;
        this.insertionTime = insertionTime;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getBody() {
        return body;
    }

    public int getDequeueCount() {
        return dequeueCount;
    }

    public Instant getInsertionTime() {
        return insertionTime;
    }

    @Override
    public String toString() {
        return "QueueMessage{messageId='" + messageId + "', dequeueCount=" + dequeueCount + "}";
    }
}

package com.mimecast.sharedqueue.trigger;

import java.time.Instant;

/**
 * Delivery details handed to a {@link TriggerHandler} alongside the payload.
 */
public class TriggerContext {
    private final String consumerId;
    private final String messageId;
    private final int dequeueCount;
    private final Instant insertionTime;

    /**
     * Constructs a new TriggerContext instance.
     *
     * @param consumerId    Consumer identifier.
     * @param messageId     Queue message id.
     * @param dequeueCount  Dequeue count of this delivery.
     * @param insertionTime Time the message was enqueued.
     */
    public TriggerContext(String consumerId, String messageId, int dequeueCount, Instant insertionTime) {
        this.consumerId = consumerId;
        this.messageId = messageId;
        this.dequeueCount = dequeueCount;
        this.insertionTime = insertionTime;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getMessageId() {
        return messageId;
    }

    public int getDequeueCount() {
        return dequeueCount;
    }

    public Instant getInsertionTime() {
        return insertionTime;
    }
}

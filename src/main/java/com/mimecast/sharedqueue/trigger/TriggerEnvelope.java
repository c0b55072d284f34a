package com.mimecast.sharedqueue.trigger;

/**
 * Decoded shared queue message.
 * <p>Transient, lives for a single dispatch.
 */
public class TriggerEnvelope {
    private final String consumerId;
    private final String payload;
    private final int dequeueCount;
    private final String messageId;

    /**
     * Constructs a new TriggerEnvelope instance.
     *
     * @param consumerId   Consumer identifier.
     * @param payload      Opaque payload.
     * @param dequeueCount Dequeue count supplied by the queue.
     * @param messageId    Queue message id.
     */
    public TriggerEnvelope(String consumerId, String payload, int dequeueCount, String messageId) {
        this.consumerId = consumerId;
        this.payload = payload;
        this.dequeueCount = dequeueCount;
        this.messageId = messageId;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getPayload() {
        return payload;
    }

    public int getDequeueCount() {
        return dequeueCount;
    }

    public String getMessageId() {
        return messageId;
    }
}

package com.mimecast.sharedqueue.trigger;

import com.mimecast.sharedqueue.queue.QueueMessage;

/**
 * Shared queue message encoding.
 */
public interface TriggerEnvelopeCodec {

    /**
     * Encode a trigger for the given consumer.
     *
     * @param consumerId Consumer identifier.
     * @param payload    Payload.
     * @return Message body.
     */
    String encode(String consumerId, String payload);

    /**
     * Decode a queue message.
     *
     * @param message Queue message.
     * @return TriggerEnvelope instance.
     * @throws EnvelopeDecodeException Malformed message.
     */
    TriggerEnvelope decode(QueueMessage message) throws EnvelopeDecodeException;
}

package com.mimecast.sharedqueue.listener;

import com.mimecast.sharedqueue.queue.QueueMessage;
import com.mimecast.sharedqueue.queue.QueueTransport;
import com.mimecast.sharedqueue.queue.QueueTransportException;
import com.mimecast.sharedqueue.trigger.TriggerEnvelopeCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Producer side of the shared queue.
 * <p>Enqueues a trigger for a consumer and wakes the listener so it does not wait out its backoff.
 */
public class TriggerMessageSender {
    private static final Logger log = LogManager.getLogger(TriggerMessageSender.class);

    private final QueueTransport sharedQueue;
    private final TriggerEnvelopeCodec codec;
    private final WakeSignal wakeSignal;

    /**
     * Constructs a new TriggerMessageSender instance.
     *
     * @param sharedQueue Shared queue.
     * @param codec       Envelope codec.
     * @param wakeSignal  Wake signal of the listener polling the shared queue.
     */
    public TriggerMessageSender(QueueTransport sharedQueue, TriggerEnvelopeCodec codec, WakeSignal wakeSignal) {
        this.sharedQueue = Objects.requireNonNull(sharedQueue, "sharedQueue");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.wakeSignal = Objects.requireNonNull(wakeSignal, "wakeSignal");
    }

    /**
     * Send a trigger.
     *
     * @param consumerId Consumer identifier.
     * @param payload    Payload.
     * @return The enqueued message.
     * @throws QueueTransportException Enqueue failed.
     */
    public QueueMessage send(String consumerId, String payload) throws QueueTransportException {
        QueueMessage message = sharedQueue.enqueue(codec.encode(consumerId, payload));
        wakeSignal.signal();
        log.debug("Trigger enqueued: uid={}, consumerId={}, queue={}", message.getMessageId(), consumerId, sharedQueue.getName());
        return message;
    }
}

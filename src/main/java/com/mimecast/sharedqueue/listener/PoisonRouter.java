package com.mimecast.sharedqueue.listener;

import com.mimecast.sharedqueue.metrics.ListenerMetrics;
import com.mimecast.sharedqueue.queue.QueueMessage;
import com.mimecast.sharedqueue.queue.QueueTransport;
import com.mimecast.sharedqueue.queue.QueueTransportException;
import com.mimecast.sharedqueue.trigger.TriggerExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Moves poison messages off the shared queue.
 * <p>The destination is picked in order, first match wins:
 * <ol>
 *   <li>The poison queue of the owning consumer's account, so poison messages stay next to their consumer</li>
 *   <li>The listener wide default poison queue in the host account</li>
 * </ol>
 * <p>The default covers consumers whose account has no queues and messages whose consumer is gone.
 * <p>A message is copied before it is deleted. If the copy fails it is released back to the
 * <br>shared queue instead, it is never deleted without a copy.
 */
public class PoisonRouter {
    private static final Logger log = LogManager.getLogger(PoisonRouter.class);

    static final String CONSUMER_TIER = "consumer";
    static final String DEFAULT_TIER = "default";

    private final QueueTransport sharedQueue;
    private final QueueTransport defaultPoisonQueue;
    private final TriggerExecutor executor;
    private final Duration releaseVisibility;

    /**
     * Constructs a new PoisonRouter instance.
     *
     * @param sharedQueue        Shared queue messages are taken from.
     * @param defaultPoisonQueue Fallback poison queue.
     * @param executor           Trigger executor resolving consumer destinations.
     * @param releaseVisibility  Visibility timeout applied when a copy fails.
     */
    public PoisonRouter(QueueTransport sharedQueue, QueueTransport defaultPoisonQueue,
                        TriggerExecutor executor, Duration releaseVisibility) {
        this.sharedQueue = Objects.requireNonNull(sharedQueue, "sharedQueue");
        this.defaultPoisonQueue = Objects.requireNonNull(defaultPoisonQueue, "defaultPoisonQueue");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.releaseVisibility = Objects.requireNonNull(releaseVisibility, "releaseVisibility");
    }

    /**
     * Resolve the poison destination of a message.
     *
     * @param message Queue message.
     * @return Consumer poison queue if usable, default poison queue otherwise.
     */
    public QueueTransport resolveDestination(QueueMessage message) {
        return executor.resolvePoisonDestination(message).orElse(defaultPoisonQueue);
    }

    /**
     * Copy the message to its poison queue then delete it from the shared queue.
     *
     * @param message Queue message.
     * @return true if copied and deleted.
     */
    public boolean route(QueueMessage message) {
        Optional<QueueTransport> consumerQueue = executor.resolvePoisonDestination(message);
        QueueTransport destination = consumerQueue.orElse(defaultPoisonQueue);
        String tier = consumerQueue.isPresent() ? CONSUMER_TIER : DEFAULT_TIER;

        try {
            sharedQueue.copyTo(destination, message);
        } catch (QueueTransportException e) {
            ListenerMetrics.incrementTransportError("copy");
            log.error("Poison copy failed, leaving message on shared queue: uid={}, destination={}, error={}",
                    message.getMessageId(), destination.getName(), e.getMessage());
            release(message);
            return false;
        }

        try {
            sharedQueue.delete(message);
        } catch (QueueTransportException e) {
            ListenerMetrics.incrementTransportError("delete");
            log.error("Poison message copied but not deleted: uid={}, destination={}, error={}",
                    message.getMessageId(), destination.getName(), e.getMessage());
            return false;
        }

        ListenerMetrics.incrementPoisoned(tier);
        log.warn("Message moved to poison queue: uid={}, dequeueCount={}, destination={}, tier={}",
                message.getMessageId(), message.getDequeueCount(), destination.getName(), tier);
        return true;
    }

    /**
     * Gets the default poison queue.
     *
     * @return QueueTransport instance.
     */
    public QueueTransport getDefaultPoisonQueue() {
        return defaultPoisonQueue;
    }

    private void release(QueueMessage message) {
        try {
            sharedQueue.release(message, releaseVisibility);
        } catch (QueueTransportException e) {
            ListenerMetrics.incrementTransportError("release");
            log.error("Release failed, message reappears after its invisibility period: uid={}, error={}",
                    message.getMessageId(), e.getMessage());
        }
    }
}

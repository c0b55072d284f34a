package com.mimecast.sharedqueue.listener;

import com.mimecast.sharedqueue.config.ListenerSettings;
import com.mimecast.sharedqueue.metrics.ListenerMetrics;
import com.mimecast.sharedqueue.queue.QueueMessage;
import com.mimecast.sharedqueue.queue.QueueTransport;
import com.mimecast.sharedqueue.queue.QueueTransportException;
import com.mimecast.sharedqueue.trigger.TriggerExecutor;
import com.mimecast.sharedqueue.trigger.TriggerResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Processes a single shared queue message end to end.
 * <p>This class is responsible for:
 * <ul>
 *   <li>Poisoning messages already past the max dequeue count before running them</li>
 *   <li>Executing the message through the {@link TriggerExecutor}</li>
 *   <li>Deleting handled and unregistered messages</li>
 *   <li>Poisoning malformed messages and failures that reached the max dequeue count</li>
 *   <li>Releasing other failures for redelivery by the queue</li>
 * </ul>
 * <p>Transport errors are logged and counted, the queue's own redelivery retries them.
 */
public class QueueMessageProcessor {
    private static final Logger log = LogManager.getLogger(QueueMessageProcessor.class);

    private final QueueTransport sharedQueue;
    private final TriggerExecutor executor;
    private final PoisonRouter poisonRouter;
    private final int maxDequeueCount;
    private final Duration visibilityTimeout;

    /**
     * Constructs a new QueueMessageProcessor instance.
     *
     * @param sharedQueue  Shared queue.
     * @param executor     Trigger executor.
     * @param poisonRouter Poison router.
     * @param settings     Listener settings.
     */
    public QueueMessageProcessor(QueueTransport sharedQueue, TriggerExecutor executor,
                                 PoisonRouter poisonRouter, ListenerSettings settings) {
        this.sharedQueue = Objects.requireNonNull(sharedQueue, "sharedQueue");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.poisonRouter = Objects.requireNonNull(poisonRouter, "poisonRouter");
        this.maxDequeueCount = settings.getMaxDequeueCount();
        this.visibilityTimeout = settings.getVisibilityTimeout();
    }

    /**
     * Process a message.
     *
     * @param message Queue message.
     */
    public void process(QueueMessage message) {
        if (!beginProcessing(message)) {
            return;
        }

        TriggerResult result = executor.execute(message);
        completeProcessing(message, result);
    }

    /**
     * Checks the dequeue count before execution.
     * <p>A message past the threshold was last seen by a listener that died mid processing.
     *
     * @param message Queue message.
     * @return true if the message should be executed.
     */
    boolean beginProcessing(QueueMessage message) {
        if (message.getDequeueCount() > maxDequeueCount) {
            log.warn("Message exceeded max dequeue count: uid={}, dequeueCount={}, maxDequeueCount={}",
                    message.getMessageId(), message.getDequeueCount(), maxDequeueCount);
            ListenerMetrics.incrementProcessed("expired");
            poisonRouter.route(message);
            return false;
        }
        return true;
    }

    /**
     * Settles a message according to its execution result.
     *
     * @param message Queue message.
     * @param result  Execution result.
     */
    void completeProcessing(QueueMessage message, TriggerResult result) {
        ListenerMetrics.incrementProcessed(result.getStatus().name().toLowerCase(Locale.ROOT));

        switch (result.getStatus()) {
            case SUCCEEDED:
            case UNREGISTERED:
                delete(message);
                break;

            case MALFORMED:
                poisonRouter.route(message);
                break;

            case FAILED:
            default:
                if (message.getDequeueCount() >= maxDequeueCount) {
                    poisonRouter.route(message);
                } else {
                    release(message);
                }
                break;
        }
    }

    private void delete(QueueMessage message) {
        try {
            sharedQueue.delete(message);
            log.debug("Message deleted: uid={}", message.getMessageId());
        } catch (QueueTransportException e) {
            ListenerMetrics.incrementTransportError("delete");
            log.error("Delete failed, message will be redelivered: uid={}, error={}",
                    message.getMessageId(), e.getMessage());
        }
    }

    private void release(QueueMessage message) {
        try {
            sharedQueue.release(message, visibilityTimeout);
            log.info("Message released for retry: uid={}, dequeueCount={}, maxDequeueCount={}",
                    message.getMessageId(), message.getDequeueCount(), maxDequeueCount);
        } catch (QueueTransportException e) {
            ListenerMetrics.incrementTransportError("release");
            log.error("Release failed, message reappears after its invisibility period: uid={}, error={}",
                    message.getMessageId(), e.getMessage());
        }
    }
}

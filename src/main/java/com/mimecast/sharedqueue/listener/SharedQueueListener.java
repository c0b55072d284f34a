package com.mimecast.sharedqueue.listener;

import com.mimecast.sharedqueue.queue.QueueAccount;
import com.mimecast.sharedqueue.trigger.Registration;
import com.mimecast.sharedqueue.trigger.TriggerExecutor;
import com.mimecast.sharedqueue.trigger.TriggerHandler;

import java.io.Closeable;
import java.util.Objects;

/**
 * Shared queue listener.
 * <p>One poll loop serving every registered consumer.
 * <br>Consumers may register and unregister while the listener runs.
 *
 * @see SharedQueueListenerFactory
 */
public class SharedQueueListener implements Closeable {

    private final QueueListener listener;
    private final TriggerExecutor executor;
    private final String poisonQueueName;

    /**
     * Constructs a new SharedQueueListener instance.
     *
     * @param listener        Poll loop.
     * @param executor        Trigger executor.
     * @param poisonQueueName Poison queue name used for account registrations.
     */
    public SharedQueueListener(QueueListener listener, TriggerExecutor executor, String poisonQueueName) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.poisonQueueName = Objects.requireNonNull(poisonQueueName, "poisonQueueName");
    }

    /**
     * Register a consumer.
     *
     * @param registration Registration.
     * @throws IllegalArgumentException If the consumer is already registered.
     */
    public void register(Registration registration) {
        executor.register(registration);
    }

    /**
     * Register a consumer whose poison messages go to its own account.
     *
     * @param consumerId Consumer identifier.
     * @param handler    Trigger handler.
     * @param account    Consumer's backend account.
     * @throws IllegalArgumentException If the consumer is already registered.
     */
    public void register(String consumerId, TriggerHandler handler, QueueAccount account) {
        executor.register(Registration.forAccount(consumerId, handler, account, poisonQueueName));
    }

    /**
     * Unregister a consumer.
     * <p>Messages still queued for it are dropped when dequeued.
     *
     * @param consumerId Consumer identifier.
     * @return true if a registration was removed.
     */
    public boolean unregister(String consumerId) {
        return executor.unregister(consumerId);
    }

    /**
     * Start polling.
     */
    public void start() {
        listener.start();
    }

    /**
     * Stop polling and drain in-flight messages.
     * <p>Handlers still running after the drain are interrupted.
     */
    public void stop() {
        listener.stop();
        executor.shutdown();
    }

    @Override
    public void close() {
        stop();
    }

    public ListenerState getState() {
        return listener.getState();
    }

    public QueueListener getListener() {
        return listener;
    }
}

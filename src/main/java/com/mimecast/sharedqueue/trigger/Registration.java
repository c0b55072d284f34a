package com.mimecast.sharedqueue.trigger;

import com.mimecast.sharedqueue.queue.QueueAccount;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Binding between a consumer identifier, its handler and its poison destination.
 * <p>Immutable once created.
 */
public final class Registration {
    private final String consumerId;
    private final TriggerHandler handler;
    private final PoisonDestinationResolver poisonDestination;

    /**
     * Constructs a new Registration instance.
     *
     * @param consumerId        Consumer identifier.
     * @param handler           Trigger handler.
     * @param poisonDestination Consumer specific poison destination resolver.
     */
    public Registration(String consumerId, TriggerHandler handler, PoisonDestinationResolver poisonDestination) {
        if (StringUtils.isBlank(consumerId)) {
            throw new IllegalArgumentException("consumerId must not be blank");
        }
        this.consumerId = consumerId;
        this.handler = Objects.requireNonNull(handler, "handler");
        this.poisonDestination = poisonDestination != null ? poisonDestination : PoisonDestinationResolver.NONE;
    }

    /**
     * Registration whose poison messages go to the named queue of the consumer's own account.
     * <p>Restricted accounts resolve nothing and fall back to the default poison queue.
     *
     * @param consumerId      Consumer identifier.
     * @param handler         Trigger handler.
     * @param account         Consumer's backend account.
     * @param poisonQueueName Poison queue name.
     * @return Registration instance.
     */
    public static Registration forAccount(String consumerId, TriggerHandler handler, QueueAccount account, String poisonQueueName) {
        Objects.requireNonNull(account, "account");
        return new Registration(consumerId, handler, () -> account.getQueue(poisonQueueName));
    }

    public String getConsumerId() {
        return consumerId;
    }

    public TriggerHandler getHandler() {
        return handler;
    }

    public PoisonDestinationResolver getPoisonDestination() {
        return poisonDestination;
    }
}

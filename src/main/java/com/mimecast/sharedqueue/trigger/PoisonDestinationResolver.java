package com.mimecast.sharedqueue.trigger;

import com.mimecast.sharedqueue.queue.QueueTransport;

import java.util.Optional;

/**
 * Resolves the consumer specific poison queue.
 */
@FunctionalInterface
public interface PoisonDestinationResolver {

    /**
     * Resolver for consumers without a poison queue of their own.
     */
    PoisonDestinationResolver NONE = Optional::empty;

    /**
     * Resolve the destination.
     *
     * @return Poison queue or empty when the consumer has none usable.
     */
    Optional<QueueTransport> resolveDestination();
}

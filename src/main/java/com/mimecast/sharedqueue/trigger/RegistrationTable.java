package com.mimecast.sharedqueue.trigger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Consumer registrations keyed by consumer identifier.
 * <p>Looked up for every dispatched message while consumers may come and go,
 * <br>so reads share a read lock and only register and unregister take the write lock.
 */
public class RegistrationTable {
    private static final Logger log = LogManager.getLogger(RegistrationTable.class);

    private final Map<String, Registration> registrations = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    /**
     * Register a consumer.
     *
     * @param registration Registration.
     * @throws IllegalArgumentException If the consumer is already registered.
     */
    public void register(Registration registration) {
        writeLock.lock();
        try {
            String consumerId = registration.getConsumerId();
            if (registrations.containsKey(consumerId)) {
                throw new IllegalArgumentException("Consumer already registered: " + consumerId);
            }
            registrations.put(consumerId, registration);
            log.info("Registered consumer: consumerId={}, registrations={}", consumerId, registrations.size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Unregister a consumer.
     *
     * @param consumerId Consumer identifier.
     * @return true if a registration was removed.
     */
    public boolean unregister(String consumerId) {
        writeLock.lock();
        try {
            boolean removed = registrations.remove(consumerId) != null;
            if (removed) {
                log.info("Unregistered consumer: consumerId={}, registrations={}", consumerId, registrations.size());
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Lookup a consumer.
     *
     * @param consumerId Consumer identifier.
     * @return Registration or empty if unknown.
     */
    public Optional<Registration> lookup(String consumerId) {
        if (consumerId == null) {
            return Optional.empty();
        }
        readLock.lock();
        try {
            return Optional.ofNullable(registrations.get(consumerId));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Get the number of registrations.
     *
     * @return Size.
     */
    public int size() {
        readLock.lock();
        try {
            return registrations.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Take a sorted snapshot of registered consumer identifiers.
     *
     * @return Set of identifiers.
     */
    public Set<String> ids() {
        readLock.lock();
        try {
            return new TreeSet<>(registrations.keySet());
        } finally {
            readLock.unlock();
        }
    }
}

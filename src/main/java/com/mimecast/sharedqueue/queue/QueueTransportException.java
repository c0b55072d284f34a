package com.mimecast.sharedqueue.queue;

/**
 * Transient queue transport failure.
 * <p>Callers log it and retry on the next poll cycle.
 */
public class QueueTransportException extends Exception {

    /**
     * Constructs a new QueueTransportException instance.
     *
     * @param message Error message.
     */
    public QueueTransportException(String message) {
        super(message);
    }

    /**
     * Constructs a new QueueTransportException instance with cause.
     *
     * @param message Error message.
     * @param cause   Cause.
     */
    public QueueTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mimecast.sharedqueue.trigger;

/**
 * Malformed shared queue message.
 * <p>Such a message can never succeed so it goes straight to the poison queue.
 */
public class EnvelopeDecodeException extends Exception {

    /**
     * Constructs a new EnvelopeDecodeException instance.
     *
     * @param message Error message.
     */
    public EnvelopeDecodeException(String message) {
        super(message);
    }

    /**
     * Constructs a new EnvelopeDecodeException instance with cause.
     *
     * @param message Error message.
     * @param cause   Cause.
     */
    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mimecast.sharedqueue.config;

/**
 * Invalid or missing configuration.
 * <p>Thrown at construction time only so a listener never starts in an invalid state.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Constructs a new ConfigurationException instance.
     *
     * @param message Error message.
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new ConfigurationException instance with cause.
     *
     * @param message Error message.
     * @param cause   Cause.
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

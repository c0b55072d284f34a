/**
 * Listener configuration.
 *
 * <p>Configuration is read from a JSON5 file, by default {@code cfg/listener.json5}.
 * <br>{@link com.mimecast.sharedqueue.config.ListenerConfig} gives typed access to the raw values
 * <br>and {@link com.mimecast.sharedqueue.config.ListenerSettings} holds the validated result.
 *
 * <p>An invalid value is reported as a {@link com.mimecast.sharedqueue.config.ConfigurationException}
 * <br>when the settings are built, before any listener is created.
 *
 * <p><b>Example:</b>
 * <pre>
 * {
 *   minimumPollingIntervalMillis: 100,
 *   maximumPollingIntervalMillis: 60000,
 *   batchSize: 16,
 *   maxDequeueCount: 5,
 *   drainTimeoutMillis: 30000
 * }
 * </pre>
 */
package com.mimecast.sharedqueue.config;

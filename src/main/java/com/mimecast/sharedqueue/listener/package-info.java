/**
 * Shared queue listener.
 *
 * <p>A single {@link com.mimecast.sharedqueue.listener.QueueListener} polls the shared queue
 * <br>on behalf of every registered consumer, backing off with
 * <br>{@link com.mimecast.sharedqueue.listener.RandomizedExponentialBackoffStrategy} while the queue is empty.
 *
 * <p>Producers enqueue through {@link com.mimecast.sharedqueue.listener.TriggerMessageSender}
 * <br>which raises the listener's {@link com.mimecast.sharedqueue.listener.WakeSignal}.
 *
 * <h2>Message outcomes:</h2>
 * <ul>
 *     <li><b>Handled</b> - deleted</li>
 *     <li><b>Unregistered consumer</b> - deleted, never poisoned</li>
 *     <li><b>Malformed</b> - poisoned on first sight</li>
 *     <li><b>Handler failure</b> - released for redelivery, poisoned at the max dequeue count</li>
 * </ul>
 *
 * <p>{@link com.mimecast.sharedqueue.listener.PoisonRouter} decides the poison queue, the consumer's
 * <br>own account first and the host account's default poison queue otherwise.
 *
 * @see com.mimecast.sharedqueue.listener.SharedQueueListenerFactory
 */
package com.mimecast.sharedqueue.listener;

/**
 * Queue transport abstraction.
 *
 * <p>The shared queue listener only needs a handful of primitives from a physical queue:
 * <br>batch dequeue, delete, release and copy. These are defined by
 * {@link com.mimecast.sharedqueue.queue.QueueTransport}.
 *
 * <p>Queues belong to a {@link com.mimecast.sharedqueue.queue.QueueAccount}.
 * <br>Restricted accounts have no queue capability which is what forces poison messages
 * <br>onto the host account's default poison queue.
 *
 * <h2>Implementations:</h2>
 * <ul>
 *     <li><b>InMemory</b> - visibility timeout and dequeue counting without persistence</li>
 * </ul>
 *
 * @see com.mimecast.sharedqueue.queue.QueueTransport
 * @see com.mimecast.sharedqueue.queue.InMemoryQueueTransport
 */
package com.mimecast.sharedqueue.queue;

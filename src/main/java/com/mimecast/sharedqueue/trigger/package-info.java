/**
 * Trigger dispatch.
 *
 * <p>Many consumers share one physical queue. Each message carries the identifier of the
 * <br>consumer it is meant for and {@link com.mimecast.sharedqueue.trigger.TriggerExecutor}
 * <br>routes it to the matching {@link com.mimecast.sharedqueue.trigger.Registration}.
 *
 * <p>A registration also knows where its poison messages belong through a
 * <br>{@link com.mimecast.sharedqueue.trigger.PoisonDestinationResolver}, normally a queue in
 * <br>the consumer's own backend account.
 *
 * @see com.mimecast.sharedqueue.trigger.RegistrationTable
 * @see com.mimecast.sharedqueue.trigger.GsonTriggerEnvelopeCodec
 */
package com.mimecast.sharedqueue.trigger;

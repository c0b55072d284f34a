package com.mimecast.sharedqueue.trigger;

/**
 * Consumer callback invoked for each trigger addressed to it.
 * <p>Any exception counts as a failed attempt and the message is redelivered
 * <br>until the poison threshold is reached. Handlers enforce their own deadlines.
 */
@FunctionalInterface
public interface TriggerHandler {

    /**
     * Handle a trigger.
     *
     * @param payload Payload.
     * @param context Delivery details.
     * @throws Exception Processing failed.
     */
    void handle(String payload, TriggerContext context) throws Exception;
}

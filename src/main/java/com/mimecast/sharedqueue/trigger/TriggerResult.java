package com.mimecast.sharedqueue.trigger;

/**
 * Outcome of executing a single shared queue message.
 */
public final class TriggerResult {

    /**
     * Outcome status.
     */
    public enum Status {
        /**
         * Handler completed.
         */
        SUCCEEDED,
        /**
         * Handler threw, subject to redelivery.
         */
        FAILED,
        /**
         * Envelope could not be decoded, never retried.
         */
        MALFORMED,
        /**
         * No registration for the consumer, dropped without poisoning.
         */
        UNREGISTERED
    }

    private static final TriggerResult SUCCEEDED = new TriggerResult(Status.SUCCEEDED, null, null);

    private final Status status;
    private final String consumerId;
    private final Throwable cause;

    private TriggerResult(Status status, String consumerId, Throwable cause) {
        this.status = status;
        this.consumerId = consumerId;
        this.cause = cause;
    }

    public static TriggerResult succeeded() {
        return SUCCEEDED;
    }

    public static TriggerResult failed(String consumerId, Throwable cause) {
        return new TriggerResult(Status.FAILED, consumerId, cause);
    }

    public static TriggerResult malformed(Throwable cause) {
        return new TriggerResult(Status.MALFORMED, null, cause);
    }

    public static TriggerResult unregistered(String consumerId) {
        return new TriggerResult(Status.UNREGISTERED, consumerId, null);
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Gets the consumer identifier.
     *
     * @return Identifier, null for successes and malformed messages.
     */
    public String getConsumerId() {
        return consumerId;
    }

    /**
     * Gets the failure cause.
     *
     * @return Throwable, null unless failed or malformed.
     */
    public Throwable getCause() {
        return cause;
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    @Override
    public String toString() {
        return "TriggerResult{status=" + status + (consumerId != null ? ", consumerId=" + consumerId : "") + "}";
    }
}

package com.mimecast.sharedqueue.trigger;

import com.mimecast.sharedqueue.queue.QueueMessage;
import com.mimecast.sharedqueue.queue.QueueTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches shared queue messages to registered consumers.
 * <p>This class is responsible for:
 * <ul>
 *   <li>Decoding the raw message into a {@link TriggerEnvelope}</li>
 *   <li>Resolving the consumer through the {@link RegistrationTable}</li>
 *   <li>Invoking the consumer's handler and reporting the outcome</li>
 *   <li>Resolving the consumer specific poison destination of a message</li>
 * </ul>
 * <p>With a handler timeout every handler runs on a dedicated pool and is cancelled once the timeout
 * <br>elapses, so a hung handler cannot hold the calling worker. Without one handlers run inline.
 * <p>Safe for concurrent use.
 */
public class TriggerExecutor {
    private static final Logger log = LogManager.getLogger(TriggerExecutor.class);

    private final RegistrationTable registrations;
    private final TriggerEnvelopeCodec codec;
    private final Duration handlerTimeout;

    /**
     * Handler pool, null when handlers run inline.
     */
    private final ThreadPoolExecutor handlerPool;

    /**
     * Constructs a new TriggerExecutor instance running handlers inline.
     *
     * @param registrations Registration table.
     * @param codec         Envelope codec.
     */
    public TriggerExecutor(RegistrationTable registrations, TriggerEnvelopeCodec codec) {
        this(registrations, codec, null);
    }

    /**
     * Constructs a new TriggerExecutor instance.
     *
     * @param registrations  Registration table.
     * @param codec          Envelope codec.
     * @param handlerTimeout Time a handler may run, null for no limit.
     */
    public TriggerExecutor(RegistrationTable registrations, TriggerEnvelopeCodec codec, Duration handlerTimeout) {
        this.registrations = Objects.requireNonNull(registrations, "registrations");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.handlerTimeout = handlerTimeout;

        if (handlerTimeout != null) {
            AtomicInteger threadCount = new AtomicInteger();
            this.handlerPool = new ThreadPoolExecutor(
                    0, Integer.MAX_VALUE,
                    60L, TimeUnit.SECONDS,
                    new SynchronousQueue<>(),
                    r -> {
                        Thread thread = new Thread(r, "SharedQueueHandler-" + threadCount.incrementAndGet());
                        thread.setDaemon(true);
                        return thread;
                    }
            );
        } else {
            this.handlerPool = null;
        }
    }

    /**
     * Register a consumer.
     *
     * @param registration Registration.
     */
    public void register(Registration registration) {
        registrations.register(registration);
    }

    /**
     * Unregister a consumer.
     *
     * @param consumerId Consumer identifier.
     * @return true if a registration was removed.
     */
    public boolean unregister(String consumerId) {
        return registrations.unregister(consumerId);
    }

    /**
     * Try get a registration.
     *
     * @param consumerId Consumer identifier.
     * @return Registration or empty if unknown.
     */
    public Optional<Registration> getRegistration(String consumerId) {
        return registrations.lookup(consumerId);
    }

    /**
     * Execute a message.
     * <p>Never throws, every outcome is reported through the result.
     *
     * @param message Queue message.
     * @return TriggerResult instance.
     */
    public TriggerResult execute(QueueMessage message) {
        TriggerEnvelope envelope;
        try {
            envelope = codec.decode(message);
        } catch (EnvelopeDecodeException e) {
            log.warn("Malformed message: uid={}, dequeueCount={}, error={}",
                    message.getMessageId(), message.getDequeueCount(), e.getMessage());
            return TriggerResult.malformed(e);
        }

        Optional<Registration> registration = registrations.lookup(envelope.getConsumerId());
        if (registration.isEmpty()) {
            log.info("No registration for consumer, dropping message: uid={}, consumerId={}",
                    message.getMessageId(), envelope.getConsumerId());
            return TriggerResult.unregistered(envelope.getConsumerId());
        }

        TriggerContext context = new TriggerContext(envelope.getConsumerId(), message.getMessageId(),
                message.getDequeueCount(), message.getInsertionTime());
        try {
            invoke(registration.get().getHandler(), envelope.getPayload(), context);
            log.debug("Handler succeeded: uid={}, consumerId={}", message.getMessageId(), envelope.getConsumerId());
            return TriggerResult.succeeded();

        } catch (TimeoutException e) {
            log.error("Handler timed out: uid={}, consumerId={}, dequeueCount={}, timeout={}",
                    message.getMessageId(), envelope.getConsumerId(), message.getDequeueCount(), handlerTimeout);
            return TriggerResult.failed(envelope.getConsumerId(), e);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Handler interrupted: uid={}, consumerId={}", message.getMessageId(), envelope.getConsumerId());
            return TriggerResult.failed(envelope.getConsumerId(), e);

        } catch (Exception e) {
            log.error("Handler failed: uid={}, consumerId={}, dequeueCount={}, error={}",
                    message.getMessageId(), envelope.getConsumerId(), message.getDequeueCount(), e.getMessage());
            return TriggerResult.failed(envelope.getConsumerId(), e);
        }
    }

    /**
     * Run a handler, bounded by the handler timeout when one is set.
     *
     * @param handler Trigger handler.
     * @param payload Payload.
     * @param context Trigger context.
     * @throws TimeoutException     Handler ran past the timeout and was cancelled.
     * @throws InterruptedException Calling thread interrupted while waiting, the handler is cancelled.
     * @throws Exception            Whatever the handler threw.
     */
    private void invoke(TriggerHandler handler, String payload, TriggerContext context) throws Exception {
        if (handlerPool == null) {
            handler.handle(payload, context);
            return;
        }

        Future<Void> future = handlerPool.submit(() -> {
            handler.handle(payload, context);
            return null;
        });
        try {
            future.get(handlerTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw (Exception) cause;
        }
    }

    /**
     * Stops the handler pool, interrupting running handlers.
     */
    public void shutdown() {
        if (handlerPool != null) {
            handlerPool.shutdownNow();
        }
    }

    /**
     * Resolve the consumer specific poison destination of a message.
     *
     * @param message Queue message.
     * @return Poison queue or empty if the message is malformed, its consumer is gone
     * or the consumer has no usable poison queue.
     */
    public Optional<QueueTransport> resolvePoisonDestination(QueueMessage message) {
        TriggerEnvelope envelope;
        try {
            envelope = codec.decode(message);
        } catch (EnvelopeDecodeException e) {
            log.debug("No consumer poison destination for malformed message: uid={}", message.getMessageId());
            return Optional.empty();
        }

        Optional<Registration> registration = registrations.lookup(envelope.getConsumerId());
        if (registration.isEmpty()) {
            return Optional.empty();
        }

        try {
            return registration.get().getPoisonDestination().resolveDestination();
        } catch (RuntimeException e) {
            log.warn("Unable to resolve poison destination: uid={}, consumerId={}, error={}",
                    message.getMessageId(), envelope.getConsumerId(), e.getMessage());
            return Optional.empty();
        }
    }
}

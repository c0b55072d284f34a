package com.mimecast.sharedqueue.listener;

import com.mimecast.sharedqueue.config.ConfigurationException;
import com.mimecast.sharedqueue.config.ListenerSettings;
import com.mimecast.sharedqueue.queue.QueueAccount;
import com.mimecast.sharedqueue.queue.QueueTransport;
import com.mimecast.sharedqueue.trigger.GsonTriggerEnvelopeCodec;
import com.mimecast.sharedqueue.trigger.RegistrationTable;
import com.mimecast.sharedqueue.trigger.TriggerEnvelopeCodec;
import com.mimecast.sharedqueue.trigger.TriggerExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds {@link SharedQueueListener} instances.
 *
 * <p>The poison queue for a message lives in the account of its consumer by default.
 * <br>With consumers spread over several accounts poison messages therefore end up in different queues.
 * <p>The host account provides the default poison queue for consumers in restricted accounts
 * <br>without queues and for messages whose consumer can no longer be resolved.
 */
public class SharedQueueListenerFactory {
    private static final Logger log = LogManager.getLogger(SharedQueueListenerFactory.class);

    private final QueueAccount hostAccount;
    private final QueueTransport sharedQueue;
    private final ListenerSettings settings;
    private final WakeSignal wakeSignal;
    private final TriggerEnvelopeCodec codec;

    /**
     * Constructs a new SharedQueueListenerFactory instance using the JSON envelope codec.
     *
     * @param hostAccount Host account.
     * @param sharedQueue Shared queue.
     * @param settings    Listener settings.
     * @param wakeSignal  Wake signal.
     * @throws ConfigurationException On a missing collaborator.
     */
    public SharedQueueListenerFactory(QueueAccount hostAccount, QueueTransport sharedQueue,
                                      ListenerSettings settings, WakeSignal wakeSignal) {
        this(hostAccount, sharedQueue, settings, wakeSignal, new GsonTriggerEnvelopeCodec());
    }

    /**
     * Constructs a new SharedQueueListenerFactory instance.
     *
     * @param hostAccount Host account.
     * @param sharedQueue Shared queue.
     * @param settings    Listener settings.
     * @param wakeSignal  Wake signal.
     * @param codec       Envelope codec.
     * @throws ConfigurationException On a missing collaborator.
     */
    public SharedQueueListenerFactory(QueueAccount hostAccount, QueueTransport sharedQueue,
                                      ListenerSettings settings, WakeSignal wakeSignal, TriggerEnvelopeCodec codec) {
        this.hostAccount = require(hostAccount, "hostAccount");
        this.sharedQueue = require(sharedQueue, "sharedQueue");
        this.settings = require(settings, "settings");
        this.wakeSignal = require(wakeSignal, "wakeSignal");
        this.codec = require(codec, "codec");
    }

    /**
     * Create a listener.
     *
     * @return SharedQueueListener instance, not started.
     * @throws ConfigurationException If the host account has no queue capability.
     */
    public SharedQueueListener create() {
        QueueTransport defaultPoisonQueue = hostAccount.getQueue(settings.getPoisonQueueName())
                .orElseThrow(() -> new ConfigurationException("Host account " + hostAccount.getName()
                        + " has no queue capability for the default poison queue"));

        DelayStrategy delayStrategy = new RandomizedExponentialBackoffStrategy(
                settings.getMinimumPollingInterval(), settings.getMaximumPollingInterval());

        TriggerExecutor executor = new TriggerExecutor(new RegistrationTable(), codec, settings.getHandlerTimeout());
        PoisonRouter poisonRouter = new PoisonRouter(sharedQueue, defaultPoisonQueue, executor, settings.getVisibilityTimeout());
        QueueMessageProcessor processor = new QueueMessageProcessor(sharedQueue, executor, poisonRouter, settings);
        QueueListener listener = new QueueListener(sharedQueue, processor, delayStrategy, wakeSignal, settings);

        log.info("Created shared queue listener: queue={}, defaultPoisonQueue={}, hostAccount={}",
                sharedQueue.getName(), defaultPoisonQueue.getName(), hostAccount.getName());
        return new SharedQueueListener(listener, executor, settings.getPoisonQueueName());
    }

    /**
     * Create a producer for the shared queue wired to the same wake signal.
     *
     * @return TriggerMessageSender instance.
     */
    public TriggerMessageSender createSender() {
        return new TriggerMessageSender(sharedQueue, codec, wakeSignal);
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new ConfigurationException(name + " must not be null");
        }
        return value;
    }
}

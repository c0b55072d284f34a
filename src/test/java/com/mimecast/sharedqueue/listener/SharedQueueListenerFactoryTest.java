package com.mimecast.sharedqueue.listener;

import com.mimecast.sharedqueue.config.ConfigurationException;
import com.mimecast.sharedqueue.config.ListenerSettings;
import com.mimecast.sharedqueue.queue.InMemoryQueueAccount;
import com.mimecast.sharedqueue.queue.InMemoryQueueTransport;
import com.mimecast.sharedqueue.queue.QueueMessage;
import com.mimecast.sharedqueue.queue.QueueTransportException;
import com.mimecast.sharedqueue.trigger.GsonTriggerEnvelopeCodec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SharedQueueListenerFactoryTest {

    private final ListenerSettings settings = ListenerSettings.builder().build();

    @Test
    void testMissingCollaboratorsRejected() {
        InMemoryQueueAccount host = new InMemoryQueueAccount("host");
        InMemoryQueueTransport shared = new InMemoryQueueTransport("shared");
        WakeSignal signal = new WakeSignal();

        assertThrows(ConfigurationException.class, () -> new SharedQueueListenerFactory(null, shared, settings, signal));
        assertThrows(ConfigurationException.class, () -> new SharedQueueListenerFactory(host, null, settings, signal));
        assertThrows(ConfigurationException.class, () -> new SharedQueueListenerFactory(host, shared, null, signal));
        assertThrows(ConfigurationException.class, () -> new SharedQueueListenerFactory(host, shared, settings, null));
        assertThrows(ConfigurationException.class, () -> new SharedQueueListenerFactory(host, shared, settings, signal, null));
    }

    @Test
    void testRestrictedHostAccountRejected() {
        SharedQueueListenerFactory factory = new SharedQueueListenerFactory(InMemoryQueueAccount.restricted("blob-only"),
                new InMemoryQueueTransport("shared"), settings, new WakeSignal());

        assertThrows(ConfigurationException.class, factory::create);
    }

    @Test
    void testCreatesIdleListenerWithHostPoisonQueue() {
        InMemoryQueueAccount host = new InMemoryQueueAccount("host");
        SharedQueueListener listener = new SharedQueueListenerFactory(host, new InMemoryQueueTransport("shared"),
                settings, new WakeSignal()).create();

        assertEquals(ListenerState.IDLE, listener.getState());
        assertNotNull(host.getExistingQueue(ListenerSettings.DEFAULT_POISON_QUEUE_NAME),
                "Default poison queue should be resolved from the host account");
        listener.stop();
    }

    @Test
    void testSenderEnqueuesEnvelopeAndSignals() throws QueueTransportException {
        InMemoryQueueTransport shared = new InMemoryQueueTransport("shared");
        WakeSignal signal = new WakeSignal();
        TriggerMessageSender sender = new SharedQueueListenerFactory(new InMemoryQueueAccount("host"), shared,
                settings, signal).createSender();

        QueueMessage message = sender.send("orders", "order-42");

        assertEquals(1, shared.size());
        assertTrue(signal.isPending(), "Sending should raise the wake signal");
        assertEquals(new GsonTriggerEnvelopeCodec().encode("orders", "order-42"), message.getBody());
    }
}

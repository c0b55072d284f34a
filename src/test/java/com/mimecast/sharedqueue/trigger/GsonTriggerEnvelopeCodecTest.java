package com.mimecast.sharedqueue.trigger;

import com.mimecast.sharedqueue.queue.QueueMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GsonTriggerEnvelopeCodecTest {

    private final GsonTriggerEnvelopeCodec codec = new GsonTriggerEnvelopeCodec();

    private static QueueMessage message(String body) {
        return new QueueMessage("msg-1", body, 2, Instant.EPOCH);
    }

    @Test
    void testEncodedMessageDecodes() throws EnvelopeDecodeException {
        String body = codec.encode("orders", "{\"orderId\":42}");

        TriggerEnvelope envelope = codec.decode(message(body));

        assertEquals("orders", envelope.getConsumerId());
        assertEquals("{\"orderId\":42}", envelope.getPayload());
        assertEquals(2, envelope.getDequeueCount());
        assertEquals("msg-1", envelope.getMessageId());
    }

    @Test
    void testObjectPayloadIsKeptAsJson() throws EnvelopeDecodeException {
        TriggerEnvelope envelope = codec.decode(message(
                "{\"type\":\"SharedTrigger\",\"consumerId\":\"orders\",\"payload\":{\"orderId\":42}}"));

        assertEquals("{\"orderId\":42}", envelope.getPayload());
    }

    @Test
    void testMissingPayloadIsNull() throws EnvelopeDecodeException {
        TriggerEnvelope envelope = codec.decode(message("{\"type\":\"SharedTrigger\",\"consumerId\":\"orders\"}"));

        assertNull(envelope.getPayload());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "not json at all {",
            "[1, 2, 3]",
            "\"just a string\"",
            "{\"consumerId\":\"orders\",\"payload\":\"x\"}",
            "{\"type\":\"BlobTrigger\",\"consumerId\":\"orders\"}",
            "{\"type\":\"SharedTrigger\",\"payload\":\"x\"}",
            "{\"type\":\"SharedTrigger\",\"consumerId\":\" \"}",
            "{\"type\":\"SharedTrigger\",\"consumerId\":{\"id\":1}}"
    })
    void testMalformedMessagesRejected(String body) {
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode(message(body)));
    }

    @Test
    void testNullBodyRejected() {
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode(message(null)));
    }
}

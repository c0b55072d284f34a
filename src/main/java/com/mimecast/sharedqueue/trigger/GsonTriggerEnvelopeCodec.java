package com.mimecast.sharedqueue.trigger;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.mimecast.sharedqueue.queue.QueueMessage;
import org.apache.commons.lang3.StringUtils;

/**
 * JSON envelope codec.
 * <p>Messages look like:
 * <pre>
 * {"type": "SharedTrigger", "consumerId": "orders", "payload": "..."}
 * </pre>
 * <p>A payload that is not a JSON string is handed over in its JSON form.
 */
public class GsonTriggerEnvelopeCodec implements TriggerEnvelopeCodec {

    public static final String TYPE = "SharedTrigger";

    private final Gson gson = new Gson();

    @Override
    public String encode(String consumerId, String payload) {
        JsonObject json = new JsonObject();
        json.addProperty("type", TYPE);
        json.addProperty("consumerId", consumerId);
        json.addProperty("payload", payload);
        return gson.toJson(json);
    }

    @Override
    public TriggerEnvelope decode(QueueMessage message) throws EnvelopeDecodeException {
        if (StringUtils.isBlank(message.getBody())) {
            throw new EnvelopeDecodeException("Empty message body");
        }

        JsonElement element;
        try {
            element = JsonParser.parseString(message.getBody());
        } catch (JsonParseException e) {
            throw new EnvelopeDecodeException("Invalid JSON: " + e.getMessage(), e);
        }

        if (!element.isJsonObject()) {
            throw new EnvelopeDecodeException("Message is not a JSON object");
        }
        JsonObject json = element.getAsJsonObject();

        String type = getString(json, "type");
        if (!TYPE.equals(type)) {
            throw new EnvelopeDecodeException("Unsupported message type: " + type);
        }

        String consumerId = getString(json, "consumerId");
        if (StringUtils.isBlank(consumerId)) {
            throw new EnvelopeDecodeException("Missing consumerId");
        }

        String payload = null;
        JsonElement payloadElement = json.get("payload");
        if (payloadElement != null && !payloadElement.isJsonNull()) {
            payload = payloadElement.isJsonPrimitive() && payloadElement.getAsJsonPrimitive().isString()
                    ? payloadElement.getAsString()
                    : gson.toJson(payloadElement);
        }

        return new TriggerEnvelope(consumerId, payload, message.getDequeueCount(), message.getMessageId());
    }

    private static String getString(JsonObject json, String name) throws EnvelopeDecodeException {
        JsonElement value = json.get(name);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new EnvelopeDecodeException("Field " + name + " is not a string");
        }
        return value.getAsString();
    }
}

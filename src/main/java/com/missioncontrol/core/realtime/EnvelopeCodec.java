package com.missioncontrol.core.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.realtime.message.EventEnvelope;
import com.missioncontrol.core.realtime.message.EventType;
import com.missioncontrol.core.realtime.message.SubscriptionPayload;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Set;

/**
 * JSON encoding of {@link EventEnvelope}s for both transports, and decoding of the few
 * envelope types clients may send.
 * <p>
 * Inbound frames are dispatched on the {@code type} discriminator before the payload is
 * bound to its record, so nothing downstream handles an untyped payload.
 */
@Component
public class EnvelopeCodec {

    private static final Set<EventType> INBOUND_TYPES = Set.of(EventType.SUBSCRIBE, EventType.UNSUBSCRIBE);

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writer().without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Codec over a standalone mapper with the java.time module registered.
     */
    public static EnvelopeCodec withDefaults() {
        return new EnvelopeCodec(JsonMapper.builder()
                .findAndAddModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public String encode(EventEnvelope envelope) {
        try {
            return writer.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + envelope.type().wireName() + " envelope", e);
        }
    }

    /**
     * Decodes a client frame.
     *
     * @throws ValidationException if the frame is not JSON, has no known type, has a type
     *                             clients may not send, or carries a malformed payload
     */
    public EventEnvelope decodeInbound(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Message is not valid JSON");
        }
        if (node == null || !node.isObject()) {
            throw new ValidationException("Message must be a JSON object");
        }

        String wireType = node.path("type").asText("");
        EventType type = EventType.fromWire(wireType)
                .filter(INBOUND_TYPES::contains)
                .orElseThrow(() -> new ValidationException("Unsupported message type '" + wireType + "'"));

        JsonNode payloadNode = node.get("payload");
        SubscriptionPayload payload;
        if (payloadNode == null || payloadNode.isNull()) {
            payload = new SubscriptionPayload(null, null);
        } else {
            try {
                payload = objectMapper.treeToValue(payloadNode, SubscriptionPayload.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new ValidationException("Malformed " + wireType + " payload");
            }
        }
        return new EventEnvelope(type, payload, Instant.now());
    }
}

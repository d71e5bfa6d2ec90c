package com.missioncontrol.core.realtime.message;

import java.time.Instant;
import java.util.Objects;

/**
 * The wire unit of both realtime transports: {@code {type, payload, timestamp}}.
 * <p>
 * The payload's class must be the one bound to {@code type}; anything else is rejected
 * at construction so a mistyped envelope can never reach the wire.
 */
public record EventEnvelope(
    EventType type,
    EventPayload payload,
    Instant timestamp
) {

    public EventEnvelope {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Envelope type " + type.wireName() + " requires "
                    + type.payloadType().getSimpleName() + " but got " + payload.getClass().getSimpleName());
        }
    }

    public static EventEnvelope of(EventType type, EventPayload payload) {
        return new EventEnvelope(type, payload, Instant.now());
    }

    /**
     * Returns the payload cast to the record bound to this envelope's type.
     */
    public <P extends EventPayload> P payloadAs(Class<P> payloadType) {
        return payloadType.cast(payload);
    }
}

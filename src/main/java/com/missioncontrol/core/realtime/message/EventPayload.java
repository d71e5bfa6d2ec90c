package com.missioncontrol.core.realtime.message;

/**
 * Marker for the typed payload of an {@link EventEnvelope}. Each {@link EventType} names
 * exactly one implementing record.
 */
public interface EventPayload {
}

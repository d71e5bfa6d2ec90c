package com.missioncontrol.core.realtime.message;

import java.time.Instant;

/** Keepalive frame; carries nothing but its send time. */
public record PingPayload(Instant timestamp) implements EventPayload {}

package com.missioncontrol.core.realtime.message;

import java.time.Instant;

public record ConnectedPayload(String clientId, Instant timestamp) implements EventPayload {}

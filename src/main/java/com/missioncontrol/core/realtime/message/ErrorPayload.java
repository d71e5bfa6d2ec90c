package com.missioncontrol.core.realtime.message;

public record ErrorPayload(String message) implements EventPayload {}

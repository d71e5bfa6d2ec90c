package com.missioncontrol.core.realtime.message;

import com.fasterxml.jackson.annotation.JsonValue;
import com.missioncontrol.core.model.Task;

public record TaskPayload(@JsonValue Task task) implements EventPayload {}

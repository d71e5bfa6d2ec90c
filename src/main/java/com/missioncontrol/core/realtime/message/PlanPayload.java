package com.missioncontrol.core.realtime.message;

import com.fasterxml.jackson.annotation.JsonValue;
import com.missioncontrol.core.model.Plan;

/** Push-stream payload for plan lifecycle events: the materialized plan itself. */
public record PlanPayload(@JsonValue Plan plan) implements EventPayload {}

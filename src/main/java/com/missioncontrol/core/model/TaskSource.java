package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who created a task: a person through the dashboard or an agent through a plan submission.
 */
public enum TaskSource {
    HUMAN,
    AGENT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TaskSource fromWire(String value) {
        return WireValues.parse(TaskSource.class, value, "task source");
    }
}

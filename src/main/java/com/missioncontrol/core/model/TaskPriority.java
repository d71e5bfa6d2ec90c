package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TaskPriority fromWire(String value) {
        return WireValues.parse(TaskPriority.class, value, "priority");
    }
}

package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityType {
    SPAWNED,
    UPDATED,
    COMPLETED,
    FILE_CREATED,
    STATUS_CHANGED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ActivityType fromWire(String value) {
        return WireValues.parse(ActivityType.class, value, "activity type");
    }
}

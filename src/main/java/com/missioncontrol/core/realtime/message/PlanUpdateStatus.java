package com.missioncontrol.core.realtime.message;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlanUpdateStatus {
    CREATED,
    UPDATED,
    APPROVED,
    REJECTED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}

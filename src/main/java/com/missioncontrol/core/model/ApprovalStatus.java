package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Approval state of an agent-proposed plan. {@code PENDING} is the only non-terminal state.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ApprovalStatus fromWire(String value) {
        return WireValues.parse(ApprovalStatus.class, value, "approval status");
    }
}

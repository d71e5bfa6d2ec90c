package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse workflow status of a task. Closed set; the wire form is the lower-case name.
 */
public enum TaskStatus {
    PLANNING,
    PENDING_APPROVAL,
    INBOX,
    ASSIGNED,
    IN_PROGRESS,
    TESTING,
    REVIEW,
    DONE,
    BLOCKED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    /**
     * Parses a wire value.
     *
     * @throws ValidationException if the value is null or not one of the known statuses
     */
    @JsonCreator
    public static TaskStatus fromWire(String value) {
        return WireValues.parse(TaskStatus.class, value, "task status");
    }
}

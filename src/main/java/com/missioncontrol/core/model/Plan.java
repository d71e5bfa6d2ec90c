package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;

/**
 * Read-side view of an agent-proposed plan: the parent task plus its children ordered
 * by {@code sort_order}. Serializes as the parent's fields with a nested {@code subtasks} array.
 */
public record Plan(
    @JsonUnwrapped Task parent,
    List<Task> subtasks
) {

    public Plan {
        subtasks = subtasks != null ? List.copyOf(subtasks) : List.of();
    }

    public String planId() {
        return parent.id();
    }

    public String workspace() {
        return parent.workspaceId();
    }

    public boolean pending() {
        return parent.approvalStatus() == ApprovalStatus.PENDING;
    }
}

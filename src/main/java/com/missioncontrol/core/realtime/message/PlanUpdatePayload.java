package com.missioncontrol.core.realtime.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.missioncontrol.core.model.Task;

import java.util.List;

/**
 * @param subtasks the children exactly as persisted when the update was published
 */
public record PlanUpdatePayload(
    @JsonProperty("parent_task_id") String parentTaskId,
    List<Task> subtasks,
    PlanUpdateStatus status
) implements EventPayload {

    public PlanUpdatePayload {
        subtasks = subtasks != null ? List.copyOf(subtasks) : List.of();
    }
}

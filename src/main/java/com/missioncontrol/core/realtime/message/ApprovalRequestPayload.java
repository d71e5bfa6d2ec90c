package com.missioncontrol.core.realtime.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalRequestPayload(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("parent_task_id") String parentTaskId,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("plan_summary") String planSummary,
    List<SubtaskSummary> subtasks
) implements EventPayload {

    public ApprovalRequestPayload {
        subtasks = subtasks != null ? List.copyOf(subtasks) : List.of();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SubtaskSummary(String id, String title, String description) {}
}

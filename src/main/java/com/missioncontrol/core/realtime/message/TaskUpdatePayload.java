package com.missioncontrol.core.realtime.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskUpdatePayload(
    @JsonProperty("task_id") String taskId,
    Map<String, Object> changes,
    @JsonProperty("agent_id") String agentId
) implements EventPayload {

    public TaskUpdatePayload {
        changes = changes != null ? Map.copyOf(changes) : Map.of();
    }
}

package com.missioncontrol.core.realtime.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.missioncontrol.core.model.ValidationException;

/**
 * @param progress percentage complete, 0 to 100 inclusive
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressUpdatePayload(
    @JsonProperty("task_id") String taskId,
    int progress,
    @JsonProperty("current_step") String currentStep,
    @JsonProperty("agent_id") String agentId
) implements EventPayload {

    public ProgressUpdatePayload {
        if (progress < 0 || progress > 100) {
            throw new ValidationException("progress must be between 0 and 100, got " + progress);
        }
    }
}

package com.missioncontrol.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param progress percentage complete, 0 to 100
 */
public record ProgressRequest(
    Integer progress,
    @JsonProperty("current_step") String currentStep,
    @JsonProperty("agent_id") String agentId
) {}

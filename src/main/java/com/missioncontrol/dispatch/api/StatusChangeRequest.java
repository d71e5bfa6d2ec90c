package com.missioncontrol.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatusChangeRequest(
    String status,
    @JsonProperty("agent_id") String agentId
) {}

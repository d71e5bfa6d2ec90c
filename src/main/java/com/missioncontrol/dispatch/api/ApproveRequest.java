package com.missioncontrol.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the approve endpoint. The body itself is optional.
 */
public record ApproveRequest(
    @JsonProperty("approved_by") String approvedBy
) {}

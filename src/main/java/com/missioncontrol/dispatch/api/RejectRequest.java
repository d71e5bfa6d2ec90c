package com.missioncontrol.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the reject endpoint. The body itself is optional.
 */
public record RejectRequest(
    @JsonProperty("rejected_by") String rejectedBy,
    String reason
) {}

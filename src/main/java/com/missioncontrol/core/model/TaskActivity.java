package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry of a task's activity log.
 *
 * @param metadata optional JSON object text with structured detail (e.g. a rejection reason)
 */
public record TaskActivity(
    String id,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("activity_type") ActivityType activityType,
    String message,
    String metadata,
    @JsonProperty("created_at") Instant createdAt
) {}

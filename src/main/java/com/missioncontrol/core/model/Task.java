package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A tracked unit of work as persisted in the record store.
 * <p>
 * Tasks form at most a two-level tree: a task either has no parent, or points at a parent
 * that itself has no parent. Plans are parents whose source is {@link TaskSource#AGENT}.
 *
 * @param id            opaque unique id
 * @param parentTaskId  parent reference; null for top-level tasks
 * @param approvalStatus null for tasks that never went through plan approval
 * @param sortOrder     0-based position among siblings
 * @param sessionKey    linked upstream agent session, if any
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Task(
    String id,
    String title,
    String description,
    TaskStatus status,
    TaskPriority priority,
    @JsonProperty("workspace_id") String workspaceId,
    @JsonProperty("parent_task_id") String parentTaskId,
    TaskSource source,
    List<String> tags,
    @JsonProperty("approval_status") ApprovalStatus approvalStatus,
    @JsonProperty("approved_at") Instant approvedAt,
    @JsonProperty("approved_by") String approvedBy,
    String color,
    @JsonProperty("sort_order") int sortOrder,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("session_key") String sessionKey,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public Task {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}

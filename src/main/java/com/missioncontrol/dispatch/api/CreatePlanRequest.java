package com.missioncontrol.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.missioncontrol.core.model.TaskDraft;

import java.util.List;

/**
 * Inbound JSON body for POST /api/plans.
 *
 * @param parentTask parent task draft; title required
 * @param subtasks   child drafts in display order; at least one
 * @param agentId    agent proposing the plan
 * @param sessionKey upstream session the plan belongs to; nullable
 */
public record CreatePlanRequest(
    @JsonProperty("parent_task") TaskDraft parentTask,
    List<TaskDraft> subtasks,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("session_key") String sessionKey
) {}

package com.missioncontrol.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Caller-supplied fields for a task that does not exist yet. Everything except the title
 * is optional; defaults are applied by the service that persists it.
 */
public record TaskDraft(
    String title,
    String description,
    TaskPriority priority,
    @JsonProperty("workspace_id") String workspaceId,
    List<String> tags,
    String color
) {

    public TaskDraft {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static TaskDraft titled(String title) {
        return new TaskDraft(title, null, null, null, List.of(), null);
    }
}

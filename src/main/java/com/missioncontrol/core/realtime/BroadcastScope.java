package com.missioncontrol.core.realtime;

import java.util.Objects;

/**
 * Target of a socket publish.
 *
 * @param workspaceId workspace whose subscribers receive the message; null for {@link Kind#ALL}
 * @param taskId      for {@link Kind#TASK}, subscribers of this task also receive it
 */
public record BroadcastScope(Kind kind, String workspaceId, String taskId) {

    public enum Kind { ALL, WORKSPACE, TASK }

    public BroadcastScope {
        Objects.requireNonNull(kind, "kind");
        if (kind != Kind.ALL) {
            Objects.requireNonNull(workspaceId, "workspaceId");
        }
        if (kind == Kind.TASK) {
            Objects.requireNonNull(taskId, "taskId");
        }
    }

    public static BroadcastScope all() {
        return new BroadcastScope(Kind.ALL, null, null);
    }

    public static BroadcastScope workspace(String workspaceId) {
        return new BroadcastScope(Kind.WORKSPACE, workspaceId, null);
    }

    /** Subscribers of {@code taskId} plus subscribers of the workspace the task lives in. */
    public static BroadcastScope task(String taskId, String workspaceId) {
        return new BroadcastScope(Kind.TASK, workspaceId, taskId);
    }
}

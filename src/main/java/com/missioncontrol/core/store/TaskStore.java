package com.missioncontrol.core.store;

import com.missioncontrol.core.model.ApprovalStatus;
import com.missioncontrol.core.model.Task;
import com.missioncontrol.core.model.TaskActivity;
import com.missioncontrol.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of tasks and their activity log. The single source of truth that the
 * realtime transports project from.
 * <p>
 * Every method may throw {@link StoreException} when the underlying storage fails.
 */
public interface TaskStore {

    void insert(Task task);

    Optional<Task> findById(String taskId);

    /**
     * Reads a task and holds a write lock on its row until the enclosing transaction ends.
     * Outside {@link #inTransaction} this behaves like {@link #findById}.
     */
    Optional<Task> findByIdForUpdate(String taskId);

    /** Children of a parent ordered by {@code sort_order}. */
    List<Task> findChildren(String parentTaskId);

    /** Top-level agent-sourced tasks in a workspace with the given approval status, newest first. */
    List<Task> findPlanParents(String workspaceId, ApprovalStatus approvalStatus);

    /**
     * Moves a pending plan to {@code decision}: the parent and all of its current children get
     * the decision, the coarse {@code status}, and the actor/time stamp.
     *
     * @return false when the parent was not pending, in which case nothing was written
     */
    boolean resolvePlan(String parentTaskId, ApprovalStatus decision, TaskStatus status,
                        String actor, Instant at);

    /** @return false when no task has that id */
    boolean updateStatus(String taskId, TaskStatus status, Instant at);

    void appendActivity(TaskActivity activity);

    List<TaskActivity> activitiesFor(String taskId);

    /**
     * Runs {@code work} against a view of this store bound to a single transaction.
     * Commits when {@code work} returns, rolls back when it throws; the exception is rethrown
     * unchanged (SQL failures arrive as {@link StoreException}). Nested calls join the
     * enclosing transaction.
     */
    <T> T inTransaction(StoreWork<T> work);

    @FunctionalInterface
    interface StoreWork<T> {
        T execute(TaskStore tx);
    }
}

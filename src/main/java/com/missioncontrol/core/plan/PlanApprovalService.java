package com.missioncontrol.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missioncontrol.core.logging.MdcContext;
import com.missioncontrol.core.metrics.RealtimeMetrics;
import com.missioncontrol.core.model.ActivityType;
import com.missioncontrol.core.model.ApprovalStatus;
import com.missioncontrol.core.model.InvalidPlanStateException;
import com.missioncontrol.core.model.Plan;
import com.missioncontrol.core.model.Task;
import com.missioncontrol.core.model.TaskActivity;
import com.missioncontrol.core.model.TaskDraft;
import com.missioncontrol.core.model.TaskNotFoundException;
import com.missioncontrol.core.model.TaskPriority;
import com.missioncontrol.core.model.TaskSource;
import com.missioncontrol.core.model.TaskStatus;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.realtime.BroadcastRouter;
import com.missioncontrol.core.realtime.BroadcastScope;
import com.missioncontrol.core.realtime.PushStreamRegistry;
import com.missioncontrol.core.realtime.message.ApprovalRequestPayload;
import com.missioncontrol.core.realtime.message.EventEnvelope;
import com.missioncontrol.core.realtime.message.EventType;
import com.missioncontrol.core.realtime.message.PlanPayload;
import com.missioncontrol.core.realtime.message.PlanUpdatePayload;
import com.missioncontrol.core.realtime.message.PlanUpdateStatus;
import com.missioncontrol.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lifecycle of agent-proposed plans: creation in {@code pending}, then one-shot approval or
 * rejection that cascades to every child.
 * <p>
 * Each operation commits its store writes in a single transaction and only then publishes to
 * the socket and push-stream transports, so no viewer is ever told about a state the store
 * does not hold. Nothing is published when an operation fails.
 */
@Service
public class PlanApprovalService {

    private static final Logger log = LoggerFactory.getLogger(PlanApprovalService.class);

    public static final String DEFAULT_WORKSPACE = "default";
    public static final String DEFAULT_COLOR = "#a855f7";
    public static final String DEFAULT_ACTOR = "human";
    public static final String AGENTIC_TAG = "agentic";

    private final TaskStore taskStore;
    private final BroadcastRouter broadcastRouter;
    private final PushStreamRegistry pushStreams;
    private final RealtimeMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public PlanApprovalService(TaskStore taskStore, BroadcastRouter broadcastRouter,
                               PushStreamRegistry pushStreams, RealtimeMetrics metrics,
                               ObjectMapper objectMapper) {
        this(taskStore, broadcastRouter, pushStreams, metrics, objectMapper, Clock.systemUTC());
    }

    PlanApprovalService(TaskStore taskStore, BroadcastRouter broadcastRouter,
                        PushStreamRegistry pushStreams, RealtimeMetrics metrics,
                        ObjectMapper objectMapper, Clock clock) {
        this.taskStore = taskStore;
        this.broadcastRouter = broadcastRouter;
        this.pushStreams = pushStreams;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Persists a parent task and its children as a pending plan.
     *
     * @param parentDraft  fields of the parent; title is required
     * @param childDrafts  at least one child, stored in the given order
     * @param agentId      agent proposing the plan
     * @param sessionKey   optional upstream session the plan belongs to
     * @throws ValidationException if any required input is missing
     */
    public Plan createPlan(TaskDraft parentDraft, List<TaskDraft> childDrafts, String agentId, String sessionKey) {
        validateDrafts(parentDraft, childDrafts, agentId);

        Instant now = now();
        String workspaceId = isBlank(parentDraft.workspaceId()) ? DEFAULT_WORKSPACE : parentDraft.workspaceId();
        String parentId = newId();

        Task parent = toTask(parentId, parentDraft, workspaceId, null, 0, agentId, sessionKey, now);
        List<Task> children = new ArrayList<>(childDrafts.size());
        for (int i = 0; i < childDrafts.size(); i++) {
            children.add(toTask(newId(), childDrafts.get(i), workspaceId, parentId, i, agentId, sessionKey, now));
        }

        MdcContext.setPlan(parentId, workspaceId);
        try {
            Plan plan = taskStore.inTransaction(tx -> {
                tx.insert(parent);
                children.forEach(tx::insert);
                tx.appendActivity(new TaskActivity(newId(), parentId, agentId, ActivityType.SPAWNED,
                        "Agent created task plan with " + children.size() + " subtasks", null, now));
                return readPlan(tx, parentId);
            });

            log.info("Plan '{}' created by agent '{}' with {} subtask(s)", parent.title(), agentId, children.size());
            metrics.recordPlanTransition("created");
            publishCreated(plan, agentId);
            return plan;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Approves a pending plan: parent and all current children become
     * {@code approved}/{@code inbox}.
     *
     * @throws TaskNotFoundException     if no task has {@code planId}
     * @throws InvalidPlanStateException if the plan is not pending
     */
    public Plan approve(String planId, String approverId) {
        String actor = isBlank(approverId) ? DEFAULT_ACTOR : approverId;
        MdcContext.setPlan(planId, null);
        try {
            Plan plan = resolve(planId, ApprovalStatus.APPROVED, TaskStatus.INBOX, actor,
                    "Plan approved by " + actor, null);
            log.info("Plan {} approved by {} ({} subtask(s) moved to inbox)", planId, actor, plan.subtasks().size());
            metrics.recordPlanTransition("approved");
            publishResolved(plan, EventType.PLAN_APPROVED, PlanUpdateStatus.APPROVED);
            return plan;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Rejects a pending plan: parent and all current children become
     * {@code rejected}/{@code blocked}. The reason, if any, goes into the activity log.
     *
     * @throws TaskNotFoundException     if no task has {@code planId}
     * @throws InvalidPlanStateException if the plan is not pending
     */
    public Plan reject(String planId, String rejecterId, String reason) {
        String actor = isBlank(rejecterId) ? DEFAULT_ACTOR : rejecterId;
        String message = isBlank(reason) ? "Plan rejected by " + actor : "Plan rejected by " + actor + ": " + reason;
        String metadata = isBlank(reason) ? null : toJson(Map.of("reason", reason));
        MdcContext.setPlan(planId, null);
        try {
            Plan plan = resolve(planId, ApprovalStatus.REJECTED, TaskStatus.BLOCKED, actor, message, metadata);
            log.info("Plan {} rejected by {}{}", planId, actor, isBlank(reason) ? "" : " (" + reason + ")");
            metrics.recordPlanTransition("rejected");
            publishResolved(plan, EventType.PLAN_REJECTED, PlanUpdateStatus.REJECTED);
            return plan;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * @throws TaskNotFoundException if no task has {@code planId}
     */
    public Plan getPlan(String planId) {
        return readPlan(taskStore, planId);
    }

    /**
     * Plans in a workspace with the given approval status, newest first.
     * Null arguments select the default workspace and {@code pending}.
     */
    public List<Plan> listPlans(String workspaceId, ApprovalStatus approvalStatus) {
        String workspace = isBlank(workspaceId) ? DEFAULT_WORKSPACE : workspaceId;
        ApprovalStatus status = approvalStatus != null ? approvalStatus : ApprovalStatus.PENDING;
        List<Plan> plans = new ArrayList<>();
        for (Task parent : taskStore.findPlanParents(workspace, status)) {
            plans.add(new Plan(parent, taskStore.findChildren(parent.id())));
        }
        return plans;
    }

    // ── Transitions ──────────────────────────────────────────────────────

    private Plan resolve(String planId, ApprovalStatus decision, TaskStatus status, String actor,
                         String activityMessage, String activityMetadata) {
        Instant now = now();
        try {
            return taskStore.inTransaction(tx -> {
                Task parent = tx.findByIdForUpdate(planId)
                        .orElseThrow(() -> new TaskNotFoundException(planId));
                if (parent.approvalStatus() != ApprovalStatus.PENDING) {
                    throw new InvalidPlanStateException(planId, parent.approvalStatus());
                }
                if (!tx.resolvePlan(planId, decision, status, actor, now)) {
                    ApprovalStatus current = tx.findById(planId).map(Task::approvalStatus).orElse(null);
                    throw new InvalidPlanStateException(planId, current);
                }
                tx.appendActivity(new TaskActivity(newId(), planId, actor, ActivityType.STATUS_CHANGED,
                        activityMessage, activityMetadata, now));
                return readPlan(tx, planId);
            });
        } catch (InvalidPlanStateException e) {
            log.warn("Refused to {} plan {}: {}", decision == ApprovalStatus.APPROVED ? "approve" : "reject",
                    planId, e.getMessage());
            metrics.recordPlanTransition("conflict");
            throw e;
        }
    }

    private void publishCreated(Plan plan, String agentId) {
        BroadcastScope scope = BroadcastScope.workspace(plan.workspace());
        Instant at = Instant.now();

        var created = new EventEnvelope(EventType.PLAN_CREATED, new PlanPayload(plan), at);
        pushStreams.publishAll(created);
        broadcastRouter.publish(created, scope);

        broadcastRouter.publish(new EventEnvelope(EventType.PLAN_UPDATE,
                new PlanUpdatePayload(plan.planId(), plan.subtasks(), PlanUpdateStatus.CREATED), at), scope);

        List<ApprovalRequestPayload.SubtaskSummary> summaries = plan.subtasks().stream()
                .map(t -> new ApprovalRequestPayload.SubtaskSummary(t.id(), t.title(), t.description()))
                .toList();
        Task parent = plan.parent();
        String summary = isBlank(parent.description()) ? parent.title() : parent.description();
        broadcastRouter.publish(new EventEnvelope(EventType.APPROVAL_REQUEST,
                new ApprovalRequestPayload(parent.id(), null, agentId, summary, summaries), at), scope);
    }

    private void publishResolved(Plan plan, EventType pushType, PlanUpdateStatus updateStatus) {
        Instant at = Instant.now();
        pushStreams.publishAll(new EventEnvelope(pushType, new PlanPayload(plan), at));
        broadcastRouter.publish(new EventEnvelope(EventType.PLAN_UPDATE,
                        new PlanUpdatePayload(plan.planId(), plan.subtasks(), updateStatus), at),
                BroadcastScope.workspace(plan.workspace()));
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private static Plan readPlan(TaskStore store, String planId) {
        Task parent = store.findById(planId).orElseThrow(() -> new TaskNotFoundException(planId));
        return new Plan(parent, store.findChildren(planId));
    }

    private static void validateDrafts(TaskDraft parentDraft, List<TaskDraft> childDrafts, String agentId) {
        if (parentDraft == null || isBlank(parentDraft.title())) {
            throw new ValidationException("parent_task.title is required");
        }
        if (childDrafts == null || childDrafts.isEmpty()) {
            throw new ValidationException("A plan requires at least one subtask");
        }
        for (int i = 0; i < childDrafts.size(); i++) {
            TaskDraft child = childDrafts.get(i);
            if (child == null || isBlank(child.title())) {
                throw new ValidationException("subtasks[" + i + "].title is required");
            }
        }
        if (isBlank(agentId)) {
            throw new ValidationException("agent_id is required");
        }
    }

    private static Task toTask(String id, TaskDraft draft, String workspaceId, String parentId, int sortOrder,
                               String agentId, String sessionKey, Instant now) {
        List<String> tags = new ArrayList<>();
        tags.add(AGENTIC_TAG);
        draft.tags().stream().filter(tag -> !AGENTIC_TAG.equals(tag)).forEach(tags::add);
        return new Task(
                id,
                draft.title(),
                draft.description(),
                TaskStatus.PENDING_APPROVAL,
                draft.priority() != null ? draft.priority() : TaskPriority.NORMAL,
                workspaceId,
                parentId,
                TaskSource.AGENT,
                tags,
                ApprovalStatus.PENDING,
                null,
                null,
                isBlank(draft.color()) ? DEFAULT_COLOR : draft.color(),
                sortOrder,
                agentId,
                sessionKey,
                now,
                now);
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize activity metadata", e);
        }
    }

    // Stored timestamps keep millisecond precision; truncate so reads match what was written.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

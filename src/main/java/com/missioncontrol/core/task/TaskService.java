package com.missioncontrol.core.task;

import com.missioncontrol.core.logging.MdcContext;
import com.missioncontrol.core.model.ActivityType;
import com.missioncontrol.core.model.Task;
import com.missioncontrol.core.model.TaskActivity;
import com.missioncontrol.core.model.TaskNotFoundException;
import com.missioncontrol.core.model.TaskStatus;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.realtime.BroadcastRouter;
import com.missioncontrol.core.realtime.BroadcastScope;
import com.missioncontrol.core.realtime.PushStreamRegistry;
import com.missioncontrol.core.realtime.message.EventEnvelope;
import com.missioncontrol.core.realtime.message.EventType;
import com.missioncontrol.core.realtime.message.ProgressUpdatePayload;
import com.missioncontrol.core.realtime.message.TaskPayload;
import com.missioncontrol.core.realtime.message.TaskUpdatePayload;
import com.missioncontrol.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;

/**
 * Single-task mutations outside the plan workflow: board status moves and agent progress
 * reports.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskStore taskStore;
    private final BroadcastRouter broadcastRouter;
    private final PushStreamRegistry pushStreams;
    private final Clock clock;

    @Autowired
    public TaskService(TaskStore taskStore, BroadcastRouter broadcastRouter, PushStreamRegistry pushStreams) {
        this(taskStore, broadcastRouter, pushStreams, Clock.systemUTC());
    }

    TaskService(TaskStore taskStore, BroadcastRouter broadcastRouter, PushStreamRegistry pushStreams, Clock clock) {
        this.taskStore = taskStore;
        this.broadcastRouter = broadcastRouter;
        this.pushStreams = pushStreams;
        this.clock = clock;
    }

    /**
     * Moves a task to another board column and tells every viewer of its workspace or of the
     * task itself.
     *
     * @throws ValidationException   if {@code status} is null
     * @throws TaskNotFoundException if no task has {@code taskId}
     */
    public Task changeStatus(String taskId, TaskStatus status, String agentId) {
        if (status == null) {
            throw new ValidationException("status is required");
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        MdcContext.setTask(taskId);
        try {
            Task updated = taskStore.inTransaction(tx -> {
                Task current = tx.findByIdForUpdate(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
                tx.updateStatus(taskId, status, now);
                tx.appendActivity(new TaskActivity(UUID.randomUUID().toString(), taskId, agentId,
                        ActivityType.STATUS_CHANGED,
                        "Status changed from " + current.status().wireValue() + " to " + status.wireValue(),
                        null, now));
                return tx.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            });
            log.info("Task {} moved to {}", taskId, status.wireValue());

            Instant at = Instant.now();
            broadcastRouter.publish(new EventEnvelope(EventType.TASK_UPDATE,
                            new TaskUpdatePayload(taskId, Map.of("status", status.wireValue()), agentId), at),
                    BroadcastScope.task(taskId, updated.workspaceId()));
            pushStreams.publishAll(new EventEnvelope(EventType.TASK_UPDATED, new TaskPayload(updated), at));
            return updated;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Relays an agent's progress on a task. Nothing is persisted.
     *
     * @return number of socket connections the update reached
     * @throws ValidationException   if {@code progress} is outside 0..100
     * @throws TaskNotFoundException if no task has {@code taskId}
     */
    public int reportProgress(String taskId, int progress, String currentStep, String agentId) {
        var payload = new ProgressUpdatePayload(taskId, progress, currentStep, agentId);
        Task task = taskStore.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        log.debug("Task {} progress {}%", taskId, progress);
        return broadcastRouter.publish(EventEnvelope.of(EventType.PROGRESS_UPDATE, payload),
                BroadcastScope.task(taskId, task.workspaceId()));
    }
}

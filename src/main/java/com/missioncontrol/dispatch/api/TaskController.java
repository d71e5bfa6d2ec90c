package com.missioncontrol.dispatch.api;

import com.missioncontrol.core.model.Task;
import com.missioncontrol.core.model.TaskStatus;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.task.TaskService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    /**
     * PATCH /api/tasks/{id}/status: Board drag-and-drop.
     */
    @PatchMapping("/{id}/status")
    public ResponseEntity<Task> changeStatus(@PathVariable String id, @RequestBody StatusChangeRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        TaskStatus status = TaskStatus.fromWire(request.status());
        return ResponseEntity.ok(taskService.changeStatus(id, status, request.agentId()));
    }

    /**
     * POST /api/tasks/{id}/progress: Agent progress report, relayed to viewers only.
     */
    @PostMapping("/{id}/progress")
    public ResponseEntity<Map<String, Object>> reportProgress(@PathVariable String id,
                                                              @RequestBody ProgressRequest request) {
        if (request == null || request.progress() == null) {
            throw new ValidationException("progress is required");
        }
        int delivered = taskService.reportProgress(id, request.progress(), request.currentStep(), request.agentId());
        return ResponseEntity.ok(Map.of("success", true, "delivered", delivered));
    }
}

package com.missioncontrol.dispatch.api;

import com.missioncontrol.core.model.Task;
import com.missioncontrol.core.model.TaskNotFoundException;
import com.missioncontrol.core.model.TaskPriority;
import com.missioncontrol.core.model.TaskSource;
import com.missioncontrol.core.model.TaskStatus;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.task.TaskService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskService taskService;

    // ── PATCH /api/tasks/{id}/status ─────────────────────────────────

    @Test
    @DisplayName("PATCH status returns the updated task")
    void changeStatus() throws Exception {
        Instant at = Instant.parse("2026-05-04T10:00:00Z");
        when(taskService.changeStatus("t-1", TaskStatus.REVIEW, "agent-7")).thenReturn(
                new Task("t-1", "Fix login", null, TaskStatus.REVIEW, TaskPriority.HIGH, "ops", null,
                        TaskSource.HUMAN, List.of(), null, null, null, "#3b82f6", 0, null, null, at, at));

        mockMvc.perform(patch("/api/tasks/t-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"review\", \"agent_id\": \"agent-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("review"))
                .andExpect(jsonPath("$.approval_status").doesNotExist());
    }

    @Test
    @DisplayName("PATCH with an unknown status is a 400 naming the value")
    void unknownStatus() throws Exception {
        mockMvc.perform(patch("/api/tasks/t-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"archived\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("archived")));
        verifyNoInteractions(taskService);
    }

    @Test
    @DisplayName("PATCH on an unknown task is a 404")
    void unknownTask() throws Exception {
        when(taskService.changeStatus(eq("nope"), any(), any())).thenThrow(new TaskNotFoundException("nope"));

        mockMvc.perform(patch("/api/tasks/nope/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"done\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Task not found: nope"));
    }

    // ── POST /api/tasks/{id}/progress ────────────────────────────────

    @Test
    @DisplayName("POST progress reports how many viewers were reached")
    void reportProgress() throws Exception {
        when(taskService.reportProgress("t-1", 40, "Running migrations", "agent-7")).thenReturn(2);

        mockMvc.perform(post("/api/tasks/t-1/progress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"progress\": 40, \"current_step\": \"Running migrations\", \"agent_id\": \"agent-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.delivered").value(2));
    }

    @Test
    @DisplayName("POST progress without a value is a 400")
    void missingProgress() throws Exception {
        mockMvc.perform(post("/api/tasks/t-1/progress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"current_step\": \"Halfway\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("progress is required"));
        verifyNoInteractions(taskService);
    }

    @Test
    @DisplayName("POST progress out of range is a 400")
    void progressOutOfRange() throws Exception {
        when(taskService.reportProgress(eq("t-1"), anyInt(), any(), any()))
                .thenThrow(new ValidationException("progress must be between 0 and 100, got 120"));

        mockMvc.perform(post("/api/tasks/t-1/progress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"progress\": 120}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("between 0 and 100")));
    }
}

package com.missioncontrol.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private static Task task(String id, String parentId, int sortOrder) {
        Instant at = Instant.parse("2026-01-15T08:00:00Z");
        return new Task(id, "Task " + id, null, TaskStatus.PENDING_APPROVAL, TaskPriority.URGENT, "default",
                parentId, TaskSource.AGENT, List.of("agentic"), ApprovalStatus.PENDING, null, null, "#a855f7",
                sortOrder, "dev", null, at, at);
    }

    @Nested
    @DisplayName("Wire values")
    class WireValueTests {

        @Test
        @DisplayName("statuses use lower-case names on the wire")
        void lowerCaseWire() {
            assertEquals("pending_approval", TaskStatus.PENDING_APPROVAL.wireValue());
            assertEquals(TaskStatus.IN_PROGRESS, TaskStatus.fromWire("in_progress"));
            assertEquals(ApprovalStatus.REJECTED, ApprovalStatus.fromWire("rejected"));
            assertEquals(TaskPriority.LOW, TaskPriority.fromWire("low"));
        }

        @Test
        @DisplayName("unknown, upper-case and missing values are validation errors")
        void strictParsing() {
            var unknown = assertThrows(ValidationException.class, () -> TaskStatus.fromWire("archived"));
            assertTrue(unknown.getMessage().contains("archived"));
            assertThrows(ValidationException.class, () -> TaskStatus.fromWire("DONE"));
            assertThrows(ValidationException.class, () -> ApprovalStatus.fromWire(null));
            assertThrows(ValidationException.class, () -> TaskPriority.fromWire(""));
        }

        @Test
        @DisplayName("JSON binding goes through the same parser")
        void jsonBinding() throws Exception {
            TaskDraft draft = mapper.readValue("{\"title\":\"x\",\"priority\":\"high\"}", TaskDraft.class);
            assertEquals(TaskPriority.HIGH, draft.priority());
            assertEquals(List.of(), draft.tags());
            assertThrows(Exception.class, () -> mapper.readValue("{\"title\":\"x\",\"priority\":\"HIGH\"}", TaskDraft.class));
        }
    }

    @Nested
    @DisplayName("JSON shape")
    class JsonShapeTests {

        @Test
        @DisplayName("task fields are snake_case and nulls are kept")
        void taskShape() throws Exception {
            JsonNode json = mapper.valueToTree(task("t-1", null, 0));

            assertEquals("pending_approval", json.get("status").asText());
            assertEquals("urgent", json.get("priority").asText());
            assertEquals("agent", json.get("source").asText());
            assertEquals("default", json.get("workspace_id").asText());
            assertEquals("2026-01-15T08:00:00Z", json.get("created_at").asText());
            assertTrue(json.has("parent_task_id"));
            assertTrue(json.get("parent_task_id").isNull());
        }

        @Test
        @DisplayName("plan serializes as the parent's fields plus nested subtasks")
        void planShape() throws Exception {
            Plan plan = new Plan(task("p-1", null, 0), List.of(task("c-1", "p-1", 0), task("c-2", "p-1", 1)));

            JsonNode json = mapper.valueToTree(plan);

            assertEquals("p-1", json.get("id").asText());
            assertFalse(json.has("parent"));
            assertEquals(2, json.get("subtasks").size());
            assertEquals("p-1", json.get("subtasks").get(1).get("parent_task_id").asText());
            assertEquals(1, json.get("subtasks").get(1).get("sort_order").asInt());
        }

        @Test
        @DisplayName("plan accessors read through to the parent")
        void planAccessors() {
            Plan plan = new Plan(task("p-1", null, 0), null);

            assertEquals("p-1", plan.planId());
            assertEquals("default", plan.workspace());
            assertTrue(plan.pending());
            assertEquals(List.of(), plan.subtasks());
        }
    }
}

package com.missioncontrol.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missioncontrol.core.model.ActivityType;
import com.missioncontrol.core.model.ApprovalStatus;
import com.missioncontrol.core.model.Task;
import com.missioncontrol.core.model.TaskActivity;
import com.missioncontrol.core.model.TaskPriority;
import com.missioncontrol.core.model.TaskSource;
import com.missioncontrol.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TaskStore} over plain JDBC.
 * <p>
 * Instances created with a {@link DataSource} borrow a connection per call. Inside
 * {@link #inTransaction} the callback receives a second instance bound to the one
 * transactional connection, so reads see the transaction's own writes and
 * {@link #findByIdForUpdate} row locks hold until commit.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private static final String TASK_COLUMNS = """
            id, title, description, status, priority, workspace_id, parent_task_id, source,
            tags, approval_status, approved_at, approved_by, color, sort_order, agent_id,
            session_key, created_at, updated_at""";

    private static final String INSERT_TASK_SQL = """
            INSERT INTO tasks (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TASK_COLUMNS);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM tasks WHERE id = ?
            """.formatted(TASK_COLUMNS);

    private static final String SELECT_BY_ID_FOR_UPDATE_SQL = """
            SELECT %s FROM tasks WHERE id = ? FOR UPDATE
            """.formatted(TASK_COLUMNS);

    private static final String SELECT_CHILDREN_SQL = """
            SELECT %s FROM tasks WHERE parent_task_id = ? ORDER BY sort_order ASC, created_at ASC
            """.formatted(TASK_COLUMNS);

    private static final String SELECT_PLAN_PARENTS_SQL = """
            SELECT %s FROM tasks
            WHERE workspace_id = ?
              AND source = 'agent'
              AND parent_task_id IS NULL
              AND approval_status = ?
            ORDER BY created_at DESC
            """.formatted(TASK_COLUMNS);

    private static final String RESOLVE_PARENT_SQL = """
            UPDATE tasks
            SET approval_status = ?, status = ?, approved_by = ?, approved_at = ?, updated_at = ?
            WHERE id = ? AND approval_status = 'pending'
            """;

    private static final String RESOLVE_CHILDREN_SQL = """
            UPDATE tasks
            SET approval_status = ?, status = ?, approved_by = ?, approved_at = ?, updated_at = ?
            WHERE parent_task_id = ?
            """;

    private static final String UPDATE_STATUS_SQL = """
            UPDATE tasks SET status = ?, updated_at = ? WHERE id = ?
            """;

    private static final String INSERT_ACTIVITY_SQL = """
            INSERT INTO task_activities (id, task_id, agent_id, activity_type, message, metadata, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_ACTIVITIES_SQL = """
            SELECT id, task_id, agent_id, activity_type, message, metadata, created_at
            FROM task_activities
            WHERE task_id = ?
            ORDER BY created_at ASC
            """;

    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

    private final DataSource dataSource;
    private final Connection boundConnection;
    private final ObjectMapper objectMapper;

    public JdbcTaskStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.boundConnection = null;
        this.objectMapper = objectMapper;
    }

    private JdbcTaskStore(Connection boundConnection, ObjectMapper objectMapper) {
        this.dataSource = null;
        this.boundConnection = boundConnection;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insert(Task task) {
        withConnection("insert task " + task.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_SQL)) {
                stmt.setString(1, task.id());
                stmt.setString(2, task.title());
                stmt.setString(3, task.description());
                stmt.setString(4, task.status().wireValue());
                stmt.setString(5, task.priority().wireValue());
                stmt.setString(6, task.workspaceId());
                stmt.setString(7, task.parentTaskId());
                stmt.setString(8, task.source().wireValue());
                stmt.setString(9, writeTags(task.tags()));
                stmt.setString(10, task.approvalStatus() != null ? task.approvalStatus().wireValue() : null);
                setInstant(stmt, 11, task.approvedAt());
                stmt.setString(12, task.approvedBy());
                stmt.setString(13, task.color());
                stmt.setInt(14, task.sortOrder());
                stmt.setString(15, task.agentId());
                stmt.setString(16, task.sessionKey());
                setInstant(stmt, 17, task.createdAt());
                setInstant(stmt, 18, task.updatedAt());
                stmt.executeUpdate();
            }
            log.debug("Inserted task '{}'", task.id());
            return null;
        });
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return selectOne(SELECT_BY_ID_SQL, taskId);
    }

    @Override
    public Optional<Task> findByIdForUpdate(String taskId) {
        return selectOne(SELECT_BY_ID_FOR_UPDATE_SQL, taskId);
    }

    @Override
    public List<Task> findChildren(String parentTaskId) {
        return withConnection("list children of " + parentTaskId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_CHILDREN_SQL)) {
                stmt.setString(1, parentTaskId);
                return readTasks(stmt);
            }
        });
    }

    @Override
    public List<Task> findPlanParents(String workspaceId, ApprovalStatus approvalStatus) {
        return withConnection("list plans in " + workspaceId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_PLAN_PARENTS_SQL)) {
                stmt.setString(1, workspaceId);
                stmt.setString(2, approvalStatus.wireValue());
                return readTasks(stmt);
            }
        });
    }

    @Override
    public boolean resolvePlan(String parentTaskId, ApprovalStatus decision, TaskStatus status,
                               String actor, Instant at) {
        return inTransaction(tx -> ((JdbcTaskStore) tx).withConnection("resolve plan " + parentTaskId, conn -> {
            int parents;
            try (PreparedStatement stmt = conn.prepareStatement(RESOLVE_PARENT_SQL)) {
                bindResolution(stmt, decision, status, actor, at);
                stmt.setString(6, parentTaskId);
                parents = stmt.executeUpdate();
            }
            if (parents == 0) {
                return false;
            }
            int children;
            try (PreparedStatement stmt = conn.prepareStatement(RESOLVE_CHILDREN_SQL)) {
                bindResolution(stmt, decision, status, actor, at);
                stmt.setString(6, parentTaskId);
                children = stmt.executeUpdate();
            }
            log.debug("Resolved plan '{}' as {} ({} children)", parentTaskId, decision.wireValue(), children);
            return true;
        }));
    }

    @Override
    public boolean updateStatus(String taskId, TaskStatus status, Instant at) {
        return withConnection("update status of " + taskId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_STATUS_SQL)) {
                stmt.setString(1, status.wireValue());
                setInstant(stmt, 2, at);
                stmt.setString(3, taskId);
                return stmt.executeUpdate() > 0;
            }
        });
    }

    @Override
    public void appendActivity(TaskActivity activity) {
        withConnection("append activity to " + activity.taskId(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_ACTIVITY_SQL)) {
                stmt.setString(1, activity.id());
                stmt.setString(2, activity.taskId());
                stmt.setString(3, activity.agentId());
                stmt.setString(4, activity.activityType().wireValue());
                stmt.setString(5, activity.message());
                stmt.setString(6, activity.metadata());
                setInstant(stmt, 7, activity.createdAt());
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<TaskActivity> activitiesFor(String taskId) {
        return withConnection("list activities of " + taskId, conn -> {
            List<TaskActivity> activities = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_ACTIVITIES_SQL)) {
                stmt.setString(1, taskId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        activities.add(new TaskActivity(
                                rs.getString("id"),
                                rs.getString("task_id"),
                                rs.getString("agent_id"),
                                ActivityType.fromWire(rs.getString("activity_type")),
                                rs.getString("message"),
                                rs.getString("metadata"),
                                getInstant(rs, "created_at")));
                    }
                }
            }
            return activities;
        });
    }

    @Override
    public <T> T inTransaction(StoreWork<T> work) {
        if (boundConnection != null) {
            return work.execute(this);
        }

        Connection conn;
        try {
            conn = dataSource.getConnection();
        } catch (SQLException e) {
            throw new StoreException("Failed to open a connection", e);
        }

        try (conn) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.execute(new JdbcTaskStore(conn, objectMapper));
                conn.commit();
                return result;
            } catch (RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw new StoreException("Transaction commit failed", e);
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Transaction failed", e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    private <T> T withConnection(String operation, SqlWork<T> work) {
        try {
            if (boundConnection != null) {
                return work.apply(boundConnection);
            }
            try (Connection conn = dataSource.getConnection()) {
                return work.apply(conn);
            }
        } catch (SQLException e) {
            log.error("Store operation failed: {}", operation, e);
            throw new StoreException("Failed to " + operation, e);
        }
    }

    private Optional<Task> selectOne(String sql, String taskId) {
        return withConnection("read task " + taskId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, taskId);
                List<Task> tasks = readTasks(stmt);
                return tasks.isEmpty() ? Optional.empty() : Optional.of(tasks.get(0));
            }
        });
    }

    private List<Task> readTasks(PreparedStatement stmt) throws SQLException {
        List<Task> tasks = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tasks.add(fromResultSet(rs));
            }
        }
        return tasks;
    }

    private Task fromResultSet(ResultSet rs) throws SQLException {
        String approval = rs.getString("approval_status");
        return new Task(
                rs.getString("id"),
                rs.getString("title"),
                rs.getString("description"),
                TaskStatus.fromWire(rs.getString("status")),
                TaskPriority.fromWire(rs.getString("priority")),
                rs.getString("workspace_id"),
                rs.getString("parent_task_id"),
                TaskSource.fromWire(rs.getString("source")),
                readTags(rs.getString("tags")),
                approval != null ? ApprovalStatus.fromWire(approval) : null,
                getInstant(rs, "approved_at"),
                rs.getString("approved_by"),
                rs.getString("color"),
                rs.getInt("sort_order"),
                rs.getString("agent_id"),
                rs.getString("session_key"),
                getInstant(rs, "created_at"),
                getInstant(rs, "updated_at"));
    }

    private static void bindResolution(PreparedStatement stmt, ApprovalStatus decision, TaskStatus status,
                                       String actor, Instant at) throws SQLException {
        stmt.setString(1, decision.wireValue());
        stmt.setString(2, status.wireValue());
        stmt.setString(3, actor);
        setInstant(stmt, 4, at);
        setInstant(stmt, 5, at);
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private String writeTags(List<String> tags) {
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tags", e);
        }
    }

    private List<String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, TAG_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize tags", e);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.error("Rollback failed", rollbackFailure);
        }
    }
}

package io.taskpatrol.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskpatrol.model.ErrorClassification;
import io.taskpatrol.model.Execution;
import io.taskpatrol.model.ExecutionCursor;
import io.taskpatrol.model.ExecutionResult;
import io.taskpatrol.model.ExecutionStatus;
import io.taskpatrol.model.Frequency;
import io.taskpatrol.model.Lease;
import io.taskpatrol.model.TaskDefinition;
import io.taskpatrol.model.TriggerReason;
import io.taskpatrol.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Task definitions, executions, results and the per-task lease.
 *
 * <p>Every state transition is a conditional UPDATE on the expected source status; terminal writes
 * are additionally fenced by the lease token handed out when the execution started.
 */
public final class ExecutionStore {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionStore.class);

    private static final String EXECUTION_COLUMNS =
            "execution_id,task_id,tenant_id,trigger_reason,status,queued_at_ms,started_at_ms,finished_at_ms,attempt,error_classification,error_detail,lease_holder";
    private static final String TASK_COLUMNS =
            "task_id,tenant_id,name,service_category,operation,configuration,frequency,is_active,credential_id,created_at_ms,updated_at_ms,last_trigger_at_ms";
    private static final String LEASE_UPSERT =
            "INSERT INTO leases(task_id,execution_id,holder,token,acquired_at_ms,expires_at_ms) VALUES(?,?,?,?,?,?) "
                    + "ON CONFLICT(task_id) DO UPDATE SET execution_id=excluded.execution_id,holder=excluded.holder,token=excluded.token,"
                    + "acquired_at_ms=excluded.acquired_at_ms,expires_at_ms=excluded.expires_at_ms "
                    + "WHERE leases.expires_at_ms<=? OR leases.execution_id=excluded.execution_id";

    public static final int MAX_PAGE_SIZE = 500;

    private final Database database;

    public ExecutionStore(Database database) {
        this.database = database;
    }

    // ---- task definitions ----

    public void insertTask(TaskDefinition t) {
        String sql = "INSERT INTO task_definitions(" + TASK_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, t.taskId());
            ps.setString(2, t.tenantId());
            ps.setString(3, t.name());
            ps.setString(4, t.serviceCategory());
            ps.setString(5, t.operation());
            ps.setString(6, Jsons.toCompactJson(t.configuration()));
            ps.setString(7, t.frequency().wireName());
            ps.setInt(8, t.active() ? 1 : 0);
            setNullableString(ps, 9, t.credentialId());
            ps.setLong(10, t.createdAtMs());
            ps.setLong(11, t.updatedAtMs());
            ps.setLong(12, t.lastTriggerAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert task definition", e);
        }
    }

    public boolean updateTask(TaskDefinition t) {
        String sql = "UPDATE task_definitions SET name=?,service_category=?,operation=?,configuration=?,frequency=?,is_active=?,credential_id=?,updated_at_ms=? WHERE task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, t.name());
            ps.setString(2, t.serviceCategory());
            ps.setString(3, t.operation());
            ps.setString(4, Jsons.toCompactJson(t.configuration()));
            ps.setString(5, t.frequency().wireName());
            ps.setInt(6, t.active() ? 1 : 0);
            setNullableString(ps, 7, t.credentialId());
            ps.setLong(8, t.updatedAtMs());
            ps.setString(9, t.taskId());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task definition", e);
        }
    }

    public Optional<TaskDefinition> findTask(String taskId) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM task_definitions WHERE task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toTask(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task definition", e);
        }
    }

    public List<TaskDefinition> listTasks(String tenantId) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM task_definitions WHERE tenant_id=? ORDER BY created_at_ms ASC, task_id ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tenantId);
            return readTasks(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list task definitions", e);
        }
    }

    /**
     * Active tasks with a time-based frequency, oldest trigger first.
     */
    public List<TaskDefinition> listActiveScheduledTasks() {
        String sql = "SELECT " + TASK_COLUMNS + " FROM task_definitions WHERE is_active=1 AND frequency<>? ORDER BY last_trigger_at_ms ASC, task_id ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, Frequency.ON_DEMAND.wireName());
            return readTasks(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list scheduled tasks", e);
        }
    }

    public boolean stampLastTrigger(String taskId, long triggerAtMs) {
        String sql = "UPDATE task_definitions SET last_trigger_at_ms=? WHERE task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, triggerAtMs);
            ps.setString(2, taskId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to stamp last trigger", e);
        }
    }

    /**
     * Removes a task with its executions, results and any expired lease. Refused with
     * {@link TaskBusyException} while a live lease exists.
     */
    public boolean deleteTask(String taskId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement lease = c.prepareStatement(
                    "SELECT execution_id FROM leases WHERE task_id=? AND expires_at_ms>?");
                 PreparedStatement delResults = c.prepareStatement(
                         "DELETE FROM results WHERE execution_id IN (SELECT execution_id FROM executions WHERE task_id=?)");
                 PreparedStatement delExecutions = c.prepareStatement("DELETE FROM executions WHERE task_id=?");
                 PreparedStatement delLease = c.prepareStatement("DELETE FROM leases WHERE task_id=?");
                 PreparedStatement delTask = c.prepareStatement("DELETE FROM task_definitions WHERE task_id=?")) {
                lease.setString(1, taskId);
                lease.setLong(2, nowMs);
                try (ResultSet rs = lease.executeQuery()) {
                    if (rs.next()) {
                        throw new TaskBusyException(taskId, rs.getString("execution_id"));
                    }
                }
                delResults.setString(1, taskId);
                int results = delResults.executeUpdate();
                delExecutions.setString(1, taskId);
                int executions = delExecutions.executeUpdate();
                delLease.setString(1, taskId);
                delLease.executeUpdate();
                delTask.setString(1, taskId);
                boolean removed = delTask.executeUpdate() == 1;
                c.commit();
                if (removed) {
                    logger.debug("Deleted task {} with {} execution(s) and {} result(s)", taskId, executions, results);
                }
                return removed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete task definition", e);
        }
    }

    // ---- leases ----

    /**
     * Takes the task lease on behalf of {@code executionId}. Succeeds when no lease exists, the current
     * one has expired, or it already names the same execution.
     */
    public boolean tryAcquireLease(String taskId, String executionId, String holder, String token, long nowMs, long expiresAtMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(LEASE_UPSERT)) {
            bindLeaseUpsert(ps, taskId, executionId, holder, token, nowMs, expiresAtMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to acquire lease", e);
        }
    }

    public boolean releaseLease(String taskId, String token) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM leases WHERE task_id=? AND token=?")) {
            ps.setString(1, taskId);
            ps.setString(2, token);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lease", e);
        }
    }

    /**
     * Drops whatever lease names {@code executionId}. For executions failed before they ever started,
     * whose hand-off token the worker never saw.
     */
    public boolean releaseLeaseOf(String executionId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM leases WHERE execution_id=?")) {
            ps.setString(1, executionId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lease", e);
        }
    }

    public Optional<Lease> findLease(String taskId) {
        String sql = "SELECT task_id,execution_id,holder,token,acquired_at_ms,expires_at_ms FROM leases WHERE task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Lease(
                        rs.getString("task_id"),
                        rs.getString("execution_id"),
                        rs.getString("holder"),
                        rs.getString("token"),
                        rs.getLong("acquired_at_ms"),
                        rs.getLong("expires_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read lease", e);
        }
    }

    // ---- executions ----

    public void insertQueuedExecution(NewExecution n) {
        String sql = "INSERT INTO executions(execution_id,task_id,tenant_id,trigger_reason,status,queued_at_ms,attempt,updated_at_ms) VALUES(?,?,?,?,?,?,1,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, n.executionId());
            ps.setString(2, n.taskId());
            ps.setString(3, n.tenantId());
            ps.setString(4, n.triggerReason().name());
            ps.setString(5, ExecutionStatus.QUEUED.name());
            ps.setLong(6, n.queuedAtMs());
            ps.setLong(7, n.queuedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert execution", e);
        }
    }

    /**
     * Moves a queued execution to running under a fresh lease, in one transaction. On a lease conflict
     * the execution is failed with {@link ErrorClassification#CONCURRENCY_CONFLICT} in the same
     * transaction. Other executions of the task still recorded running are flagged stale.
     */
    public StartResult startExecution(String executionId, String holder, String token, long nowMs, long expiresAtMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement(
                    "SELECT task_id,status FROM executions WHERE execution_id=?");
                 PreparedStatement lease = c.prepareStatement(LEASE_UPSERT);
                 PreparedStatement holderRead = c.prepareStatement(
                         "SELECT execution_id FROM leases WHERE task_id=?");
                 PreparedStatement run = c.prepareStatement(
                         "UPDATE executions SET status=?,started_at_ms=?,lease_holder=?,lease_token=?,updated_at_ms=? WHERE execution_id=? AND status=?");
                 PreparedStatement others = c.prepareStatement(
                         "SELECT execution_id FROM executions WHERE task_id=? AND status=? AND execution_id<>?");
                 PreparedStatement stale = c.prepareStatement(
                         "UPDATE executions SET status=?,finished_at_ms=?,error_detail=?,lease_token=NULL,updated_at_ms=? WHERE execution_id=? AND status=?")) {
                read.setString(1, executionId);
                String taskId;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return StartResult.notQueued(null);
                    }
                    taskId = rs.getString("task_id");
                    if (!ExecutionStatus.QUEUED.name().equals(rs.getString("status"))) {
                        c.rollback();
                        return StartResult.notQueued(taskId);
                    }
                }

                bindLeaseUpsert(lease, taskId, executionId, holder, token, nowMs, expiresAtMs);
                if (lease.executeUpdate() == 0) {
                    String owner = null;
                    holderRead.setString(1, taskId);
                    try (ResultSet rs = holderRead.executeQuery()) {
                        if (rs.next()) {
                            owner = rs.getString("execution_id");
                        }
                    }
                    boolean failed = writeQueuedFailure(c, executionId, ErrorClassification.CONCURRENCY_CONFLICT,
                            "Task lease held by execution " + owner, nowMs);
                    c.commit();
                    return failed ? StartResult.conflict(taskId, owner) : StartResult.notQueued(taskId);
                }

                run.setString(1, ExecutionStatus.RUNNING.name());
                run.setLong(2, nowMs);
                run.setString(3, holder);
                run.setString(4, token);
                run.setLong(5, nowMs);
                run.setString(6, executionId);
                run.setString(7, ExecutionStatus.QUEUED.name());
                if (run.executeUpdate() == 0) {
                    c.rollback();
                    return StartResult.notQueued(taskId);
                }

                List<String> superseded = new ArrayList<>();
                others.setString(1, taskId);
                others.setString(2, ExecutionStatus.RUNNING.name());
                others.setString(3, executionId);
                try (ResultSet rs = others.executeQuery()) {
                    while (rs.next()) {
                        superseded.add(rs.getString("execution_id"));
                    }
                }
                for (String id : superseded) {
                    stale.setString(1, ExecutionStatus.STALE.name());
                    stale.setLong(2, nowMs);
                    stale.setString(3, "Superseded by execution " + executionId + " after its lease lapsed");
                    stale.setLong(4, nowMs);
                    stale.setString(5, id);
                    stale.setString(6, ExecutionStatus.RUNNING.name());
                    stale.executeUpdate();
                }
                c.commit();
                return StartResult.started(taskId, superseded);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to start execution", e);
        }
    }

    /**
     * Stores the result, marks the execution succeeded and drops its lease in one transaction. Returns
     * false, writing nothing, when the execution is no longer running under {@code leaseToken}.
     */
    public boolean completeSuccess(String executionId, String leaseToken, JsonNode payload, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement done = c.prepareStatement(
                    "UPDATE executions SET status=?,finished_at_ms=?,error_classification=NULL,error_detail=NULL,updated_at_ms=? WHERE execution_id=? AND status=? AND lease_token=?");
                 PreparedStatement result = c.prepareStatement(
                         "INSERT INTO results(execution_id,payload,produced_at_ms) VALUES(?,?,?)")) {
                done.setString(1, ExecutionStatus.SUCCEEDED.name());
                done.setLong(2, nowMs);
                done.setLong(3, nowMs);
                done.setString(4, executionId);
                done.setString(5, ExecutionStatus.RUNNING.name());
                done.setString(6, leaseToken);
                if (done.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                result.setString(1, executionId);
                result.setString(2, Jsons.toCompactJson(payload));
                result.setLong(3, nowMs);
                result.executeUpdate();
                dropOwnLease(c, executionId, leaseToken);
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark execution succeeded", e);
        }
    }

    /**
     * Marks the execution failed and drops its lease in one transaction, fenced like
     * {@link #completeSuccess}.
     */
    public boolean completeFailure(String executionId, String leaseToken, ErrorClassification classification, String detail, long nowMs) {
        String sql = "UPDATE executions SET status=?,finished_at_ms=?,error_classification=?,error_detail=?,updated_at_ms=? WHERE execution_id=? AND status=? AND lease_token=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, ExecutionStatus.FAILED.name());
                ps.setLong(2, nowMs);
                ps.setString(3, classification.wireName());
                setNullableString(ps, 4, detail);
                ps.setLong(5, nowMs);
                ps.setString(6, executionId);
                ps.setString(7, ExecutionStatus.RUNNING.name());
                ps.setString(8, leaseToken);
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                dropOwnLease(c, executionId, leaseToken);
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark execution failed", e);
        }
    }

    /**
     * Fails an execution that never started. Only applies while it is still queued.
     */
    public boolean failQueued(String executionId, ErrorClassification classification, String detail, long nowMs) {
        try (Connection c = database.openConnection()) {
            return writeQueuedFailure(c, executionId, classification, detail, nowMs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fail queued execution", e);
        }
    }

    public Optional<Execution> getExecution(String executionId) {
        String sql = "SELECT " + EXECUTION_COLUMNS + " FROM executions WHERE execution_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toExecution(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read execution", e);
        }
    }

    public Optional<ExecutionResult> getResult(String executionId) {
        String sql = "SELECT execution_id,payload,produced_at_ms FROM results WHERE execution_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new ExecutionResult(
                        rs.getString("execution_id"),
                        Jsons.parse(rs.getString("payload")),
                        rs.getLong("produced_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read result", e);
        }
    }

    /**
     * One page of a task's executions, newest first, starting strictly after {@code after} when given.
     */
    public List<Execution> listExecutions(String taskId, ExecutionCursor after, int limit) {
        int safeLimit = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        String sql = after == null
                ? "SELECT " + EXECUTION_COLUMNS + " FROM executions WHERE task_id=? ORDER BY queued_at_ms DESC, execution_id DESC LIMIT ?"
                : "SELECT " + EXECUTION_COLUMNS + " FROM executions WHERE task_id=? AND (queued_at_ms<? OR (queued_at_ms=? AND execution_id<?)) ORDER BY queued_at_ms DESC, execution_id DESC LIMIT ?";
        List<Execution> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            if (after == null) {
                ps.setInt(2, safeLimit);
            } else {
                ps.setLong(2, after.queuedAtMs());
                ps.setLong(3, after.queuedAtMs());
                ps.setString(4, after.executionId());
                ps.setInt(5, safeLimit);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toExecution(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list executions", e);
        }
    }

    public int countExecutions(String taskId, ExecutionStatus status) {
        String sql = "SELECT COUNT(1) FROM executions WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            ps.setString(2, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count executions", e);
        }
    }

    /**
     * Flags running executions whose lease is missing, expired, or owned by another execution as
     * stale, and drops expired leases that still name them. Returns the flagged executions.
     */
    public List<Execution> markStaleExecutions(long nowMs) {
        String select = "SELECT e.execution_id FROM executions e LEFT JOIN leases l ON l.task_id=e.task_id "
                + "WHERE e.status=? AND (l.task_id IS NULL OR l.expires_at_ms<=? OR l.execution_id<>e.execution_id) "
                + "ORDER BY e.started_at_ms ASC";
        List<String> flagged = new ArrayList<>();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(select);
                 PreparedStatement mark = c.prepareStatement(
                         "UPDATE executions SET status=?,finished_at_ms=?,error_detail=?,lease_token=NULL,updated_at_ms=? WHERE execution_id=? AND status=?");
                 PreparedStatement dropLease = c.prepareStatement(
                         "DELETE FROM leases WHERE execution_id=? AND expires_at_ms<=?")) {
                ps.setString(1, ExecutionStatus.RUNNING.name());
                ps.setLong(2, nowMs);
                List<String> candidates = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString("execution_id"));
                    }
                }
                for (String id : candidates) {
                    mark.setString(1, ExecutionStatus.STALE.name());
                    mark.setLong(2, nowMs);
                    mark.setString(3, "Execution lease lost while running");
                    mark.setLong(4, nowMs);
                    mark.setString(5, id);
                    mark.setString(6, ExecutionStatus.RUNNING.name());
                    if (mark.executeUpdate() == 1) {
                        flagged.add(id);
                        dropLease.setString(1, id);
                        dropLease.setLong(2, nowMs);
                        dropLease.executeUpdate();
                    }
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reconcile stale executions", e);
        }
        List<Execution> out = new ArrayList<>(flagged.size());
        for (String id : flagged) {
            getExecution(id).ifPresent(out::add);
        }
        return out;
    }

    public List<Execution> listStaleExecutions(int limit) {
        String sql = "SELECT " + EXECUTION_COLUMNS + " FROM executions WHERE status=? ORDER BY updated_at_ms DESC, execution_id DESC LIMIT ?";
        List<Execution> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ExecutionStatus.STALE.name());
            ps.setInt(2, Math.max(1, Math.min(1000, limit)));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toExecution(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list stale executions", e);
        }
    }

    private boolean writeQueuedFailure(Connection c, String executionId, ErrorClassification classification, String detail, long nowMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE executions SET status=?,finished_at_ms=?,error_classification=?,error_detail=?,updated_at_ms=? WHERE execution_id=? AND status=?")) {
            ps.setString(1, ExecutionStatus.FAILED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, classification.wireName());
            setNullableString(ps, 4, detail);
            ps.setLong(5, nowMs);
            ps.setString(6, executionId);
            ps.setString(7, ExecutionStatus.QUEUED.name());
            return ps.executeUpdate() == 1;
        }
    }

    private static void dropOwnLease(Connection c, String executionId, String leaseToken) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM leases WHERE execution_id=? AND token=?")) {
            ps.setString(1, executionId);
            ps.setString(2, leaseToken);
            ps.executeUpdate();
        }
    }

    private void bindLeaseUpsert(PreparedStatement ps, String taskId, String executionId, String holder, String token,
                                 long nowMs, long expiresAtMs) throws SQLException {
        ps.setString(1, taskId);
        ps.setString(2, executionId);
        ps.setString(3, holder);
        ps.setString(4, token);
        ps.setLong(5, nowMs);
        ps.setLong(6, expiresAtMs);
        ps.setLong(7, nowMs);
    }

    private List<TaskDefinition> readTasks(PreparedStatement ps) throws SQLException {
        List<TaskDefinition> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(toTask(rs));
            }
        }
        return out;
    }

    private TaskDefinition toTask(ResultSet rs) throws SQLException {
        return new TaskDefinition(
                rs.getString("task_id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("service_category"),
                rs.getString("operation"),
                Jsons.parse(rs.getString("configuration")),
                Frequency.fromString(rs.getString("frequency")),
                rs.getInt("is_active") == 1,
                rs.getString("credential_id"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                rs.getLong("last_trigger_at_ms")
        );
    }

    private Execution toExecution(ResultSet rs) throws SQLException {
        return new Execution(
                rs.getString("execution_id"),
                rs.getString("task_id"),
                rs.getString("tenant_id"),
                TriggerReason.fromString(rs.getString("trigger_reason")),
                ExecutionStatus.valueOf(rs.getString("status")),
                rs.getLong("queued_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "finished_at_ms"),
                rs.getInt("attempt"),
                ErrorClassification.fromWireName(rs.getString("error_classification")),
                rs.getString("error_detail"),
                rs.getString("lease_holder")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    public record NewExecution(String executionId, String taskId, String tenantId, TriggerReason triggerReason, long queuedAtMs) {}

    public enum StartOutcome {
        STARTED,
        LEASE_CONFLICT,
        NOT_QUEUED
    }

    public record StartResult(StartOutcome outcome, String taskId, String leaseOwnerExecutionId, List<String> supersededExecutionIds) {
        public static StartResult started(String taskId, List<String> superseded) {
            return new StartResult(StartOutcome.STARTED, taskId, null, List.copyOf(superseded));
        }

        public static StartResult conflict(String taskId, String ownerExecutionId) {
            return new StartResult(StartOutcome.LEASE_CONFLICT, taskId, ownerExecutionId, List.of());
        }

        public static StartResult notQueued(String taskId) {
            return new StartResult(StartOutcome.NOT_QUEUED, taskId, null, List.of());
        }
    }
}

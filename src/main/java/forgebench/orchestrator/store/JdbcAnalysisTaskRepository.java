package forgebench.orchestrator.store;

import forgebench.orchestrator.model.AnalysisStatus;
import forgebench.orchestrator.model.AnalysisTask;
import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.repository.AnalysisTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static forgebench.orchestrator.store.JdbcSupport.rollback;
import static forgebench.orchestrator.store.JdbcSupport.setTimestamp;
import static forgebench.orchestrator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of AnalysisTaskRepository.
 * Tool names are stored as a comma-separated list; services by wire name.
 */
public class JdbcAnalysisTaskRepository implements AnalysisTaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAnalysisTaskRepository.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final Database db;

    public JdbcAnalysisTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void saveAll(List<AnalysisTask> tasks) {
        if (tasks.isEmpty())
            return;

        String sql = """
                    INSERT INTO analysis_tasks (id, parent_id, pipeline_id, status, service_name, target_model,
                                                target_app_number, tools, progress, retry_count, max_retries,
                                                result_summary, error_message, metadata, created_at, started_at,
                                                completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (AnalysisTask task : tasks) {
                    ps.setString(1, task.id());
                    ps.setString(2, task.parentId());
                    ps.setString(3, task.pipelineId());
                    ps.setString(4, task.status().name());
                    ps.setString(5, task.service() != null ? task.service().wireName() : null);
                    ps.setString(6, task.targetModel());
                    ps.setInt(7, task.targetAppNumber());
                    ps.setString(8, String.join(",", task.tools()));
                    ps.setInt(9, task.progress());
                    ps.setInt(10, task.retryCount());
                    ps.setInt(11, task.maxRetries());
                    ps.setString(12, task.resultSummary());
                    ps.setString(13, truncate(task.errorMessage()));
                    ps.setString(14, task.metadata());
                    setTimestamp(ps, 15, task.createdAt() != null ? task.createdAt() : Instant.now());
                    setTimestamp(ps, 16, task.startedAt());
                    setTimestamp(ps, 17, task.completedAt());
                    ps.addBatch();
                }

                ps.executeBatch();
                conn.commit();

                log.debug("Saved {} analysis tasks", tasks.size());
            } catch (SQLException e) {
                rollback(conn);
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save analysis tasks: " + tasks.get(0).id(), e);
        }
    }

    @Override
    public Optional<AnalysisTask> findById(String taskId) {
        String sql = "SELECT * FROM analysis_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find analysis task: " + taskId, e);
        }
    }

    @Override
    public List<AnalysisTask> findSubtasks(String parentId) {
        String sql = "SELECT * FROM analysis_tasks WHERE parent_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, parentId);
            List<AnalysisTask> subtasks = executeQuery(ps);
            // one subtask per service, created in service order
            subtasks.sort(Comparator.comparing(AnalysisTask::service, Comparator.nullsLast(Comparator.naturalOrder())));
            return subtasks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find subtasks of: " + parentId, e);
        }
    }

    @Override
    public List<AnalysisTask> findByStatus(AnalysisStatus status, int limit) {
        String sql = "SELECT * FROM analysis_tasks WHERE status = ? ORDER BY created_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find analysis tasks by status: " + status, e);
        }
    }

    @Override
    public List<AnalysisTask> findRunningStartedBefore(Instant cutoff) {
        String sql = """
                    SELECT * FROM analysis_tasks
                    WHERE status = 'RUNNING' AND started_at < ?
                    ORDER BY started_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck running tasks", e);
        }
    }

    @Override
    public List<AnalysisTask> findPendingCreatedBefore(Instant cutoff) {
        String sql = """
                    SELECT * FROM analysis_tasks
                    WHERE status = 'PENDING' AND created_at < ?
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale pending tasks", e);
        }
    }

    @Override
    public boolean markRunning(String taskId, Instant startedAt) {
        String sql = """
                    UPDATE analysis_tasks
                    SET status = 'RUNNING', started_at = ?, error_message = NULL
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(startedAt));
            ps.setString(2, taskId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark analysis task running: " + taskId, e);
        }
    }

    @Override
    public boolean markCompleted(String taskId, String resultSummary, Instant completedAt) {
        String sql = """
                    UPDATE analysis_tasks
                    SET status = 'COMPLETED', progress = 100, result_summary = ?, error_message = NULL,
                        completed_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resultSummary);
            ps.setTimestamp(2, Timestamp.from(completedAt));
            ps.setString(3, taskId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Analysis task {} completed", taskId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete analysis task: " + taskId, e);
        }
    }

    @Override
    public boolean markFailed(String taskId, String errorMessage, Instant completedAt) {
        String sql = """
                    UPDATE analysis_tasks
                    SET status = 'FAILED', error_message = ?, completed_at = ?,
                        retry_count = retry_count + 1
                    WHERE id = ? AND status IN ('PENDING', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(errorMessage));
            ps.setTimestamp(2, Timestamp.from(completedAt));
            ps.setString(3, taskId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Analysis task {} marked as FAILED: {}", taskId, errorMessage);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark analysis task as failed: " + taskId, e);
        }
    }

    @Override
    public boolean markCancelled(String taskId, AnalysisStatus expected, String reason, Instant completedAt) {
        String sql = """
                    UPDATE analysis_tasks
                    SET status = 'CANCELLED', error_message = ?, completed_at = ?
                    WHERE id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(reason));
            ps.setTimestamp(2, Timestamp.from(completedAt));
            ps.setString(3, taskId);
            ps.setString(4, expected.name());
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel analysis task: " + taskId, e);
        }
    }

    @Override
    public boolean resetForRetry(String taskId) {
        String sql = """
                    UPDATE analysis_tasks
                    SET status = 'PENDING', error_message = NULL, started_at = NULL, completed_at = NULL
                    WHERE id = ? AND status = 'FAILED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Analysis task {} reset to PENDING for retry", taskId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset analysis task: " + taskId, e);
        }
    }

    @Override
    public boolean markRunningForRetry(String taskId, AnalysisStatus expected, Instant startedAt) {
        String sql = """
                    UPDATE analysis_tasks
                    SET status = 'RUNNING', started_at = ?, completed_at = NULL, error_message = NULL
                    WHERE id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(startedAt));
            ps.setString(2, taskId);
            ps.setString(3, expected.name());
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Analysis task {} back to RUNNING for retry", taskId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to restart analysis task: " + taskId, e);
        }
    }

    @Override
    public boolean updateRollup(String taskId, AnalysisStatus status, int progress, String resultSummary,
            String errorMessage, Instant startedAt, Instant completedAt) {
        String sql = """
                    UPDATE analysis_tasks
                    SET status = ?, progress = ?, result_summary = ?, error_message = ?,
                        started_at = COALESCE(started_at, ?), completed_at = ?
                    WHERE id = ? AND status <> 'CANCELLED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, progress);
            ps.setString(3, resultSummary);
            ps.setString(4, truncate(errorMessage));
            setTimestamp(ps, 5, startedAt);
            setTimestamp(ps, 6, completedAt);
            ps.setString(7, taskId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update main task: " + taskId, e);
        }
    }

    @Override
    public int countByStatus(AnalysisStatus status) {
        String sql = "SELECT COUNT(*) FROM analysis_tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count analysis tasks", e);
        }
    }

    // ========== Helper methods ==========

    private List<AnalysisTask> executeQuery(PreparedStatement ps) throws SQLException {
        List<AnalysisTask> tasks = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tasks.add(mapRow(rs));
            }
        }
        return tasks;
    }

    private AnalysisTask mapRow(ResultSet rs) throws SQLException {
        String serviceName = rs.getString("service_name");
        String tools = rs.getString("tools");

        return AnalysisTask.builder()
                .id(rs.getString("id"))
                .parentId(rs.getString("parent_id"))
                .pipelineId(rs.getString("pipeline_id"))
                .status(AnalysisStatus.valueOf(rs.getString("status")))
                .service(serviceName != null ? ServiceType.fromWireName(serviceName) : null)
                .targetModel(rs.getString("target_model"))
                .targetAppNumber(rs.getInt("target_app_number"))
                .tools(tools == null || tools.isEmpty() ? List.of() : Arrays.asList(tools.split(",")))
                .progress(rs.getInt("progress"))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .resultSummary(rs.getString("result_summary"))
                .errorMessage(rs.getString("error_message"))
                .metadata(rs.getString("metadata"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}

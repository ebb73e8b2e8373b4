package forgebench.orchestrator.store;

import forgebench.orchestrator.model.PipelineRun;
import forgebench.orchestrator.model.PipelineStatus;
import forgebench.orchestrator.model.StageProgress;
import forgebench.orchestrator.repository.PipelineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static forgebench.orchestrator.store.JdbcSupport.setTimestamp;
import static forgebench.orchestrator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of PipelineRepository.
 */
public class JdbcPipelineRepository implements PipelineRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPipelineRepository.class);

    private final Database db;

    public JdbcPipelineRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(PipelineRun run) {
        String sql = """
                    INSERT INTO pipeline_runs (id, config, status, gen_total, gen_completed, gen_failed, gen_in_flight,
                                               an_total, an_completed, an_failed, an_in_flight, error_message,
                                               created_at, started_at, finished_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant created = run.createdAt() != null ? run.createdAt() : Instant.now();
            ps.setString(1, run.id());
            ps.setString(2, run.config());
            ps.setString(3, run.status().name());
            bindProgress(ps, 4, run.generation());
            bindProgress(ps, 8, run.analysis());
            ps.setString(12, run.errorMessage());
            setTimestamp(ps, 13, created);
            setTimestamp(ps, 14, run.startedAt());
            setTimestamp(ps, 15, run.finishedAt());
            setTimestamp(ps, 16, run.updatedAt() != null ? run.updatedAt() : created);

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved pipeline run: {}", run.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save pipeline run: " + run.id(), e);
        }
    }

    @Override
    public void update(PipelineRun run) {
        String sql = """
                    UPDATE pipeline_runs
                    SET status = ?, gen_total = ?, gen_completed = ?, gen_failed = ?, gen_in_flight = ?,
                        an_total = ?, an_completed = ?, an_failed = ?, an_in_flight = ?, error_message = ?,
                        started_at = ?, finished_at = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.status().name());
            bindProgress(ps, 2, run.generation());
            bindProgress(ps, 6, run.analysis());
            ps.setString(10, run.errorMessage());
            setTimestamp(ps, 11, run.startedAt());
            setTimestamp(ps, 12, run.finishedAt());
            setTimestamp(ps, 13, run.updatedAt() != null ? run.updatedAt() : Instant.now());
            ps.setString(14, run.id());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update pipeline run: " + run.id(), e);
        }
    }

    @Override
    public Optional<PipelineRun> findById(String runId) {
        String sql = "SELECT * FROM pipeline_runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find pipeline run: " + runId, e);
        }
    }

    @Override
    public List<PipelineRun> findByStatuses(Set<PipelineStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT * FROM pipeline_runs WHERE status IN (" + placeholders + ") ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (PipelineStatus status : statuses) {
                ps.setString(i++, status.name());
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find pipeline runs by status: " + statuses, e);
        }
    }

    @Override
    public List<PipelineRun> findRecent(int limit) {
        String sql = "SELECT * FROM pipeline_runs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent pipeline runs", e);
        }
    }

    @Override
    public boolean markCancelled(String runId, PipelineStatus expected, String reason, Instant now) {
        String sql = """
                    UPDATE pipeline_runs
                    SET status = 'CANCELLED', error_message = ?, finished_at = ?, updated_at = ?,
                        gen_in_flight = 0, an_in_flight = 0
                    WHERE id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setString(1, reason);
            ps.setTimestamp(2, ts);
            ps.setTimestamp(3, ts);
            ps.setString(4, runId);
            ps.setString(5, expected.name());
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel pipeline run: " + runId, e);
        }
    }

    @Override
    public int countByStatus(PipelineStatus status) {
        String sql = "SELECT COUNT(*) FROM pipeline_runs WHERE status = ?";

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
            throw new RuntimeException("Failed to count pipeline runs", e);
        }
    }

    // ========== Helper methods ==========

    private void bindProgress(PreparedStatement ps, int firstIndex, StageProgress progress) throws SQLException {
        ps.setInt(firstIndex, progress.total());
        ps.setInt(firstIndex + 1, progress.completed());
        ps.setInt(firstIndex + 2, progress.failed());
        ps.setInt(firstIndex + 3, progress.inFlight());
    }

    private List<PipelineRun> executeQuery(PreparedStatement ps) throws SQLException {
        List<PipelineRun> runs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                runs.add(mapRow(rs));
            }
        }
        return runs;
    }

    private PipelineRun mapRow(ResultSet rs) throws SQLException {
        return PipelineRun.builder()
                .id(rs.getString("id"))
                .config(rs.getString("config"))
                .status(PipelineStatus.valueOf(rs.getString("status")))
                .generation(new StageProgress(
                        rs.getInt("gen_total"),
                        rs.getInt("gen_completed"),
                        rs.getInt("gen_failed"),
                        rs.getInt("gen_in_flight")))
                .analysis(new StageProgress(
                        rs.getInt("an_total"),
                        rs.getInt("an_completed"),
                        rs.getInt("an_failed"),
                        rs.getInt("an_in_flight")))
                .errorMessage(rs.getString("error_message"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}

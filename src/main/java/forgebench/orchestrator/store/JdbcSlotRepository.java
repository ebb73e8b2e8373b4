package forgebench.orchestrator.store;

import forgebench.orchestrator.model.ApplicationSlot;
import forgebench.orchestrator.repository.SlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static forgebench.orchestrator.store.JdbcSupport.isConflict;
import static forgebench.orchestrator.store.JdbcSupport.rollback;
import static forgebench.orchestrator.store.JdbcSupport.setTimestamp;
import static forgebench.orchestrator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of SlotRepository.
 * The next app number is computed and inserted by one statement; the unique
 * (model, app_number, version) key rejects whichever concurrent writer lost.
 */
public class JdbcSlotRepository implements SlotRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSlotRepository.class);

    private static final String INSERT_SQL = """
                INSERT INTO application_slots (id, model, app_number, version, parent_slot_id, template, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private final Database db;

    public JdbcSlotRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<ApplicationSlot> tryInsertNext(String id, String model, String template, Instant createdAt) {
        String insertSql = """
                    INSERT INTO application_slots (id, model, app_number, version, parent_slot_id, template, created_at)
                    SELECT CAST(? AS VARCHAR(64)), CAST(? AS VARCHAR(256)), COALESCE(MAX(app_number), 0) + 1, 1,
                           CAST(NULL AS VARCHAR(64)), CAST(? AS VARCHAR(256)), CAST(? AS TIMESTAMP)
                    FROM application_slots
                    WHERE model = ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, id);
                ps.setString(2, model);
                ps.setString(3, template);
                setTimestamp(ps, 4, createdAt);
                ps.setString(5, model);
                ps.executeUpdate();

                Optional<ApplicationSlot> inserted = findById(conn, id);
                conn.commit();
                return inserted;
            } catch (SQLException e) {
                rollback(conn);
                if (isConflict(e)) {
                    log.debug("Next-slot insert for {} lost a race: {}", model, e.getMessage());
                    return Optional.empty();
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to allocate slot for model: " + model, e);
        }
    }

    @Override
    public Optional<ApplicationSlot> tryInsert(ApplicationSlot slot) {
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                bindSlot(ps, slot);
                ps.executeUpdate();
                conn.commit();
                return Optional.of(slot);
            } catch (SQLException e) {
                rollback(conn);
                if (isConflict(e)) {
                    log.debug("Slot {} already taken", slot.label());
                    return Optional.empty();
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert slot: " + slot.label(), e);
        }
    }

    @Override
    public Optional<ApplicationSlot> tryInsertVersion(ApplicationSlot parent, String id, Instant createdAt) {
        String latestSql = """
                    SELECT MAX(version) FROM application_slots
                    WHERE model = ? AND app_number = ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement latestPs = conn.prepareStatement(latestSql);
                    PreparedStatement insertPs = conn.prepareStatement(INSERT_SQL)) {

                latestPs.setString(1, parent.model());
                latestPs.setInt(2, parent.appNumber());
                int latestVersion;
                try (ResultSet rs = latestPs.executeQuery()) {
                    latestVersion = rs.next() ? rs.getInt(1) : 0;
                }

                if (latestVersion != parent.version()) {
                    conn.rollback();
                    log.debug("Refusing to branch {}: latest version is {}", parent.label(), latestVersion);
                    return Optional.empty();
                }

                ApplicationSlot next = new ApplicationSlot(id, parent.model(), parent.appNumber(),
                        parent.version() + 1, parent.id(), parent.template(), createdAt);
                bindSlot(insertPs, next);
                insertPs.executeUpdate();
                conn.commit();
                return Optional.of(next);
            } catch (SQLException e) {
                rollback(conn);
                if (isConflict(e)) {
                    log.debug("Version insert after {} lost a race", parent.label());
                    return Optional.empty();
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create version of slot: " + parent.id(), e);
        }
    }

    @Override
    public Optional<ApplicationSlot> findById(String id) {
        try (Connection conn = db.getConnection()) {
            return findById(conn, id);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find slot: " + id, e);
        }
    }

    @Override
    public Optional<ApplicationSlot> findLatest(String model, int appNumber) {
        String sql = """
                    SELECT * FROM application_slots
                    WHERE model = ? AND app_number = ?
                    ORDER BY version DESC
                    LIMIT 1
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, model);
            ps.setInt(2, appNumber);
            List<ApplicationSlot> slots = executeQuery(ps);
            return slots.isEmpty() ? Optional.empty() : Optional.of(slots.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find latest slot: " + model + "/app" + appNumber, e);
        }
    }

    @Override
    public List<ApplicationSlot> findLineage(String model, int appNumber) {
        String sql = "SELECT * FROM application_slots WHERE model = ? AND app_number = ? ORDER BY version";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, model);
            ps.setInt(2, appNumber);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load lineage: " + model + "/app" + appNumber, e);
        }
    }

    @Override
    public List<ApplicationSlot> findByModel(String model) {
        String sql = """
                    SELECT s.* FROM application_slots s
                    WHERE s.model = ?
                      AND s.version = (SELECT MAX(v.version) FROM application_slots v
                                       WHERE v.model = s.model AND v.app_number = s.app_number)
                    ORDER BY s.app_number
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, model);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find slots for model: " + model, e);
        }
    }

    // ========== Helper methods ==========

    private Optional<ApplicationSlot> findById(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM application_slots WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    private void bindSlot(PreparedStatement ps, ApplicationSlot slot) throws SQLException {
        ps.setString(1, slot.id());
        ps.setString(2, slot.model());
        ps.setInt(3, slot.appNumber());
        ps.setInt(4, slot.version());
        ps.setString(5, slot.parentSlotId());
        ps.setString(6, slot.template());
        setTimestamp(ps, 7, slot.createdAt() != null ? slot.createdAt() : Instant.now());
    }

    private List<ApplicationSlot> executeQuery(PreparedStatement ps) throws SQLException {
        List<ApplicationSlot> slots = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                slots.add(mapRow(rs));
            }
        }
        return slots;
    }

    private ApplicationSlot mapRow(ResultSet rs) throws SQLException {
        return new ApplicationSlot(
                rs.getString("id"),
                rs.getString("model"),
                rs.getInt("app_number"),
                rs.getInt("version"),
                rs.getString("parent_slot_id"),
                rs.getString("template"),
                toInstant(rs.getTimestamp("created_at")));
    }
}

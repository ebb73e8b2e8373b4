package forgebench.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import forgebench.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("forgebench-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- APPLICATION SLOTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS application_slots (
                            id              VARCHAR(64) PRIMARY KEY,
                            model           VARCHAR(256) NOT NULL,
                            app_number      INT NOT NULL,
                            version         INT NOT NULL DEFAULT 1,
                            parent_slot_id  VARCHAR(64),
                            template        VARCHAR(256),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_slot_version UNIQUE (model, app_number, version)
                        );
                    """);

            // ---------- ANALYSIS TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS analysis_tasks (
                            id                VARCHAR(64) PRIMARY KEY,
                            parent_id         VARCHAR(64),
                            pipeline_id       VARCHAR(64),
                            status            VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                            service_name      VARCHAR(64),
                            target_model      VARCHAR(256) NOT NULL,
                            target_app_number INT NOT NULL,
                            tools             CLOB,
                            progress          INT DEFAULT 0,
                            retry_count       INT DEFAULT 0,
                            max_retries       INT DEFAULT 3,
                            result_summary    CLOB,
                            error_message     VARCHAR(2048),
                            metadata          CLOB,
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at        TIMESTAMP,
                            completed_at      TIMESTAMP
                        );
                    """);

            // ---------- PIPELINE RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS pipeline_runs (
                            id              VARCHAR(64) PRIMARY KEY,
                            config          CLOB NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            gen_total       INT DEFAULT 0,
                            gen_completed   INT DEFAULT 0,
                            gen_failed      INT DEFAULT 0,
                            gen_in_flight   INT DEFAULT 0,
                            an_total        INT DEFAULT 0,
                            an_completed    INT DEFAULT 0,
                            an_failed       INT DEFAULT 0,
                            an_in_flight    INT DEFAULT 0,
                            error_message   VARCHAR(2048),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at      TIMESTAMP,
                            finished_at     TIMESTAMP,
                            updated_at      TIMESTAMP
                        );
                    """);

            // ---------- NAMED LOCKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS named_locks (
                            name        VARCHAR(256) PRIMARY KEY,
                            owner       VARCHAR(64) NOT NULL,
                            expires_at  TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_slots_model ON application_slots(model, app_number);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_parent ON analysis_tasks(parent_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_created ON analysis_tasks(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_pipeline ON analysis_tasks(pipeline_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_pipelines_status ON pipeline_runs(status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}

package forgebench.orchestrator.store;

import forgebench.orchestrator.model.PipelineRun;
import forgebench.orchestrator.model.PipelineStatus;
import forgebench.orchestrator.model.StageProgress;
import forgebench.orchestrator.testing.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPipelineRepositoryTest {

    private static Database db;
    private static JdbcPipelineRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-pipelines");
        repo = new JdbcPipelineRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanRuns() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM pipeline_runs");
            conn.commit();
        }
    }

    private static PipelineRun run(String id, PipelineStatus status) {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        return PipelineRun.builder()
                .id(id)
                .config("{}")
                .status(status)
                .generation(StageProgress.ofTotal(4))
                .analysis(StageProgress.ofTotal(4))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Test
    void saveUpdateAndFind() {
        repo.save(run("p1", PipelineStatus.PENDING));

        PipelineRun updated = run("p1", PipelineStatus.RUNNING).toBuilder()
                .generation(new StageProgress(4, 2, 1, 1))
                .build();
        repo.update(updated);

        PipelineRun found = repo.findById("p1").orElseThrow();
        assertEquals(PipelineStatus.RUNNING, found.status());
        assertEquals(new StageProgress(4, 2, 1, 1), found.generation());
        assertEquals(StageProgress.ofTotal(4), found.analysis());
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    void findByStatusesAndCount() {
        repo.save(run("a", PipelineStatus.RUNNING));
        repo.save(run("b", PipelineStatus.PENDING));
        repo.save(run("c", PipelineStatus.COMPLETED));

        assertEquals(2, repo.findByStatuses(EnumSet.of(PipelineStatus.PENDING, PipelineStatus.RUNNING)).size());
        assertEquals(1, repo.countByStatus(PipelineStatus.COMPLETED));
        assertEquals(3, repo.findRecent(10).size());
    }

    @Test
    void conditionalCancel() {
        repo.save(run("r", PipelineStatus.RUNNING).toBuilder()
                .generation(new StageProgress(4, 1, 0, 2))
                .build());
        Instant now = Instant.parse("2026-03-01T13:00:00Z");

        assertFalse(repo.markCancelled("r", PipelineStatus.PENDING, "reclaimed", now));
        assertTrue(repo.markCancelled("r", PipelineStatus.RUNNING, "reclaimed", now));

        PipelineRun cancelled = repo.findById("r").orElseThrow();
        assertEquals(PipelineStatus.CANCELLED, cancelled.status());
        assertEquals("reclaimed", cancelled.errorMessage());
        assertEquals(0, cancelled.generation().inFlight());
        assertEquals(now, cancelled.finishedAt());
    }
}

package forgebench.orchestrator.scheduler;

import forgebench.orchestrator.config.OrchestratorConfig;
import forgebench.orchestrator.store.Database;
import forgebench.orchestrator.store.JdbcAnalysisTaskRepository;
import forgebench.orchestrator.store.JdbcPipelineRepository;
import forgebench.orchestrator.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private Database db;

    @BeforeEach
    void setUp() {
        db = TestDatabases.create("test-scheduler");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void runsSweepAtStartupAndHealthChecksPeriodically() throws Exception {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withMaintenanceInterval(Duration.ofHours(1))
                .withHealthCheckInterval(Duration.ofMillis(50));
        MaintenanceSweep sweep = new MaintenanceSweep(new JdbcAnalysisTaskRepository(db),
                new JdbcPipelineRepository(db), id -> false, config);
        CountDownLatch healthChecks = new CountDownLatch(3);

        try (Scheduler scheduler = new Scheduler(sweep, () -> {
            healthChecks.countDown();
            throw new IllegalStateException("probe blew up");
        }, config)) {
            scheduler.start();
            assertTrue(scheduler.isRunning());

            // a failing health check must not cancel later runs
            assertTrue(healthChecks.await(5, TimeUnit.SECONDS));
            assertEquals(1, sweep.status().runs());

            scheduler.stop();
            assertFalse(scheduler.isRunning());
        }
    }
}

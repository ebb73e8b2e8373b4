package forgebench.orchestrator.scheduler;

import forgebench.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - MaintenanceSweep: reclaims stuck tasks and orphaned pipeline runs, once
 * at startup and then every maintenance interval
 * - Endpoint health check: actively probes every worker endpoint
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final MaintenanceSweep maintenanceSweep;
    private final Runnable healthCheck;
    private final OrchestratorConfig config;

    private volatile boolean running = false;

    /**
     * Create scheduler.
     *
     * @param maintenanceSweep the sweep to run
     * @param healthCheck      runnable probing all endpoints (typically
     *                         EndpointPool::checkAll)
     * @param config           configuration
     */
    public Scheduler(MaintenanceSweep maintenanceSweep, Runnable healthCheck, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "forgebench-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.maintenanceSweep = maintenanceSweep;
        this.healthCheck = healthCheck;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        // Maintenance runs immediately, then periodically
        long maintenanceIntervalMs = config.maintenanceInterval().toMillis();
        executor.scheduleAtFixedRate(
                maintenanceSweep,
                0, // initial delay
                maintenanceIntervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Maintenance sweep scheduled every {}ms", maintenanceIntervalMs);

        long healthIntervalMs = config.healthCheckInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("endpoint-health-check", healthCheck),
                healthIntervalMs,
                healthIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Endpoint health check scheduled every {}ms", healthIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public MaintenanceSweep maintenanceSweep() {
        return maintenanceSweep;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}

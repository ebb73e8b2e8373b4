package forgebench.orchestrator.config;

import forgebench.orchestrator.api.v1.EndpointController;
import forgebench.orchestrator.api.v1.HealthController;
import forgebench.orchestrator.api.v1.MaintenanceController;
import forgebench.orchestrator.api.v1.PipelineController;
import forgebench.orchestrator.api.v1.TaskController;
import forgebench.orchestrator.pool.EndpointPool;
import forgebench.orchestrator.repository.AnalysisTaskRepository;
import forgebench.orchestrator.repository.DistributedLock;
import forgebench.orchestrator.repository.PipelineRepository;
import forgebench.orchestrator.repository.SlotRepository;
import forgebench.orchestrator.scheduler.JobScheduler;
import forgebench.orchestrator.scheduler.MaintenanceSweep;
import forgebench.orchestrator.scheduler.Scheduler;
import forgebench.orchestrator.server.RouterHandler;
import forgebench.orchestrator.service.ApplicationGenerator;
import forgebench.orchestrator.service.HttpApplicationGenerator;
import forgebench.orchestrator.service.ReservationStore;
import forgebench.orchestrator.service.ResultAggregator;
import forgebench.orchestrator.service.TaskOrchestrator;
import forgebench.orchestrator.store.Database;
import forgebench.orchestrator.store.JdbcAnalysisTaskRepository;
import forgebench.orchestrator.store.JdbcDistributedLock;
import forgebench.orchestrator.store.JdbcPipelineRepository;
import forgebench.orchestrator.store.JdbcSlotRepository;
import forgebench.orchestrator.worker.NettyWorkerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.start(); // poll loop, maintenance sweep, health checks
 * JobScheduler jobs = deps.jobScheduler();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Database database;
    private final SlotRepository slotRepository;
    private final AnalysisTaskRepository taskRepository;
    private final PipelineRepository pipelineRepository;
    private final DistributedLock lock;
    private final NettyWorkerClient workerClient;
    private final EndpointPool endpointPool;
    private final ReservationStore reservationStore;
    private final ApplicationGenerator generator;
    private final TaskOrchestrator taskOrchestrator;
    private final JobScheduler jobScheduler;
    private final MaintenanceSweep maintenanceSweep;
    private final Scheduler scheduler;
    private final ExecutorService adHocExecutor;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(OrchestratorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.lock = new JdbcDistributedLock(database, config.lockTimeout(), config.lockWait());

        // Repositories
        this.slotRepository = new JdbcSlotRepository(database);
        this.taskRepository = new JdbcAnalysisTaskRepository(database);
        this.pipelineRepository = new JdbcPipelineRepository(database);

        // Workers
        this.workerClient = new NettyWorkerClient(config.connectTimeout());
        this.endpointPool = EndpointPool.fromConfig(config, workerClient);

        // Services
        this.reservationStore = new ReservationStore(slotRepository, lock);
        this.generator = new HttpApplicationGenerator(config.generatorUrl(), config.connectTimeout(),
                config.generationTimeout());
        this.taskOrchestrator = new TaskOrchestrator(taskRepository, endpointPool, workerClient,
                new ResultAggregator(), lock, config);
        this.jobScheduler = new JobScheduler(pipelineRepository, reservationStore, generator, taskOrchestrator,
                config);

        // Background
        this.maintenanceSweep = new MaintenanceSweep(taskRepository, pipelineRepository, jobScheduler::isTracking,
                taskOrchestrator::rollup, config, Clock.systemUTC());
        this.scheduler = new Scheduler(maintenanceSweep, endpointPool::checkAll, config);
        this.adHocExecutor = Executors.newFixedThreadPool(config.analysisPoolSize(), adHocThreads());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public AnalysisTaskRepository taskRepository() {
        return taskRepository;
    }

    public PipelineRepository pipelineRepository() {
        return pipelineRepository;
    }

    public EndpointPool endpointPool() {
        return endpointPool;
    }

    public ReservationStore reservationStore() {
        return reservationStore;
    }

    public TaskOrchestrator taskOrchestrator() {
        return taskOrchestrator;
    }

    public JobScheduler jobScheduler() {
        return jobScheduler;
    }

    public MaintenanceSweep maintenanceSweep() {
        return maintenanceSweep;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, endpointPool, jobScheduler, taskRepository))
                    .registerController(new PipelineController(jobScheduler, pipelineRepository))
                    .registerController(new TaskController(taskOrchestrator, adHocExecutor))
                    .registerController(new EndpointController(endpointPool))
                    .registerController(new MaintenanceController(maintenanceSweep));
            log.info("RouterHandler created with {} controllers", 5);
        }
        return routerHandler;
    }

    /**
     * Start the job poll loop and the background scheduler.
     * Should be called after server startup.
     */
    public void start() {
        jobScheduler.start();
        scheduler.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop background work first
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }
        try {
            jobScheduler.close();
        } catch (Exception e) {
            log.warn("Error stopping job scheduler: {}", e.getMessage());
        }

        adHocExecutor.shutdown();
        try {
            if (!adHocExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                adHocExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            adHocExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        endpointPool.close();
        workerClient.close();

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }

    private static ThreadFactory adHocThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "forgebench-adhoc-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

package forgebench.orchestrator.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import forgebench.orchestrator.config.OrchestratorConfig;
import forgebench.orchestrator.model.AnalysisStatus;
import forgebench.orchestrator.model.AnalysisTask;
import forgebench.orchestrator.model.ApplicationSlot;
import forgebench.orchestrator.model.PipelineDefinition;
import forgebench.orchestrator.model.PipelineRun;
import forgebench.orchestrator.model.PipelineStatus;
import forgebench.orchestrator.model.StageProgress;
import forgebench.orchestrator.repository.PipelineRepository;
import forgebench.orchestrator.service.ApplicationGenerator;
import forgebench.orchestrator.service.ReservationStore;
import forgebench.orchestrator.service.TaskOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans pipeline runs out into generation and analysis jobs.
 *
 * <p>
 * Each run keeps its pending queues, its in-flight set and its counters in
 * memory. The poll loop ({@link #tick()}) submits pending jobs while the run
 * has capacity; counters move only in the completion callback of each job's
 * future, so every job is counted exactly once. A successful generation job
 * enqueues the analysis job for the same (model, template).
 *
 * <p>
 * Two executors bound the total number of threads; the per-run limits come
 * from the pipeline's stage options.
 */
public class JobScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PipelineRepository pipelineRepository;
    private final ReservationStore reservations;
    private final ApplicationGenerator generator;
    private final TaskOrchestrator orchestrator;
    private final OrchestratorConfig config;
    private final Clock clock;

    private final ExecutorService generationExecutor;
    private final ExecutorService analysisExecutor;
    private final ScheduledExecutorService poller;
    private final Map<String, RunState> runs = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    public JobScheduler(PipelineRepository pipelineRepository, ReservationStore reservations,
            ApplicationGenerator generator, TaskOrchestrator orchestrator, OrchestratorConfig config) {
        this(pipelineRepository, reservations, generator, orchestrator, config, Clock.systemUTC());
    }

    public JobScheduler(PipelineRepository pipelineRepository, ReservationStore reservations,
            ApplicationGenerator generator, TaskOrchestrator orchestrator, OrchestratorConfig config, Clock clock) {
        this.pipelineRepository = pipelineRepository;
        this.reservations = reservations;
        this.generator = generator;
        this.orchestrator = orchestrator;
        this.config = config;
        this.clock = clock;
        this.generationExecutor = Executors.newFixedThreadPool(config.generationPoolSize(),
                namedThreads("forgebench-generation"));
        this.analysisExecutor = Executors.newFixedThreadPool(config.analysisPoolSize(),
                namedThreads("forgebench-analysis"));
        this.poller = Executors.newSingleThreadScheduledExecutor(namedThreads("forgebench-job-poller"));
    }

    /**
     * Start the poll loop.
     */
    public void start() {
        if (running) {
            log.warn("Job scheduler already running");
            return;
        }
        running = true;

        long intervalMs = config.pollInterval().toMillis();
        poller.scheduleWithFixedDelay(() -> {
            try {
                tick();
            } catch (Exception e) {
                log.error("Job poll loop error", e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Job scheduler started (poll every {}ms)", intervalMs);
    }

    /**
     * Persist a new run as pending, then start it.
     *
     * @throws IllegalArgumentException if the definition is invalid
     */
    public PipelineRun submit(PipelineDefinition definition) {
        definition.validate();

        String runId = "pipeline-" + UUID.randomUUID();
        Set<JobKey> keys = new LinkedHashSet<>();
        for (String model : definition.generation().models()) {
            for (String template : definition.generation().templates()) {
                keys.add(JobKey.generation(runId, model.trim(), template.trim()));
            }
        }
        int jobs = definition.generationJobCount();
        PipelineRun run = PipelineRun.builder()
                .id(runId)
                .config(toJson(definition))
                .status(PipelineStatus.PENDING)
                .generation(StageProgress.ofTotal(jobs))
                .analysis(StageProgress.ofTotal(definition.analysisEnabled() ? jobs : 0))
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        pipelineRepository.save(run);

        RunState state = new RunState(run, definition,
                definition.generationConcurrency(config.generationMaxConcurrent()),
                definition.analysisConcurrency(config.analysisMaxConcurrent()));
        for (JobKey key : keys) {
            state.enqueue(new Job(key, null));
        }

        synchronized (state) {
            state.run = state.run.toBuilder()
                    .status(PipelineStatus.RUNNING)
                    .startedAt(clock.instant())
                    .build();
            persist(state);
        }
        runs.put(runId, state);

        log.info("Pipeline {} started: {} generation jobs (limit {}), analysis {} (limit {})", runId, jobs,
                state.generationLimit, definition.analysisEnabled() ? "enabled" : "disabled",
                state.analysisLimit);

        pump(state);
        return find(runId).orElseThrow();
    }

    /**
     * Poll-loop body: submit pending jobs of every active run.
     */
    public void tick() {
        for (RunState state : runs.values()) {
            pump(state);
        }
    }

    /**
     * Cancel a run. Pending jobs are dropped; in-flight jobs finish but their
     * results no longer advance the completed or failed counters.
     *
     * @return the run after cancellation, or empty if it does not exist
     */
    public Optional<PipelineRun> cancel(String runId) {
        RunState state = runs.get(runId);
        if (state == null) {
            // not tracked by this process: cancel the persisted row if still active
            Optional<PipelineRun> stored = pipelineRepository.findById(runId);
            stored.filter(r -> !r.isTerminal())
                    .ifPresent(r -> pipelineRepository.markCancelled(runId, r.status(), "Cancelled by caller",
                            clock.instant()));
            return pipelineRepository.findById(runId);
        }

        synchronized (state) {
            if (state.run.isTerminal()) {
                return Optional.of(state.run);
            }
            state.cancelled = true;
            state.pendingGeneration.clear();
            state.pendingAnalysis.clear();
            state.run = state.run.toBuilder()
                    .status(PipelineStatus.CANCELLED)
                    .errorMessage("Cancelled by caller")
                    .finishedAt(clock.instant())
                    .build();
            persist(state);
            log.info("Pipeline {} cancelled with {} jobs in flight", runId, state.inFlight.size());
            releaseIfDrained(state);
            return Optional.of(state.run);
        }
    }

    /**
     * Current state of a run: the live view if this process runs it,
     * otherwise the persisted row.
     */
    public Optional<PipelineRun> find(String runId) {
        RunState state = runs.get(runId);
        if (state != null) {
            synchronized (state) {
                return Optional.of(state.run);
            }
        }
        return pipelineRepository.findById(runId);
    }

    /**
     * Wait until a run tracked by this process reaches a terminal state and
     * its in-flight jobs have drained.
     *
     * @return true if the run finished within the timeout (or is not tracked)
     */
    public boolean awaitCompletion(String runId, Duration timeout) throws InterruptedException {
        RunState state = runs.get(runId);
        if (state == null) {
            return true;
        }
        return state.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Whether this process is driving the run.
     */
    public boolean isTracking(String runId) {
        return runs.containsKey(runId);
    }

    public int activeRuns() {
        return runs.size();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stop polling and wait briefly for in-flight jobs.
     */
    public void stop() {
        running = false;
        poller.shutdown();
        generationExecutor.shutdown();
        analysisExecutor.shutdown();
        try {
            if (!generationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                generationExecutor.shutdownNow();
            }
            if (!analysisExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                analysisExecutor.shutdownNow();
                log.warn("Job scheduler forcefully stopped");
            }
        } catch (InterruptedException e) {
            generationExecutor.shutdownNow();
            analysisExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Job scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    // ========== Submission ==========

    private void pump(RunState state) {
        synchronized (state) {
            if (state.cancelled || state.run.isTerminal()) {
                return;
            }
            boolean changed = false;

            while (state.inFlightCount(JobKey.Stage.GENERATION) < state.generationLimit
                    && !state.pendingGeneration.isEmpty()) {
                Job job = state.pendingGeneration.poll();
                changed |= submitJob(state, job);
            }
            while (state.inFlightCount(JobKey.Stage.ANALYSIS) < state.analysisLimit
                    && !state.pendingAnalysis.isEmpty()) {
                Job job = state.pendingAnalysis.poll();
                changed |= submitJob(state, job);
            }

            if (!finishIfDrained(state) && changed) {
                persist(state);
            }
        }
    }

    /**
     * Submit one job unless its key is already in flight or done. Caller holds
     * the state's monitor.
     */
    private boolean submitJob(RunState state, Job job) {
        if (state.inFlight.contains(job.key()) || !state.submitted.add(job.key())) {
            log.debug("Skipping duplicate submission of {}", job.key());
            return false;
        }
        state.inFlight.add(job.key());
        boolean generation = job.key().stage() == JobKey.Stage.GENERATION;
        if (generation) {
            state.run = state.run.toBuilder().generation(state.run.generation().started()).build();
        } else {
            state.run = state.run.toBuilder().analysis(state.run.analysis().started()).build();
        }

        try {
            if (generation) {
                CompletableFuture.supplyAsync(() -> runGeneration(job), generationExecutor)
                        .whenComplete((slot, error) -> onGenerationDone(state, job, slot, error));
            } else {
                String runId = state.run.id();
                PipelineDefinition definition = state.definition;
                CompletableFuture.supplyAsync(() -> runAnalysis(runId, definition, job), analysisExecutor)
                        .whenComplete((task, error) -> onAnalysisDone(state, job, task, error));
            }
        } catch (RejectedExecutionException e) {
            log.warn("Job {} rejected: scheduler is shutting down", job.key());
            state.inFlight.remove(job.key());
            recordFailure(state, job, "Scheduler shut down before the job started");
        }
        log.debug("Submitted {}", job.key());
        return true;
    }

    private ApplicationSlot runGeneration(Job job) {
        ApplicationSlot slot = reservations.allocate(job.key().model(), job.key().template());
        generator.generate(slot);
        return slot;
    }

    private AnalysisTask runAnalysis(String runId, PipelineDefinition definition, Job job) {
        ApplicationSlot slot = job.slot();
        AnalysisTask task = orchestrator.createTask(slot.model(), slot.appNumber(), definition.analysisTools(),
                runId);
        return orchestrator.execute(task.id());
    }

    // ========== Completion callbacks ==========

    private void onGenerationDone(RunState state, Job job, ApplicationSlot slot, Throwable error) {
        try {
            synchronized (state) {
                state.inFlight.remove(job.key());
                if (state.cancelled) {
                    state.run = state.run.toBuilder().generation(state.run.generation().discarded()).build();
                    persist(state);
                    releaseIfDrained(state);
                    return;
                }

                if (error == null) {
                    state.run = state.run.toBuilder().generation(state.run.generation().succeeded()).build();
                    log.info("Generated {} for pipeline {}", slot.label(), state.run.id());
                    if (state.definition.analysisEnabled()) {
                        state.enqueue(new Job(job.key().toAnalysis(), slot));
                    }
                } else {
                    recordFailure(state, job, rootMessage(error));
                }
                persist(state);
            }
            pump(state);
        } catch (RuntimeException e) {
            log.error("Failed to record generation result of {}", job.key(), e);
        }
    }

    private void onAnalysisDone(RunState state, Job job, AnalysisTask task, Throwable error) {
        try {
            synchronized (state) {
                state.inFlight.remove(job.key());
                if (state.cancelled) {
                    state.run = state.run.toBuilder().analysis(state.run.analysis().discarded()).build();
                    persist(state);
                    releaseIfDrained(state);
                    return;
                }

                boolean succeeded = error == null && task != null
                        && (task.status() == AnalysisStatus.COMPLETED
                                || task.status() == AnalysisStatus.PARTIAL_SUCCESS);
                if (succeeded) {
                    state.run = state.run.toBuilder().analysis(state.run.analysis().succeeded()).build();
                    log.info("Analysis {} for pipeline {} finished: {}", task.id(), state.run.id(),
                            task.status().value());
                } else {
                    String reason = error != null ? rootMessage(error)
                            : "Analysis task " + (task != null ? task.id() + " " + task.status().value() : "missing");
                    recordFailure(state, job, reason);
                }
                persist(state);
            }
            pump(state);
        } catch (RuntimeException e) {
            log.error("Failed to record analysis result of {}", job.key(), e);
        }
    }

    /**
     * Count a failed job. A failed generation job also removes its analysis
     * job from the analysis total, since it can never become eligible.
     */
    private void recordFailure(RunState state, Job job, String reason) {
        if (job.key().stage() == JobKey.Stage.GENERATION) {
            StageProgress analysis = state.run.analysis();
            state.run = state.run.toBuilder()
                    .generation(state.run.generation().failedOne())
                    .analysis(state.definition.analysisEnabled()
                            ? analysis.withTotal(Math.max(0, analysis.total() - 1))
                            : analysis)
                    .build();
        } else {
            state.run = state.run.toBuilder().analysis(state.run.analysis().failedOne()).build();
        }
        state.lastError = job.key() + ": " + reason;
        log.warn("Job {} of pipeline {} failed: {}", job.key(), state.run.id(), reason);
    }

    // ========== Run completion ==========

    /**
     * Move a drained run to its final status. Caller holds the monitor.
     *
     * @return true if the run finished
     */
    private boolean finishIfDrained(RunState state) {
        if (state.run.isTerminal()) {
            return true;
        }
        StageProgress generation = state.run.generation();
        StageProgress analysis = state.run.analysis();
        if (!generation.isDrained() || !analysis.isDrained() || !state.inFlight.isEmpty()
                || !state.pendingGeneration.isEmpty() || !state.pendingAnalysis.isEmpty()) {
            return false;
        }

        int failures = generation.failed() + analysis.failed();
        int successes = generation.completed() + analysis.completed();
        PipelineStatus status;
        if (failures == 0) {
            status = PipelineStatus.COMPLETED;
        } else if (successes == 0) {
            status = PipelineStatus.FAILED;
        } else {
            status = PipelineStatus.PARTIAL_SUCCESS;
        }

        state.run = state.run.toBuilder()
                .status(status)
                .errorMessage(failures == 0 ? null : failures + " job(s) failed; last: " + state.lastError)
                .finishedAt(clock.instant())
                .build();
        persist(state);
        releaseIfDrained(state);

        log.info("Pipeline {} finished: {} (generation {}/{}, analysis {}/{})", state.run.id(), status.value(),
                generation.completed(), generation.total(), analysis.completed(), analysis.total());
        return true;
    }

    /**
     * Stop tracking a terminal run once nothing is in flight.
     */
    private void releaseIfDrained(RunState state) {
        if (state.run.isTerminal() && state.inFlight.isEmpty()) {
            runs.remove(state.run.id());
            state.done.countDown();
        }
    }

    private void persist(RunState state) {
        state.run = state.run.toBuilder().updatedAt(clock.instant()).build();
        pipelineRepository.update(state.run);
    }

    // ========== Helpers ==========

    private static String toJson(PipelineDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Pipeline definition is not serializable", e);
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable cur = error;
        while ((cur instanceof CompletionException
                || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur.getMessage() != null ? cur.getMessage() : cur.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** A job and, for analysis jobs, the slot it analyzes. */
    private record Job(JobKey key, ApplicationSlot slot) {
    }

    /**
     * In-memory state of one run. Guarded by its own monitor.
     */
    private static final class RunState {
        final PipelineDefinition definition;
        final int generationLimit;
        final int analysisLimit;
        final Deque<Job> pendingGeneration = new ArrayDeque<>();
        final Deque<Job> pendingAnalysis = new ArrayDeque<>();
        final Set<JobKey> inFlight = new HashSet<>();
        final Set<JobKey> submitted = new HashSet<>();
        final CountDownLatch done = new CountDownLatch(1);

        PipelineRun run;
        boolean cancelled;
        String lastError;

        RunState(PipelineRun run, PipelineDefinition definition, int generationLimit, int analysisLimit) {
            this.run = run;
            this.definition = definition;
            this.generationLimit = generationLimit;
            this.analysisLimit = analysisLimit;
        }

        void enqueue(Job job) {
            if (job.key().stage() == JobKey.Stage.GENERATION) {
                pendingGeneration.add(job);
            } else {
                pendingAnalysis.add(job);
            }
        }

        int inFlightCount(JobKey.Stage stage) {
            int count = 0;
            for (JobKey key : inFlight) {
                if (key.stage() == stage) {
                    count++;
                }
            }
            return count;
        }
    }

    /** Visible for tests: jobs of a run currently in flight. */
    List<JobKey> inFlight(String runId) {
        RunState state = runs.get(runId);
        if (state == null) {
            return List.of();
        }
        synchronized (state) {
            return List.copyOf(state.inFlight);
        }
    }
}

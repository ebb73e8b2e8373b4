package forgebench.orchestrator.scheduler;

import forgebench.orchestrator.config.OrchestratorConfig;
import forgebench.orchestrator.model.AnalysisStatus;
import forgebench.orchestrator.model.AnalysisTask;
import forgebench.orchestrator.model.PipelineRun;
import forgebench.orchestrator.model.PipelineStatus;
import forgebench.orchestrator.repository.AnalysisTaskRepository;
import forgebench.orchestrator.repository.PipelineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Background reconciliation of stuck work.
 *
 * The sweep:
 * 1. Cancels RUNNING tasks started before both the running timeout and the
 * grace period
 * 2. Cancels PENDING tasks created before both the pending timeout and the
 * grace period
 * 3. Cancels pipeline runs left active by a previous process
 *
 * The main task of every reclaimed subtask is rolled up again afterwards.
 *
 * Nothing is deleted. Every transition is conditional on the status that was
 * read, so overlapping sweeps never reclaim the same row twice.
 */
public class MaintenanceSweep implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceSweep.class);
    private static final Consumer<String> NO_ROLLUP = parentId -> {
    };

    private final AnalysisTaskRepository taskRepository;
    private final PipelineRepository pipelineRepository;
    private final Predicate<String> trackedRun;
    private final Consumer<String> parentRollup;
    private final Duration runningTimeout;
    private final Duration pendingTimeout;
    private final Duration gracePeriod;
    private final Clock clock;

    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private volatile SweepResult lastResult;
    private long runs;
    private long totalReclaimedTasks;
    private long totalReclaimedPipelines;

    /**
     * @param trackedRun tells whether a live scheduler in this process is
     *                   driving a pipeline run
     */
    public MaintenanceSweep(AnalysisTaskRepository taskRepository, PipelineRepository pipelineRepository,
            Predicate<String> trackedRun, OrchestratorConfig config) {
        this(taskRepository, pipelineRepository, trackedRun, NO_ROLLUP, config, Clock.systemUTC());
    }

    public MaintenanceSweep(AnalysisTaskRepository taskRepository, PipelineRepository pipelineRepository,
            Predicate<String> trackedRun, OrchestratorConfig config, Clock clock) {
        this(taskRepository, pipelineRepository, trackedRun, NO_ROLLUP, config, clock);
    }

    /**
     * @param parentRollup recomputes a main task after one of its subtasks was
     *                     reclaimed
     */
    public MaintenanceSweep(AnalysisTaskRepository taskRepository, PipelineRepository pipelineRepository,
            Predicate<String> trackedRun, Consumer<String> parentRollup, OrchestratorConfig config, Clock clock) {
        this.taskRepository = taskRepository;
        this.pipelineRepository = pipelineRepository;
        this.trackedRun = trackedRun;
        this.parentRollup = parentRollup;
        this.runningTimeout = config.runningTimeout();
        this.pendingTimeout = config.pendingTimeout();
        this.gracePeriod = config.gracePeriod();
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Maintenance sweep error", e);
        }
    }

    /**
     * Run one sweep. Returns a skipped result if another sweep is in progress.
     */
    public SweepResult sweep() {
        Instant now = clock.instant();
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("Maintenance sweep already in progress, skipping");
            return SweepResult.skipped(now);
        }

        try {
            Instant graceCutoff = now.minus(gracePeriod);
            Set<String> parents = new LinkedHashSet<>();
            int running = reclaimRunning(earliest(now.minus(runningTimeout), graceCutoff), now, parents);
            int pending = reclaimPending(earliest(now.minus(pendingTimeout), graceCutoff), now, parents);
            rollUpParents(parents);
            int pipelines = reclaimOrphanedPipelines(graceCutoff, now);

            SweepResult result = new SweepResult(now, running, pending, pipelines, false);
            synchronized (this) {
                runs++;
                totalReclaimedTasks += result.reclaimedTasks();
                totalReclaimedPipelines += pipelines;
                lastResult = result;
            }

            if (result.reclaimedTasks() > 0 || pipelines > 0) {
                log.info("Maintenance sweep: {} running and {} pending tasks reclaimed, {} orphaned pipelines",
                        running, pending, pipelines);
            } else {
                log.debug("Maintenance sweep: nothing to reclaim");
            }
            return result;
        } finally {
            sweeping.set(false);
        }
    }

    public synchronized MaintenanceStatus status() {
        return new MaintenanceStatus(runs, lastResult != null ? lastResult.startedAt() : null, lastResult,
                totalReclaimedTasks, totalReclaimedPipelines, runningTimeout.toMinutes(),
                pendingTimeout.toMinutes(), gracePeriod.toMinutes());
    }

    private int reclaimRunning(Instant cutoff, Instant now, Set<String> parents) {
        List<AnalysisTask> stuck = taskRepository.findRunningStartedBefore(cutoff);
        int reclaimed = 0;
        for (AnalysisTask task : stuck) {
            try {
                String reason = "Reclaimed by maintenance: running for more than "
                        + runningTimeout.toMinutes() + " minutes";
                if (taskRepository.markCancelled(task.id(), AnalysisStatus.RUNNING, reason, now)) {
                    reclaimed++;
                    addParent(task, parents);
                    log.info("Reclaimed stuck running task {} (started {})", task.id(), task.startedAt());
                }
            } catch (Exception e) {
                log.error("Failed to reclaim task {}", task.id(), e);
            }
        }
        return reclaimed;
    }

    private int reclaimPending(Instant cutoff, Instant now, Set<String> parents) {
        List<AnalysisTask> stale = taskRepository.findPendingCreatedBefore(cutoff);
        int reclaimed = 0;
        for (AnalysisTask task : stale) {
            try {
                String reason = "Reclaimed by maintenance: pending for more than "
                        + pendingTimeout.toMinutes() + " minutes";
                if (taskRepository.markCancelled(task.id(), AnalysisStatus.PENDING, reason, now)) {
                    reclaimed++;
                    addParent(task, parents);
                    log.info("Reclaimed stale pending task {} (created {})", task.id(), task.createdAt());
                }
            } catch (Exception e) {
                log.error("Failed to reclaim task {}", task.id(), e);
            }
        }
        return reclaimed;
    }

    private static void addParent(AnalysisTask task, Set<String> parents) {
        if (task.parentId() != null) {
            parents.add(task.parentId());
        }
    }

    private void rollUpParents(Set<String> parents) {
        for (String parentId : parents) {
            try {
                parentRollup.accept(parentId);
            } catch (Exception e) {
                log.error("Failed to roll up task {} after reclaiming its subtasks", parentId, e);
            }
        }
    }

    private int reclaimOrphanedPipelines(Instant graceCutoff, Instant now) {
        List<PipelineRun> active = pipelineRepository.findByStatuses(
                EnumSet.of(PipelineStatus.PENDING, PipelineStatus.RUNNING));
        int reclaimed = 0;
        for (PipelineRun run : active) {
            if (trackedRun.test(run.id())) {
                continue;
            }
            Instant lastUpdate = run.updatedAt() != null ? run.updatedAt() : run.createdAt();
            if (lastUpdate != null && !lastUpdate.isBefore(graceCutoff)) {
                continue;
            }
            try {
                if (pipelineRepository.markCancelled(run.id(), run.status(),
                        "Reclaimed by maintenance: no live scheduler is driving this run", now)) {
                    reclaimed++;
                    log.info("Reclaimed orphaned pipeline run {} (last update {})", run.id(), lastUpdate);
                }
            } catch (Exception e) {
                log.error("Failed to reclaim pipeline run {}", run.id(), e);
            }
        }
        return reclaimed;
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}

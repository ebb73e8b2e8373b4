package forgebench.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import forgebench.orchestrator.config.OrchestratorConfig;
import forgebench.orchestrator.model.AnalysisStatus;
import forgebench.orchestrator.model.AnalysisTask;
import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.model.ToolCatalog;
import forgebench.orchestrator.pool.Endpoint;
import forgebench.orchestrator.pool.EndpointPool;
import forgebench.orchestrator.repository.AnalysisTaskRepository;
import forgebench.orchestrator.repository.DistributedLock;
import forgebench.orchestrator.worker.WorkerClient;
import forgebench.orchestrator.worker.WorkerDispatchException;
import forgebench.orchestrator.worker.WorkerRequest;
import forgebench.orchestrator.worker.WorkerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Turns one "analyze application X" request into a main task with one
 * subtask per analyzer service, dispatches the subtasks through the endpoint
 * pool and rolls their outcomes up into the main task.
 */
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String TASKS_LOCK = "analysis-tasks";

    private final AnalysisTaskRepository taskRepository;
    private final EndpointPool pool;
    private final WorkerClient workerClient;
    private final ResultAggregator aggregator;
    private final DistributedLock lock;
    private final Duration dispatchTimeout;
    private final int defaultMaxRetries;
    private final Clock clock;

    public TaskOrchestrator(AnalysisTaskRepository taskRepository, EndpointPool pool, WorkerClient workerClient,
            ResultAggregator aggregator, DistributedLock lock, OrchestratorConfig config) {
        this(taskRepository, pool, workerClient, aggregator, lock, config, Clock.systemUTC());
    }

    public TaskOrchestrator(AnalysisTaskRepository taskRepository, EndpointPool pool, WorkerClient workerClient,
            ResultAggregator aggregator, DistributedLock lock, OrchestratorConfig config, Clock clock) {
        this.taskRepository = taskRepository;
        this.pool = pool;
        this.workerClient = workerClient;
        this.aggregator = aggregator;
        this.lock = lock;
        this.dispatchTimeout = config.dispatchTimeout();
        this.defaultMaxRetries = config.defaultMaxRetries();
        this.clock = clock;
    }

    /**
     * Create a main task (and its subtasks) for a standalone request.
     */
    public AnalysisTask createTask(String targetModel, int targetAppNumber, List<String> tools) {
        return createTask(targetModel, targetAppNumber, tools, null);
    }

    /**
     * Create a main task and one subtask per service touched by the tool
     * selection. A selection owned by a single service yields a main task with
     * no subtasks that is dispatched directly.
     *
     * @param pipelineId owning pipeline run, or null
     * @throws IllegalArgumentException on an empty selection or unknown tool
     */
    public AnalysisTask createTask(String targetModel, int targetAppNumber, List<String> tools, String pipelineId) {
        if (targetModel == null || targetModel.isBlank()) {
            throw new IllegalArgumentException("targetModel is required");
        }
        if (targetAppNumber < 1) {
            throw new IllegalArgumentException("targetAppNumber must be >= 1");
        }
        if (tools == null || tools.isEmpty()) {
            throw new IllegalArgumentException("At least one analysis tool is required");
        }

        Map<ServiceType, List<String>> partitions = ToolCatalog.partition(tools);
        Instant now = clock.instant();
        String mainId = newId();

        List<String> allTools = new ArrayList<>();
        partitions.values().forEach(allTools::addAll);

        AnalysisTask.Builder main = AnalysisTask.builder()
                .id(mainId)
                .pipelineId(pipelineId)
                .status(AnalysisStatus.PENDING)
                .targetModel(targetModel)
                .targetAppNumber(targetAppNumber)
                .tools(allTools)
                .maxRetries(defaultMaxRetries)
                .metadata(metadata(partitions))
                .createdAt(now);

        List<AnalysisTask> rows = new ArrayList<>();
        if (partitions.size() == 1) {
            main.service(partitions.keySet().iterator().next());
            rows.add(main.build());
        } else {
            rows.add(main.build());
            for (Map.Entry<ServiceType, List<String>> partition : partitions.entrySet()) {
                rows.add(AnalysisTask.builder()
                        .id(newId())
                        .parentId(mainId)
                        .pipelineId(pipelineId)
                        .status(AnalysisStatus.PENDING)
                        .service(partition.getKey())
                        .targetModel(targetModel)
                        .targetAppNumber(targetAppNumber)
                        .tools(partition.getValue())
                        .maxRetries(defaultMaxRetries)
                        .createdAt(now)
                        .build());
            }
        }

        lock.withLock(TASKS_LOCK, () -> {
            taskRepository.saveAll(rows);
            return null;
        });

        log.info("Created analysis task {} for {}/app{} with {} subtasks", mainId, targetModel,
                targetAppNumber, rows.size() - 1);
        return rows.get(0);
    }

    /**
     * Run a task to a terminal state on the calling thread. Subtasks are
     * dispatched in creation order. A task that is already terminal is
     * returned as is.
     */
    public AnalysisTask execute(String mainTaskId) {
        AnalysisTask main = requireMainTask(mainTaskId);
        if (main.isTerminal()) {
            return main;
        }
        return run(main);
    }

    /**
     * Re-dispatch failed subtasks that still have retry budget. Subtasks out
     * of budget keep their failed status.
     */
    public AnalysisTask retry(String mainTaskId) {
        AnalysisTask main = requireMainTask(mainTaskId);
        if (main.status() != AnalysisStatus.FAILED && main.status() != AnalysisStatus.PARTIAL_SUCCESS) {
            throw new IllegalArgumentException("Only failed or partially successful tasks can be retried, task "
                    + mainTaskId + " is " + main.status().value());
        }

        List<AnalysisTask> subtasks = taskRepository.findSubtasks(mainTaskId);
        if (subtasks.isEmpty()) {
            if (!main.canRetry()) {
                log.info("Task {} has no retry budget left ({}/{})", mainTaskId, main.retryCount(),
                        main.maxRetries());
                return main;
            }
            taskRepository.resetForRetry(mainTaskId);
            log.info("Retrying task {} (attempt {})", mainTaskId, main.retryCount() + 1);
            return run(requireMainTask(mainTaskId));
        }

        int reset = 0;
        for (AnalysisTask subtask : subtasks) {
            if (subtask.status() == AnalysisStatus.FAILED && subtask.canRetry()
                    && taskRepository.resetForRetry(subtask.id())) {
                reset++;
            }
        }
        if (reset == 0) {
            log.info("Task {} has no retryable subtasks", mainTaskId);
            return main;
        }

        if (!taskRepository.markRunningForRetry(mainTaskId, main.status(), clock.instant())) {
            log.info("Task {} changed state before its retry started", mainTaskId);
            return requireMainTask(mainTaskId);
        }
        log.info("Retrying {} subtasks of task {}", reset, mainTaskId);
        return run(requireMainTask(mainTaskId));
    }

    /**
     * Cancel a task and every subtask that has not finished.
     */
    public AnalysisTask cancel(String mainTaskId) {
        AnalysisTask main = requireMainTask(mainTaskId);
        if (main.isTerminal()) {
            return main;
        }

        lock.withLock(taskLockName(mainTaskId), () -> {
            Instant now = clock.instant();
            for (AnalysisTask subtask : taskRepository.findSubtasks(mainTaskId)) {
                if (!subtask.isTerminal()) {
                    taskRepository.markCancelled(subtask.id(), subtask.status(), "Cancelled by caller", now);
                }
            }
            AnalysisTask current = requireMainTask(mainTaskId);
            if (!current.isTerminal()
                    && taskRepository.markCancelled(mainTaskId, current.status(), "Cancelled by caller", now)) {
                log.info("Cancelled analysis task {}", mainTaskId);
            }
            return null;
        });
        return requireMainTask(mainTaskId);
    }

    public Optional<AnalysisTask> findById(String taskId) {
        return taskRepository.findById(taskId);
    }

    public List<AnalysisTask> subtasks(String mainTaskId) {
        return taskRepository.findSubtasks(mainTaskId);
    }

    // ========== Execution ==========

    private AnalysisTask run(AnalysisTask main) {
        List<AnalysisTask> subtasks = taskRepository.findSubtasks(main.id());
        if (subtasks.isEmpty()) {
            return runDirect(main);
        }

        taskRepository.updateRollup(main.id(), AnalysisStatus.RUNNING, main.progress(), main.resultSummary(),
                null, clock.instant(), null);

        for (AnalysisTask subtask : subtasks) {
            if (subtask.status() != AnalysisStatus.PENDING) {
                continue;
            }
            if (isCancelled(main.id())) {
                log.info("Task {} cancelled, not dispatching remaining subtasks", main.id());
                break;
            }
            dispatch(subtask);
            rollup(main.id());
        }

        rollup(main.id());
        return requireMainTask(main.id());
    }

    /**
     * A main task without subtasks completes or fails on its own dispatch.
     */
    private AnalysisTask runDirect(AnalysisTask main) {
        if (main.service() == null) {
            throw new IllegalStateException("Task " + main.id() + " has neither subtasks nor a service");
        }

        Optional<SubtaskSnapshot> snapshot = dispatch(main);
        AnalysisTask after = requireMainTask(main.id());
        if (after.status() == AnalysisStatus.CANCELLED) {
            return after;
        }

        AggregatedResult result = aggregator.aggregate(List.of(main.service().wireName()),
                snapshot.map(List::of).orElse(List.of()));
        Instant now = clock.instant();
        AnalysisStatus status = snapshot.isPresent() ? AnalysisStatus.COMPLETED : AnalysisStatus.FAILED;
        if (taskRepository.updateRollup(main.id(), status, 100, aggregator.toJson(result), after.errorMessage(),
                now, now)) {
            log.info("Task {} finished: {}", main.id(), status.value());
        }
        return requireMainTask(main.id());
    }

    /**
     * Dispatch one unit of work to an endpoint of its service.
     *
     * @return the result snapshot if the worker produced results
     */
    private Optional<SubtaskSnapshot> dispatch(AnalysisTask task) {
        ServiceType service = task.service();
        Optional<Endpoint> selected = pool.select(service);
        if (selected.isEmpty()) {
            taskRepository.markFailed(task.id(),
                    "No healthy " + service.wireName() + " endpoint available (capacity exhausted)", clock.instant());
            return Optional.empty();
        }

        Endpoint endpoint = selected.get();
        if (!taskRepository.markRunning(task.id(), clock.instant())) {
            log.debug("Task {} is no longer pending, skipping dispatch", task.id());
            return Optional.empty();
        }

        WorkerRequest request = WorkerRequest.of(task.targetModel(), task.targetAppNumber(), task.tools());
        pool.lease(endpoint);
        long startNanos = System.nanoTime();
        try {
            WorkerResponse response = workerClient.dispatch(endpoint, request, dispatchTimeout);
            pool.release(endpoint, elapsedMs(startNanos), response.isSuccessful());
            pool.reportSuccess(endpoint);

            if (response.isSuccessful()) {
                SubtaskSnapshot snapshot = SubtaskSnapshot.from(service, task.tools(), response);
                if (!taskRepository.markCompleted(task.id(), toJson(snapshot), clock.instant())) {
                    log.debug("Task {} left RUNNING during dispatch, dropping its result", task.id());
                    return Optional.empty();
                }
                log.debug("Task {} completed on {} with {} findings", task.id(), endpoint.url(),
                        snapshot.findings().size());
                return Optional.of(snapshot);
            }

            taskRepository.markFailed(task.id(), response.failureMessage(), clock.instant());
            log.info("Task {} failed on {}: {}", task.id(), endpoint.url(), response.failureMessage());
            return Optional.empty();

        } catch (WorkerDispatchException e) {
            pool.release(endpoint, elapsedMs(startNanos), false);
            pool.reportFailure(endpoint, e.getMessage());
            String message = e.isTimeout()
                    ? service.wireName() + " timed out after " + dispatchTimeout.toSeconds() + "s"
                    : service.wireName() + " unreachable: " + e.getMessage();
            taskRepository.markFailed(task.id(), message, clock.instant());
            log.warn("Task {} dispatch failed: {}", task.id(), message);
            return Optional.empty();

        } catch (RuntimeException e) {
            pool.release(endpoint, elapsedMs(startNanos), false);
            taskRepository.markFailed(task.id(), "Unexpected dispatch error: " + e.getMessage(), clock.instant());
            log.error("Unexpected error dispatching task {}: {}", task.id(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Recompute a main task's status and progress from its subtasks. A
     * cancelled main task keeps its status.
     */
    public void rollup(String mainTaskId) {
        lock.withLock(taskLockName(mainTaskId), () -> {
            AnalysisTask main = requireMainTask(mainTaskId);
            if (main.status() == AnalysisStatus.CANCELLED) {
                return null;
            }

            List<AnalysisTask> subtasks = taskRepository.findSubtasks(mainTaskId);
            int total = subtasks.size();
            int terminal = (int) subtasks.stream().filter(AnalysisTask::isTerminal).count();
            int progress = total == 0 ? 0 : terminal * 100 / total;
            Instant now = clock.instant();

            if (terminal < total) {
                taskRepository.updateRollup(mainTaskId, AnalysisStatus.RUNNING, progress, main.resultSummary(),
                        null, now, null);
                return null;
            }

            List<String> services = new ArrayList<>();
            List<SubtaskSnapshot> snapshots = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            int cancelled = 0;
            for (AnalysisTask subtask : subtasks) {
                services.add(subtask.service().wireName());
                if (subtask.status() == AnalysisStatus.COMPLETED) {
                    parseSnapshot(subtask).ifPresent(snapshots::add);
                } else {
                    if (subtask.status() == AnalysisStatus.CANCELLED) {
                        cancelled++;
                    }
                    errors.add(subtask.service().wireName() + ": "
                            + (subtask.errorMessage() != null ? subtask.errorMessage() : subtask.status().value()));
                }
            }

            AggregatedResult result = aggregator.aggregate(services, snapshots);
            AnalysisStatus status = cancelled == total
                    ? AnalysisStatus.CANCELLED
                    : ResultAggregator.rollupStatus(snapshots.size(), total - snapshots.size());
            String error = errors.isEmpty() ? null : String.join("; ", errors);

            boolean written = taskRepository.updateRollup(mainTaskId, status, 100, aggregator.toJson(result),
                    error, now, now);
            if (!written) {
                log.debug("Task {} was cancelled during rollup", mainTaskId);
            } else if (main.status() != status) {
                log.info("Task {} rolled up to {} ({}/{} services succeeded)", mainTaskId, status.value(),
                        snapshots.size(), total);
            }
            return null;
        });
    }

    // ========== Helpers ==========

    private AnalysisTask requireMainTask(String taskId) {
        AnalysisTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Analysis task not found: " + taskId));
        if (!task.isMainTask()) {
            throw new IllegalArgumentException("Task " + taskId + " is a subtask of " + task.parentId());
        }
        return task;
    }

    private static String taskLockName(String mainTaskId) {
        return "analysis-task:" + mainTaskId;
    }

    private boolean isCancelled(String mainTaskId) {
        return taskRepository.findById(mainTaskId)
                .map(t -> t.status() == AnalysisStatus.CANCELLED)
                .orElse(true);
    }

    private Optional<SubtaskSnapshot> parseSnapshot(AnalysisTask subtask) {
        if (subtask.resultSummary() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(subtask.resultSummary(), SubtaskSnapshot.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable result of subtask {}: {}", subtask.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String toJson(SubtaskSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize subtask result", e);
        }
    }

    private static String metadata(Map<ServiceType, List<String>> partitions) {
        ObjectNode node = MAPPER.createObjectNode();
        Set<String> services = new LinkedHashSet<>();
        partitions.keySet().forEach(s -> services.add(s.wireName()));
        node.putPOJO("services", services);
        node.put("subtaskCount", partitions.size() > 1 ? partitions.size() : 0);
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task metadata", e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String newId() {
        return "task-" + UUID.randomUUID();
    }
}

package forgebench.orchestrator.repository;

import forgebench.orchestrator.model.AnalysisStatus;
import forgebench.orchestrator.model.AnalysisTask;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for analysis tasks (main tasks and their subtasks).
 * State transitions are conditional updates: each returns whether the row
 * was actually in the expected state.
 */
public interface AnalysisTaskRepository {

    /**
     * Save a main task and its subtasks in one transaction.
     *
     * @param tasks main task first, then subtasks
     */
    void saveAll(List<AnalysisTask> tasks);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<AnalysisTask> findById(String taskId);

    /**
     * Find the subtasks of a main task, in creation order.
     *
     * @param parentId the main task ID
     * @return list of subtasks (empty for a single-service task)
     */
    List<AnalysisTask> findSubtasks(String parentId);

    /**
     * Find tasks by status.
     *
     * @param status the status to filter by
     * @param limit  maximum number of results
     * @return list of tasks
     */
    List<AnalysisTask> findByStatus(AnalysisStatus status, int limit);

    /**
     * Find RUNNING tasks started before the cutoff.
     */
    List<AnalysisTask> findRunningStartedBefore(Instant cutoff);

    /**
     * Find PENDING tasks created before the cutoff.
     */
    List<AnalysisTask> findPendingCreatedBefore(Instant cutoff);

    /**
     * Move a PENDING task to RUNNING.
     *
     * @return true if the task was PENDING
     */
    boolean markRunning(String taskId, Instant startedAt);

    /**
     * Move a RUNNING task to COMPLETED with its result document.
     *
     * @return true if the task was RUNNING
     */
    boolean markCompleted(String taskId, String resultSummary, Instant completedAt);

    /**
     * Move a PENDING or RUNNING task to FAILED. Every failure consumes one
     * unit of the task's retry budget.
     *
     * @return true if the task was PENDING or RUNNING
     */
    boolean markFailed(String taskId, String errorMessage, Instant completedAt);

    /**
     * Move a task to CANCELLED only if it is still in the expected status.
     *
     * @return true if this call performed the transition
     */
    boolean markCancelled(String taskId, AnalysisStatus expected, String reason, Instant completedAt);

    /**
     * Return a FAILED task to PENDING for another dispatch attempt.
     *
     * @return true if the task was FAILED
     */
    boolean resetForRetry(String taskId);

    /**
     * Put a finished main task back to RUNNING for a retry. The start time is
     * reset to the retry time and the completion time cleared.
     *
     * @return true if the task was still in the expected status
     */
    boolean markRunningForRetry(String taskId, AnalysisStatus expected, Instant startedAt);

    /**
     * Write the rolled-up state of a main task. A cancelled task is left
     * untouched.
     *
     * @return false if the task was cancelled
     */
    boolean updateRollup(String taskId, AnalysisStatus status, int progress, String resultSummary,
            String errorMessage, Instant startedAt, Instant completedAt);

    /**
     * Count tasks by status.
     */
    int countByStatus(AnalysisStatus status);
}

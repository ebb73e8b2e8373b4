package forgebench.orchestrator.repository;

import forgebench.orchestrator.model.PipelineRun;
import forgebench.orchestrator.model.PipelineStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for pipeline runs.
 */
public interface PipelineRepository {

    /**
     * Save a new run.
     */
    void save(PipelineRun run);

    /**
     * Overwrite status, counters, error and timestamps of an existing run.
     */
    void update(PipelineRun run);

    Optional<PipelineRun> findById(String runId);

    /**
     * Find runs in any of the given statuses, oldest first.
     */
    List<PipelineRun> findByStatuses(Set<PipelineStatus> statuses);

    /**
     * Most recently created runs.
     */
    List<PipelineRun> findRecent(int limit);

    /**
     * Cancel a run only if it is still in the expected status.
     *
     * @return true if this call performed the transition
     */
    boolean markCancelled(String runId, PipelineStatus expected, String reason, Instant now);

    int countByStatus(PipelineStatus status);
}

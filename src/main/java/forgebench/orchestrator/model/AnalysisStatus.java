package forgebench.orchestrator.model;

/**
 * Status of an analysis task (main task or subtask).
 */
public enum AnalysisStatus {
    /** Created, waiting for dispatch */
    PENDING,
    /** Dispatched to an analyzer (or, for a main task, subtasks in progress) */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Some subtasks completed, some failed */
    PARTIAL_SUCCESS,
    /** Finished without any successful result */
    FAILED,
    /** Cancelled by a caller or reclaimed by maintenance */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL_SUCCESS || this == FAILED || this == CANCELLED;
    }

    /** Wire/persistence value, e.g. "partial_success". */
    public String value() {
        return name().toLowerCase();
    }
}

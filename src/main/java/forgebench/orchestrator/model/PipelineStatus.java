package forgebench.orchestrator.model;

/**
 * Overall state of a pipeline run.
 */
public enum PipelineStatus {
    /** Persisted, not yet started */
    PENDING,
    /** Jobs are being submitted or are in flight */
    RUNNING,
    /** Every job across enabled stages succeeded */
    COMPLETED,
    /** Work drained, some jobs failed, at least one succeeded */
    PARTIAL_SUCCESS,
    /** No job could complete */
    FAILED,
    /** Cancelled by a caller or reclaimed by maintenance */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public String value() {
        return name().toLowerCase();
    }
}

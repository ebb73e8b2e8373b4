package forgebench.orchestrator.model;

/**
 * Counters for one pipeline stage.
 */
public record StageProgress(int total, int completed, int failed, int inFlight) {

    public static StageProgress empty() {
        return new StageProgress(0, 0, 0, 0);
    }

    public static StageProgress ofTotal(int total) {
        return new StageProgress(total, 0, 0, 0);
    }

    /** Jobs neither finished nor in flight. */
    public int pending() {
        return Math.max(0, total - completed - failed - inFlight);
    }

    public boolean isDrained() {
        return inFlight == 0 && pending() == 0;
    }

    public StageProgress withTotal(int newTotal) {
        return new StageProgress(newTotal, completed, failed, inFlight);
    }

    public StageProgress started() {
        return new StageProgress(total, completed, failed, inFlight + 1);
    }

    public StageProgress succeeded() {
        return new StageProgress(total, completed + 1, failed, Math.max(0, inFlight - 1));
    }

    public StageProgress failedOne() {
        return new StageProgress(total, completed, failed + 1, Math.max(0, inFlight - 1));
    }

    /** In-flight job finished after cancellation: only the in-flight counter moves. */
    public StageProgress discarded() {
        return new StageProgress(total, completed, failed, Math.max(0, inFlight - 1));
    }
}

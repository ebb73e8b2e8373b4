package forgebench.orchestrator.worker;

/**
 * Transport-level dispatch failure: the worker could not be reached, the
 * connection broke, or no reply arrived before the timeout.
 */
public class WorkerDispatchException extends RuntimeException {

    private final boolean timeout;

    public WorkerDispatchException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public WorkerDispatchException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
    }

    public boolean isTimeout() {
        return timeout;
    }
}

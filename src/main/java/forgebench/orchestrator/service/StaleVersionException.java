package forgebench.orchestrator.service;

/**
 * Thrown when a new version is requested from a slot that is no longer the
 * latest version of its lineage.
 */
public class StaleVersionException extends RuntimeException {

    public StaleVersionException(String message) {
        super(message);
    }
}

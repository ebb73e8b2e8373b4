package forgebench.orchestrator.pool;

import java.time.Duration;

/**
 * Active liveness check of a single endpoint.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Probe the endpoint, giving up after the timeout.
     *
     * @return true if the endpoint answered healthy in time
     */
    boolean probe(Endpoint endpoint, Duration timeout);
}

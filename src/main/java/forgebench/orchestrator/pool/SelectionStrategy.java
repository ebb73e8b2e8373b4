package forgebench.orchestrator.pool;

import java.util.Locale;

/**
 * How the pool picks one endpoint among the eligible candidates.
 */
public enum SelectionStrategy {
    ROUND_ROBIN,
    LEAST_IN_FLIGHT,
    RANDOM;

    /** Parse "round_robin", "least-in-flight", "RANDOM", ... */
    public static SelectionStrategy parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("LEAST_LOADED".equals(normalized)) {
            return LEAST_IN_FLIGHT;
        }
        return SelectionStrategy.valueOf(normalized);
    }
}

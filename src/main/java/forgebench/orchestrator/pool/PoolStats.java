package forgebench.orchestrator.pool;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Pool statistics grouped by service wire name.
 */
public record PoolStats(
        @JsonProperty("strategy") String strategy,
        @JsonProperty("services") Map<String, ServiceStats> services) {

    public record ServiceStats(
            @JsonProperty("total") int total,
            @JsonProperty("healthy") int healthy,
            @JsonProperty("inFlight") int inFlight,
            @JsonProperty("endpoints") List<EndpointSnapshot> endpoints) {
    }

    public int totalEndpoints() {
        return services.values().stream().mapToInt(ServiceStats::total).sum();
    }

    public int healthyEndpoints() {
        return services.values().stream().mapToInt(ServiceStats::healthy).sum();
    }
}

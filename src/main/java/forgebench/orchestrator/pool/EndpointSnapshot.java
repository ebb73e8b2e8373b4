package forgebench.orchestrator.pool;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time view of an endpoint for the admin API.
 */
public record EndpointSnapshot(
        @JsonProperty("service") String service,
        @JsonProperty("url") String url,
        @JsonProperty("healthy") boolean healthy,
        @JsonProperty("lastHealthCheck") Instant lastHealthCheck,
        @JsonProperty("inFlight") int inFlight,
        @JsonProperty("totalRequests") long totalRequests,
        @JsonProperty("totalFailures") long totalFailures,
        @JsonProperty("avgLatencyMs") double avgLatencyMs) {
}

package forgebench.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Consolidated analysis document for a main task.
 */
public record AggregatedResult(
        @JsonProperty("status") String status,
        @JsonProperty("servicesExecuted") List<String> servicesExecuted,
        @JsonProperty("servicesFailed") List<String> servicesFailed,
        @JsonProperty("totalFindings") int totalFindings,
        @JsonProperty("findings") List<JsonNode> findings,
        @JsonProperty("severityBreakdown") Map<String, Integer> severityBreakdown,
        @JsonProperty("toolsExecuted") int toolsExecuted,
        @JsonProperty("toolStatus") Map<String, String> toolStatus) {
}

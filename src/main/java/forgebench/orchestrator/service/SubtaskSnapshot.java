package forgebench.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.worker.WorkerResponse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one service's subtask, as stored in the subtask's result summary.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubtaskSnapshot(
        @JsonProperty("serviceName") String serviceName,
        @JsonProperty("status") String status,
        @JsonProperty("findings") List<JsonNode> findings,
        @JsonProperty("toolsUsed") List<String> toolsUsed,
        @JsonProperty("severityBreakdown") Map<String, Integer> severityBreakdown,
        @JsonProperty("toolStatus") Map<String, String> toolStatus) {

    public SubtaskSnapshot {
        findings = findings != null ? List.copyOf(findings) : List.of();
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
        severityBreakdown = severityBreakdown != null ? Map.copyOf(severityBreakdown) : Map.of();
        toolStatus = toolStatus != null ? Map.copyOf(toolStatus) : Map.of();
    }

    /**
     * Build a snapshot from a worker reply. Tools the worker did not report
     * on are recorded with the reply's overall status.
     */
    public static SubtaskSnapshot from(ServiceType service, List<String> requestedTools, WorkerResponse response) {
        WorkerResponse.Analysis analysis = response.analysisOrEmpty();
        Map<String, String> toolStatus = new LinkedHashMap<>(analysis.toolStatus());
        List<String> used = analysis.toolsUsed().isEmpty() ? requestedTools : analysis.toolsUsed();
        for (String tool : used) {
            toolStatus.putIfAbsent(tool, response.status());
        }
        return new SubtaskSnapshot(service.wireName(), response.status(), analysis.findings(), used,
                analysis.severityBreakdown(), toolStatus);
    }
}

package forgebench.orchestrator.worker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Worker reply: {@code {status, analysis: {findings, toolsUsed, severityBreakdown}, error}}.
 * Finding contents are opaque.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerResponse(
        @JsonProperty("type") String type,
        @JsonProperty("status") String status,
        @JsonProperty("analysis") Analysis analysis,
        @JsonProperty("error") String error) {

    public static final String SUCCESS = "success";
    public static final String PARTIAL = "partial";
    public static final String ERROR = "error";
    public static final String TIMEOUT = "timeout";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Analysis(
            @JsonProperty("findings") List<JsonNode> findings,
            @JsonProperty("toolsUsed") List<String> toolsUsed,
            @JsonProperty("severityBreakdown") Map<String, Integer> severityBreakdown,
            @JsonProperty("toolStatus") Map<String, String> toolStatus) {

        public Analysis {
            findings = findings != null ? List.copyOf(findings) : List.of();
            toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
            severityBreakdown = severityBreakdown != null ? Map.copyOf(severityBreakdown) : Map.of();
            toolStatus = toolStatus != null ? Map.copyOf(toolStatus) : Map.of();
        }

        public static Analysis empty() {
            return new Analysis(List.of(), List.of(), Map.of(), Map.of());
        }
    }

    /** Worker produced usable results (full or partial). */
    @JsonIgnore
    public boolean isSuccessful() {
        return SUCCESS.equalsIgnoreCase(status) || PARTIAL.equalsIgnoreCase(status);
    }

    @JsonIgnore
    public Analysis analysisOrEmpty() {
        return analysis != null ? analysis : Analysis.empty();
    }

    /** Human-readable failure summary. */
    @JsonIgnore
    public String failureMessage() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        return "Worker reported status '" + status + "'";
    }
}

package forgebench.orchestrator.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Cumulative maintenance statistics.
 */
public record MaintenanceStatus(
        @JsonProperty("runs") long runs,
        @JsonProperty("lastRunAt") Instant lastRunAt,
        @JsonProperty("lastResult") SweepResult lastResult,
        @JsonProperty("totalReclaimedTasks") long totalReclaimedTasks,
        @JsonProperty("totalReclaimedPipelines") long totalReclaimedPipelines,
        @JsonProperty("runningTimeoutMinutes") long runningTimeoutMinutes,
        @JsonProperty("pendingTimeoutMinutes") long pendingTimeoutMinutes,
        @JsonProperty("gracePeriodMinutes") long gracePeriodMinutes) {
}

package forgebench.orchestrator.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one maintenance sweep.
 */
public record SweepResult(
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("reclaimedRunning") int reclaimedRunning,
        @JsonProperty("reclaimedPending") int reclaimedPending,
        @JsonProperty("reclaimedPipelines") int reclaimedPipelines,
        @JsonProperty("skipped") boolean skipped) {

    static SweepResult skipped(Instant now) {
        return new SweepResult(now, 0, 0, 0, true);
    }

    public int reclaimedTasks() {
        return reclaimedRunning + reclaimedPending;
    }
}

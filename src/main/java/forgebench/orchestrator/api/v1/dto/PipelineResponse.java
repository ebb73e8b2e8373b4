package forgebench.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import forgebench.orchestrator.model.PipelineRun;
import forgebench.orchestrator.model.StageProgress;

import java.time.Instant;

/**
 * Response DTO for pipeline runs.
 * GET /api/v1/pipelines/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResponse(
        @JsonProperty("pipelineId") String pipelineId,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("generation") StageView generation,
        @JsonProperty("analysis") StageView analysis,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public record StageView(
            @JsonProperty("total") int total,
            @JsonProperty("completed") int completed,
            @JsonProperty("failed") int failed,
            @JsonProperty("inFlight") int inFlight,
            @JsonProperty("pending") int pending) {

        static StageView from(StageProgress progress) {
            return new StageView(progress.total(), progress.completed(), progress.failed(),
                    progress.inFlight(), progress.pending());
        }
    }

    /** Create response from domain model */
    public static PipelineResponse from(PipelineRun run) {
        return new PipelineResponse(
                run.id(),
                run.status().value(),
                run.progressPercent(),
                StageView.from(run.generation()),
                StageView.from(run.analysis()),
                run.errorMessage(),
                run.createdAt(),
                run.startedAt(),
                run.finishedAt());
    }
}

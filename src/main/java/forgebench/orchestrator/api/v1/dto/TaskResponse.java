package forgebench.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import forgebench.orchestrator.model.AnalysisTask;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for analysis tasks.
 * GET /api/v1/tasks/{taskId}
 *
 * The stored result summary is embedded as JSON rather than as a string.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("parentId") String parentId,
        @JsonProperty("pipelineId") String pipelineId,
        @JsonProperty("service") String service,
        @JsonProperty("status") String status,
        @JsonProperty("targetModel") String targetModel,
        @JsonProperty("targetAppNumber") int targetAppNumber,
        @JsonProperty("tools") List<String> tools,
        @JsonProperty("progress") int progress,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("subtasks") List<TaskResponse> subtasks) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Create response from domain model */
    public static TaskResponse from(AnalysisTask task) {
        return from(task, null);
    }

    /** Create response for a main task with its subtasks */
    public static TaskResponse from(AnalysisTask task, List<AnalysisTask> subtasks) {
        return new TaskResponse(
                task.id(),
                task.parentId(),
                task.pipelineId(),
                task.service() != null ? task.service().wireName() : null,
                task.status().value(),
                task.targetModel(),
                task.targetAppNumber(),
                task.tools(),
                task.progress(),
                task.retryCount(),
                task.maxRetries(),
                parseResult(task.resultSummary()),
                task.errorMessage(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                subtasks == null ? null : subtasks.stream().map(TaskResponse::from).toList());
    }

    private static JsonNode parseResult(String summary) {
        if (summary == null || summary.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(summary);
        } catch (JsonProcessingException e) {
            // non-JSON summaries are returned as text
            return TextNode.valueOf(summary);
        }
    }
}

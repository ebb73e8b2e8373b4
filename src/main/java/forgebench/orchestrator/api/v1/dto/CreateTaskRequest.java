package forgebench.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import forgebench.orchestrator.model.ToolCatalog;

import java.util.List;

/**
 * Request DTO for an ad-hoc analysis task.
 * POST /api/v1/tasks
 */
public record CreateTaskRequest(
        @JsonProperty("targetModel") String targetModel,
        @JsonProperty("targetAppNumber") Integer targetAppNumber,
        @JsonProperty("tools") List<String> tools) {

    /** Validate the request */
    public void validate() {
        if (targetModel == null || targetModel.isBlank()) {
            throw new IllegalArgumentException("targetModel is required");
        }
        if (targetAppNumber == null || targetAppNumber < 1) {
            throw new IllegalArgumentException("targetAppNumber must be a positive integer");
        }
        if (tools == null || tools.isEmpty()) {
            throw new IllegalArgumentException("tools must not be empty");
        }
        for (String tool : tools) {
            if (!ToolCatalog.isKnown(tool)) {
                throw new IllegalArgumentException("Unknown analysis tool: " + tool);
            }
        }
    }
}

package forgebench.orchestrator.worker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Analysis request sent to a worker. Tools are addressed by name only.
 */
public record WorkerRequest(
        @JsonProperty("type") String type,
        @JsonProperty("targetModel") String targetModel,
        @JsonProperty("targetAppNumber") int targetAppNumber,
        @JsonProperty("tools") List<String> tools) {

    public static final String TYPE = "analysis_request";

    public WorkerRequest {
        Objects.requireNonNull(targetModel, "targetModel is required");
        tools = tools != null ? List.copyOf(tools) : List.of();
        type = type != null ? type : TYPE;
    }

    public static WorkerRequest of(String targetModel, int targetAppNumber, List<String> tools) {
        return new WorkerRequest(TYPE, targetModel, targetAppNumber, tools);
    }
}

package forgebench.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable analysis task. A main task has no parent and owns zero or more
 * subtasks, one per analyzer service touched by its tool selection. A main
 * task without subtasks carries its own service and is dispatched directly.
 */
public final class AnalysisTask {
    private final String id;
    private final String parentId;
    private final String pipelineId;
    private final AnalysisStatus status;
    private final ServiceType service; // null for a multi-service main task
    private final String targetModel;
    private final int targetAppNumber;
    private final List<String> tools;
    private final int progress;
    private final int retryCount;
    private final int maxRetries;
    private final String resultSummary; // JSON
    private final String errorMessage;
    private final String metadata; // JSON
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private AnalysisTask(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.parentId = builder.parentId;
        this.pipelineId = builder.pipelineId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.service = builder.service;
        this.targetModel = Objects.requireNonNull(builder.targetModel, "targetModel is required");
        this.targetAppNumber = builder.targetAppNumber;
        this.tools = builder.tools != null ? List.copyOf(builder.tools) : List.of();
        this.progress = builder.progress;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.resultSummary = builder.resultSummary;
        this.errorMessage = builder.errorMessage;
        this.metadata = builder.metadata;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String parentId() {
        return parentId;
    }

    public String pipelineId() {
        return pipelineId;
    }

    public AnalysisStatus status() {
        return status;
    }

    public ServiceType service() {
        return service;
    }

    public String targetModel() {
        return targetModel;
    }

    public int targetAppNumber() {
        return targetAppNumber;
    }

    public List<String> tools() {
        return tools;
    }

    public int progress() {
        return progress;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public String resultSummary() {
        return resultSummary;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String metadata() {
        return metadata;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean isMainTask() {
        return parentId == null;
    }

    /** Check if a failed dispatch may be retried */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .parentId(parentId)
                .pipelineId(pipelineId)
                .status(status)
                .service(service)
                .targetModel(targetModel)
                .targetAppNumber(targetAppNumber)
                .tools(tools)
                .progress(progress)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .resultSummary(resultSummary)
                .errorMessage(errorMessage)
                .metadata(metadata)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String parentId;
        private String pipelineId;
        private AnalysisStatus status = AnalysisStatus.PENDING;
        private ServiceType service;
        private String targetModel;
        private int targetAppNumber;
        private List<String> tools;
        private int progress;
        private int retryCount;
        private int maxRetries = 3;
        private String resultSummary;
        private String errorMessage;
        private String metadata;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder pipelineId(String pipelineId) {
            this.pipelineId = pipelineId;
            return this;
        }

        public Builder status(AnalysisStatus status) {
            this.status = status;
            return this;
        }

        public Builder service(ServiceType service) {
            this.service = service;
            return this;
        }

        public Builder targetModel(String targetModel) {
            this.targetModel = targetModel;
            return this;
        }

        public Builder targetAppNumber(int targetAppNumber) {
            this.targetAppNumber = targetAppNumber;
            return this;
        }

        public Builder tools(List<String> tools) {
            this.tools = tools;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder resultSummary(String resultSummary) {
            this.resultSummary = resultSummary;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder metadata(String metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public AnalysisTask build() {
            return new AnalysisTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisTask task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AnalysisTask{id='" + id + "', status=" + status + ", service=" + service
                + ", target=" + targetModel + "/app" + targetAppNumber + "}";
    }
}

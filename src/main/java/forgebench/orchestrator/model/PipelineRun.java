package forgebench.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one pipeline run and its per-stage progress.
 */
public final class PipelineRun {
    private final String id;
    private final String config; // PipelineDefinition JSON
    private final PipelineStatus status;
    private final StageProgress generation;
    private final StageProgress analysis;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Instant updatedAt;

    private PipelineRun(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.config = Objects.requireNonNull(builder.config, "config is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.generation = builder.generation != null ? builder.generation : StageProgress.empty();
        this.analysis = builder.analysis != null ? builder.analysis : StageProgress.empty();
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String config() {
        return config;
    }

    public PipelineStatus status() {
        return status;
    }

    public StageProgress generation() {
        return generation;
    }

    public StageProgress analysis() {
        return analysis;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Calculate progress percentage over both stages */
    public int progressPercent() {
        int total = generation.total() + analysis.total();
        if (total == 0)
            return 0;
        int done = generation.completed() + generation.failed() + analysis.completed() + analysis.failed();
        return done * 100 / total;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .config(config)
                .status(status)
                .generation(generation)
                .analysis(analysis)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String config;
        private PipelineStatus status = PipelineStatus.PENDING;
        private StageProgress generation;
        private StageProgress analysis;
        private String errorMessage;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder config(String config) {
            this.config = config;
            return this;
        }

        public Builder status(PipelineStatus status) {
            this.status = status;
            return this;
        }

        public Builder generation(StageProgress generation) {
            this.generation = generation;
            return this;
        }

        public Builder analysis(StageProgress analysis) {
            this.analysis = analysis;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
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

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public PipelineRun build() {
            return new PipelineRun(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PipelineRun run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "PipelineRun{id='" + id + "', status=" + status + ", progress=" + progressPercent() + "%}";
    }
}

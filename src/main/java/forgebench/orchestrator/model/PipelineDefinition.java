package forgebench.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative pipeline: which models generate which templates, and which
 * analysis tools run on the results.
 *
 * <pre>
 * {"generation": {"models": [...], "templates": [...], "options": {"parallel": true, "maxConcurrentTasks": 2}},
 *  "analysis":   {"enabled": true, "tools": [...], "options": {"parallel": true, "maxConcurrentTasks": 2}}}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineDefinition(
        @JsonProperty("generation") GenerationStage generation,
        @JsonProperty("analysis") AnalysisStage analysis) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerationStage(
            @JsonProperty("models") List<String> models,
            @JsonProperty("templates") List<String> templates,
            @JsonProperty("options") StageOptions options) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisStage(
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("tools") List<String> tools,
            @JsonProperty("options") StageOptions options) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StageOptions(
            @JsonProperty("parallel") Boolean parallel,
            @JsonProperty("maxConcurrentTasks") Integer maxConcurrentTasks) {

        /**
         * Effective concurrency for the stage. Sequential stages run one job at
         * a time.
         */
        public int effectiveConcurrency(int defaultMax) {
            if (parallel != null && !parallel) {
                return 1;
            }
            if (maxConcurrentTasks == null || maxConcurrentTasks <= 0) {
                return Math.max(1, defaultMax);
            }
            return maxConcurrentTasks;
        }
    }

    /** Number of generation jobs: |models| x |templates|. */
    @JsonIgnore
    public int generationJobCount() {
        if (generation == null || generation.models() == null || generation.templates() == null) {
            return 0;
        }
        return generation.models().size() * generation.templates().size();
    }

    @JsonIgnore
    public boolean analysisEnabled() {
        return analysis != null && analysis.enabled();
    }

    @JsonIgnore
    public List<String> analysisTools() {
        return analysisEnabled() && analysis.tools() != null ? analysis.tools() : List.of();
    }

    @JsonIgnore
    public int generationConcurrency(int defaultMax) {
        StageOptions options = generation != null ? generation.options() : null;
        return options != null ? options.effectiveConcurrency(defaultMax) : Math.max(1, defaultMax);
    }

    @JsonIgnore
    public int analysisConcurrency(int defaultMax) {
        StageOptions options = analysis != null ? analysis.options() : null;
        return options != null ? options.effectiveConcurrency(defaultMax) : Math.max(1, defaultMax);
    }

    /** Validate the definition. */
    public void validate() {
        if (generation == null) {
            throw new IllegalArgumentException("generation stage is required");
        }
        if (generation.models() == null || generation.models().isEmpty()) {
            throw new IllegalArgumentException("generation.models must not be empty");
        }
        if (generation.templates() == null || generation.templates().isEmpty()) {
            throw new IllegalArgumentException("generation.templates must not be empty");
        }
        requireDistinct(generation.models(), "model");
        requireDistinct(generation.templates(), "template");
        if (analysisEnabled()) {
            if (analysis.tools() == null || analysis.tools().isEmpty()) {
                throw new IllegalArgumentException("analysis.tools must not be empty when analysis is enabled");
            }
            for (String tool : analysis.tools()) {
                if (!ToolCatalog.isKnown(tool)) {
                    throw new IllegalArgumentException("Unknown analysis tool: " + tool);
                }
            }
        }
    }

    /** Names are compared trimmed, so "gpt" and "gpt " are the same model. */
    private static void requireDistinct(List<String> names, String kind) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException(kind + " names must not be blank");
            }
            if (!seen.add(name.trim())) {
                throw new IllegalArgumentException("Duplicate " + kind + ": " + name.trim());
            }
        }
    }
}

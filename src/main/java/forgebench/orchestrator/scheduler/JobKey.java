package forgebench.orchestrator.scheduler;

import java.util.Locale;

/**
 * Identity of one job within a pipeline run. A key is submitted at most once.
 */
public record JobKey(String runId, Stage stage, String model, String template) {

    public enum Stage {
        GENERATION,
        ANALYSIS
    }

    public static JobKey generation(String runId, String model, String template) {
        return new JobKey(runId, Stage.GENERATION, model, template);
    }

    public JobKey toAnalysis() {
        return new JobKey(runId, Stage.ANALYSIS, model, template);
    }

    @Override
    public String toString() {
        return stage.name().toLowerCase(Locale.ROOT) + ":" + model + "/" + template;
    }
}

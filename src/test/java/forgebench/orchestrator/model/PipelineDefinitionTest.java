package forgebench.orchestrator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineDefinitionTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static PipelineDefinition definition(List<String> models, List<String> templates, boolean analysis,
            List<String> tools) {
        return new PipelineDefinition(
                new PipelineDefinition.GenerationStage(models, templates, null),
                new PipelineDefinition.AnalysisStage(analysis, tools, null));
    }

    @Test
    void parsesJsonDefinition() throws Exception {
        String json = """
                {
                  "generation": {"models": ["m1", "m2"], "templates": ["crud"],
                                 "options": {"parallel": true, "maxConcurrentTasks": 3}},
                  "analysis": {"enabled": true, "tools": ["bandit", "zap"],
                               "options": {"parallel": false}},
                  "extra": "ignored"
                }
                """;

        PipelineDefinition def = MAPPER.readValue(json, PipelineDefinition.class);
        def.validate();

        assertEquals(2, def.generationJobCount());
        assertTrue(def.analysisEnabled());
        assertEquals(List.of("bandit", "zap"), def.analysisTools());
        assertEquals(3, def.generationConcurrency(2));
        assertEquals(1, def.analysisConcurrency(2), "sequential stage runs one job at a time");
    }

    @Test
    @DisplayName("Missing options fall back to the configured default")
    void defaultConcurrency() {
        PipelineDefinition def = definition(List.of("m"), List.of("t"), false, null);
        assertEquals(4, def.generationConcurrency(4));
        assertEquals(4, def.analysisConcurrency(4));
        assertEquals(List.of(), def.analysisTools());
    }

    @Test
    void rejectsEmptyModels() {
        PipelineDefinition def = definition(List.of(), List.of("t"), false, null);
        assertThrows(IllegalArgumentException.class, def::validate);
    }

    @Test
    void rejectsMissingGenerationStage() {
        PipelineDefinition def = new PipelineDefinition(null, null);
        assertThrows(IllegalArgumentException.class, def::validate);
    }

    @Test
    void rejectsUnknownToolWhenAnalysisEnabled() {
        PipelineDefinition def = definition(List.of("m"), List.of("t"), true, List.of("bandit", "frobnicate"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, def::validate);
        assertTrue(e.getMessage().contains("frobnicate"));
    }

    @Test
    @DisplayName("A model or template listed twice is rejected, ignoring surrounding whitespace")
    void rejectsDuplicateNames() {
        IllegalArgumentException models = assertThrows(IllegalArgumentException.class,
                definition(List.of("gpt", "gpt "), List.of("crud"), false, null)::validate);
        assertTrue(models.getMessage().contains("Duplicate model: gpt"));

        IllegalArgumentException templates = assertThrows(IllegalArgumentException.class,
                definition(List.of("gpt"), List.of("crud", "blog", "crud"), false, null)::validate);
        assertTrue(templates.getMessage().contains("Duplicate template: crud"));
    }

    @Test
    void analysisToolsIgnoredWhenDisabled() {
        PipelineDefinition def = definition(List.of("m"), List.of("t"), false, List.of("frobnicate"));
        assertDoesNotThrow(def::validate);
    }

    @Test
    void stageProgressCounters() {
        StageProgress p = StageProgress.ofTotal(3).started().started();
        assertEquals(1, p.pending());
        p = p.succeeded().failedOne();
        assertEquals(1, p.completed());
        assertEquals(1, p.failed());
        assertEquals(0, p.inFlight());
        assertFalse(p.isDrained());
        assertTrue(p.withTotal(2).isDrained());
        assertEquals(0, StageProgress.ofTotal(1).started().discarded().inFlight());
    }
}

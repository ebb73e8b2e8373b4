package forgebench.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import forgebench.orchestrator.model.AnalysisStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ResultAggregator aggregator = new ResultAggregator();

    private static JsonNode finding(String severity) {
        return MAPPER.createObjectNode().put("severity", severity).put("message", "issue");
    }

    @Test
    void mergesSnapshotsOfAllServices() {
        SubtaskSnapshot staticResult = new SubtaskSnapshot("static-analyzer", "success",
                List.of(finding("HIGH"), finding("low")), List.of("bandit", "pylint"), Map.of(),
                Map.of("bandit", "success", "pylint", "success"));
        SubtaskSnapshot dynamicResult = new SubtaskSnapshot("dynamic-analyzer", "partial",
                List.of(finding("medium")), List.of("zap"), Map.of("Medium", 1, "high", 2),
                Map.of("zap", "partial"));

        AggregatedResult result = aggregator.aggregate(List.of("static-analyzer", "dynamic-analyzer"),
                List.of(staticResult, dynamicResult));

        assertEquals(AnalysisStatus.COMPLETED.value(), result.status());
        assertEquals(List.of("static-analyzer", "dynamic-analyzer"), result.servicesExecuted());
        assertTrue(result.servicesFailed().isEmpty());
        assertEquals(3, result.totalFindings());
        assertEquals(3, result.toolsExecuted());
        assertEquals(Map.of("high", 3, "low", 1, "medium", 1), result.severityBreakdown(),
                "reported breakdowns win over per-finding counts, levels are lowercased");
        assertEquals("partial", result.toolStatus().get("zap"));
    }

    @Test
    void missingServicesAreReportedAsFailed() {
        SubtaskSnapshot only = new SubtaskSnapshot("static-analyzer", "success", List.of(finding("low")),
                List.of("bandit"), Map.of(), Map.of());

        AggregatedResult result = aggregator.aggregate(List.of("static-analyzer", "performance-tester"),
                List.of(only));

        assertEquals("partial_success", result.status());
        assertEquals(List.of("performance-tester"), result.servicesFailed());
    }

    @Test
    void noSnapshotsGiveValidFailedDocument() throws Exception {
        AggregatedResult result = aggregator.aggregate(List.of("ai-analyzer"), List.of());

        assertEquals("failed", result.status());
        assertEquals(0, result.totalFindings());

        JsonNode json = MAPPER.readTree(aggregator.toJson(result));
        assertEquals(0, json.get("totalFindings").asInt());
        assertTrue(json.get("findings").isArray());
        assertEquals("ai-analyzer", json.get("servicesFailed").get(0).asText());
    }

    @Test
    void rollupStatusThresholds() {
        assertEquals(AnalysisStatus.COMPLETED, ResultAggregator.rollupStatus(3, 0));
        assertEquals(AnalysisStatus.PARTIAL_SUCCESS, ResultAggregator.rollupStatus(1, 2));
        assertEquals(AnalysisStatus.FAILED, ResultAggregator.rollupStatus(0, 2));
    }
}

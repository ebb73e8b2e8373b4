package forgebench.orchestrator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import forgebench.orchestrator.model.AnalysisStatus;
import forgebench.orchestrator.model.AnalysisTask;
import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.server.RouterHandler;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskResponseTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    private static AnalysisTask.Builder task(String id) {
        return AnalysisTask.builder()
                .id(id)
                .status(AnalysisStatus.COMPLETED)
                .targetModel("gpt")
                .targetAppNumber(2)
                .tools(List.of("bandit"))
                .maxRetries(3)
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void embedsResultSummaryAsJson() throws Exception {
        AnalysisTask main = task("main").resultSummary("{\"totalFindings\":3}").build();
        AnalysisTask sub = task("sub").parentId("main").service(ServiceType.STATIC_ANALYZER).build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(TaskResponse.from(main, List.of(sub))));

        assertEquals("completed", json.get("status").asText());
        assertEquals(3, json.get("result").get("totalFindings").asInt());
        assertEquals("static-analyzer", json.get("subtasks").get(0).get("service").asText());
        assertFalse(json.has("service"), "null fields are omitted");
        assertEquals("2026-01-01T00:00:00Z", json.get("createdAt").asText());
    }

    @Test
    void plainTextSummaryIsKept() {
        TaskResponse response = TaskResponse.from(task("t").resultSummary("worker said no").build());

        assertTrue(response.result().isTextual());
        assertEquals("worker said no", response.result().asText());
        assertNull(response.subtasks());
    }
}

package forgebench.orchestrator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import forgebench.orchestrator.config.Dependencies;
import forgebench.orchestrator.config.OrchestratorConfig;
import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.server.OrchestratorNettyServer;
import forgebench.orchestrator.testing.TestDatabases;
import org.junit.jupiter.api.*;

import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the HTTP API end to end through Netty. No worker or generator is
 * listening, so every dispatch fails fast with a refused connection.
 */
class HttpApiIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> TERMINAL = Set.of("completed", "partial_success", "failed", "cancelled");

    private Dependencies deps;
    private OrchestratorNettyServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        int deadPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            deadPort = socket.getLocalPort();
        }

        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl(TestDatabases.url("test-http"))
                .withServerPort(0)
                .withGeneratorUrl("http://127.0.0.1:" + deadPort)
                .withConnectTimeout(Duration.ofSeconds(1))
                .withDispatchTimeout(Duration.ofSeconds(5))
                .withPoolSizes(2, 2);
        for (ServiceType type : ServiceType.values()) {
            config = config.withEndpointUrls(type, List.of("ws://127.0.0.1:" + deadPort));
        }

        deps = Dependencies.create(config);
        server = new OrchestratorNettyServer(deps.routerHandler(), "127.0.0.1");
        server.start(0);
        baseUrl = "http://127.0.0.1:" + server.port();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode awaitTerminal(String path) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        JsonNode node;
        do {
            HttpResponse<String> resp = get(path);
            assertEquals(200, resp.statusCode(), resp.body());
            node = MAPPER.readTree(resp.body());
            if (TERMINAL.contains(node.get("status").asText())) {
                return node;
            }
            TimeUnit.MILLISECONDS.sleep(100);
        } while (System.nanoTime() < deadline);
        fail("Still not terminal: " + node);
        return node;
    }

    @Test
    void healthReportsDatabaseAndEndpoints() throws Exception {
        HttpResponse<String> resp = get("/api/v1/health");

        assertEquals(200, resp.statusCode(), resp.body());
        JsonNode health = MAPPER.readTree(resp.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals(ServiceType.values().length, health.get("totalEndpoints").asInt());
        assertEquals(0, health.get("activePipelines").asInt());
    }

    @Test
    void unknownPathIs404() throws Exception {
        HttpResponse<String> resp = get("/api/v1/nowhere");

        assertEquals(404, resp.statusCode());
        assertEquals("not found", MAPPER.readTree(resp.body()).get("error").asText());
    }

    @Test
    void invalidTaskRequestIs400() throws Exception {
        HttpResponse<String> unknownTool = post("/api/v1/tasks",
                "{\"targetModel\":\"gpt\",\"targetAppNumber\":1,\"tools\":[\"nmap\"]}");
        assertEquals(400, unknownTool.statusCode(), unknownTool.body());

        HttpResponse<String> garbage = post("/api/v1/tasks", "{not json");
        assertEquals(400, garbage.statusCode(), garbage.body());
    }

    @Test
    @DisplayName("POST /tasks accepts, runs in the background, and the failure is visible on GET")
    void taskLifecycleOverHttp() throws Exception {
        HttpResponse<String> created = post("/api/v1/tasks",
                "{\"targetModel\":\"gpt\",\"targetAppNumber\":7,\"tools\":[\"bandit\",\"zap\"]}");

        assertEquals(202, created.statusCode(), created.body());
        JsonNode accepted = MAPPER.readTree(created.body());
        assertTrue(accepted.get("success").asBoolean());
        String taskId = accepted.get("taskId").asText();

        JsonNode task = awaitTerminal("/api/v1/tasks/" + taskId);
        assertEquals("failed", task.get("status").asText());
        assertEquals("gpt", task.get("targetModel").asText());
        assertEquals(2, task.get("subtasks").size());

        HttpResponse<String> retry = post("/api/v1/tasks/" + taskId + "/retry", "");
        assertEquals(202, retry.statusCode(), retry.body());

        assertEquals(404, get("/api/v1/tasks/no-such-task").statusCode());
        assertEquals(404, post("/api/v1/tasks/no-such-task/retry", "").statusCode());
    }

    @Test
    void pipelineLifecycleOverHttp() throws Exception {
        HttpResponse<String> created = post("/api/v1/pipelines", """
                {"generation": {"models": ["gpt"], "templates": ["crud", "blog"]},
                 "analysis": {"enabled": true, "tools": ["bandit"]}}""");

        assertEquals(201, created.statusCode(), created.body());
        JsonNode body = MAPPER.readTree(created.body());
        String pipelineId = body.get("pipelineId").asText();
        assertEquals(2, body.get("generationJobs").asInt());

        JsonNode run = awaitTerminal("/api/v1/pipelines/" + pipelineId);
        assertEquals("failed", run.get("status").asText());
        assertEquals(2, run.get("generation").get("failed").asInt());
        assertEquals(0, run.get("analysis").get("total").asInt());

        JsonNode list = MAPPER.readTree(get("/api/v1/pipelines").body());
        assertEquals(pipelineId, list.get("pipelines").get(0).get("pipelineId").asText());

        HttpResponse<String> cancel = post("/api/v1/pipelines/" + pipelineId + "/cancel", "");
        assertEquals(200, cancel.statusCode(), cancel.body());
        assertEquals("failed", MAPPER.readTree(cancel.body()).get("status").asText());

        assertEquals(404, get("/api/v1/pipelines/pipeline-missing").statusCode());
        assertEquals(400, post("/api/v1/pipelines", "{\"generation\":{\"models\":[]}}").statusCode());
    }

    @Test
    void endpointAndMaintenanceViews() throws Exception {
        HttpResponse<String> endpoints = get("/api/v1/endpoints");
        assertEquals(200, endpoints.statusCode());
        JsonNode stats = MAPPER.readTree(endpoints.body());
        assertEquals("least_in_flight", stats.get("strategy").asText());
        assertEquals(1, stats.get("services").get("static-analyzer").get("total").asInt());

        deps.maintenanceSweep().sweep();
        HttpResponse<String> maintenance = get("/api/v1/maintenance");
        assertEquals(200, maintenance.statusCode());
        JsonNode status = MAPPER.readTree(maintenance.body());
        assertEquals(1, status.get("runs").asInt());
        assertEquals(120, status.get("runningTimeoutMinutes").asInt());
    }
}

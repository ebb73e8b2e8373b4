package forgebench.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import forgebench.orchestrator.api.Controller;
import forgebench.orchestrator.model.ApplicationSlot;
import forgebench.orchestrator.server.OrchestratorNettyServer;
import forgebench.orchestrator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpApplicationGeneratorTest {

    private final StubGenerator stub = new StubGenerator();
    private OrchestratorNettyServer server;
    private HttpApplicationGenerator generator;

    private final ApplicationSlot slot = new ApplicationSlot("slot-1", "openai_gpt-4", 3, 2, "slot-0",
            "fastapi-crud", Instant.now());

    @BeforeEach
    void setUp() {
        server = new OrchestratorNettyServer(new RouterHandler().registerController(stub), "127.0.0.1");
        server.start(0);
        generator = new HttpApplicationGenerator("http://127.0.0.1:" + server.port() + "/",
                Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void postsSlotCoordinates() throws Exception {
        stub.reply.set(Controller.ControllerResponse.json("{\"success\":true}"));

        generator.generate(slot);

        JsonNode sent = RouterHandler.mapper().readTree(stub.lastBody.get());
        assertEquals("openai_gpt-4", sent.get("model").asText());
        assertEquals(3, sent.get("appNumber").asInt());
        assertEquals(2, sent.get("version").asInt());
        assertEquals("fastapi-crud", sent.get("template").asText());
    }

    @Test
    void nonSuccessStatusFails() {
        stub.reply.set(Controller.ControllerResponse.error("generator crashed"));

        GenerationException e = assertThrows(GenerationException.class, () -> generator.generate(slot));
        assertTrue(e.getMessage().contains("HTTP 500"), e.getMessage());
    }

    @Test
    void successFalseBodyFails() {
        stub.reply.set(Controller.ControllerResponse.json("{\"success\":false,\"error\":\"model quota exceeded\"}"));

        GenerationException e = assertThrows(GenerationException.class, () -> generator.generate(slot));
        assertTrue(e.getMessage().contains("model quota exceeded"), e.getMessage());
    }

    @Test
    void unreachableGeneratorFails() {
        HttpApplicationGenerator offline = new HttpApplicationGenerator("http://127.0.0.1:1",
                Duration.ofMillis(500), Duration.ofSeconds(1));

        assertThrows(GenerationException.class, () -> offline.generate(slot));
    }

    private static final class StubGenerator implements Controller {
        final AtomicReference<ControllerResponse> reply = new AtomicReference<>();
        final AtomicReference<String> lastBody = new AtomicReference<>();

        @Override
        public boolean matches(HttpMethod method, String path) {
            return HttpMethod.POST.equals(method) && "/api/generate".equals(path);
        }

        @Override
        public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
            lastBody.set(req.content().toString(StandardCharsets.UTF_8));
            ControllerResponse r = reply.get();
            return r != null ? r : ControllerResponse.json(HttpResponseStatus.OK, "{}");
        }
    }
}

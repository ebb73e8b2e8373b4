package forgebench.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import forgebench.orchestrator.model.ApplicationSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the generation worker.
 * POSTs {@code {model, appNumber, version, template}} to {@code /api/generate}.
 */
public class HttpApplicationGenerator implements ApplicationGenerator {

    private static final Logger log = LoggerFactory.getLogger(HttpApplicationGenerator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;

    public HttpApplicationGenerator(String baseUrl, Duration connectTimeout, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public void generate(ApplicationSlot slot) {
        log.info("Generating {} from template {}", slot.label(), slot.template());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", slot.model());
        body.put("appNumber", slot.appNumber());
        body.put("version", slot.version());
        body.put("template", slot.template());

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/generate"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GenerationException("Generation request for " + slot.label() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while generating " + slot.label(), e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new GenerationException("Generation of " + slot.label() + " failed: HTTP " + resp.statusCode());
        }

        String error = errorOf(resp.body());
        if (error != null) {
            throw new GenerationException("Generation of " + slot.label() + " failed: " + error);
        }
        log.debug("Generated {}", slot.label());
    }

    /**
     * A 2xx reply may still carry {@code {"success": false, "error": ...}}.
     */
    private static String errorOf(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            if (node.has("success") && !node.get("success").asBoolean(true)) {
                return node.path("error").asText("generator reported failure");
            }
            return null;
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON generator reply ignored: {}", e.getMessage());
            return null;
        }
    }
}

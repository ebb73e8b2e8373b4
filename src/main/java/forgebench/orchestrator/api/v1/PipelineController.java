package forgebench.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import forgebench.orchestrator.api.Controller;
import forgebench.orchestrator.api.v1.dto.PipelineResponse;
import forgebench.orchestrator.model.PipelineDefinition;
import forgebench.orchestrator.model.PipelineRun;
import forgebench.orchestrator.repository.PipelineRepository;
import forgebench.orchestrator.scheduler.JobScheduler;
import forgebench.orchestrator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for pipeline runs.
 *
 * POST /api/v1/pipelines - Start a pipeline run
 * GET /api/v1/pipelines - Most recent runs
 * GET /api/v1/pipelines/{id} - Run status and per-stage progress
 * POST /api/v1/pipelines/{id}/cancel - Cancel a run
 */
public class PipelineController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private static final Pattern PIPELINES_PATTERN = Pattern.compile("^/api/v1/pipelines$");
    private static final Pattern PIPELINE_BY_ID_PATTERN = Pattern.compile("^/api/v1/pipelines/([^/]+)$");
    private static final Pattern PIPELINE_CANCEL_PATTERN = Pattern.compile("^/api/v1/pipelines/([^/]+)/cancel$");
    private static final int RECENT_LIMIT = 50;

    private final JobScheduler jobScheduler;
    private final PipelineRepository pipelineRepository;

    public PipelineController(JobScheduler jobScheduler, PipelineRepository pipelineRepository) {
        this.jobScheduler = jobScheduler;
        this.pipelineRepository = pipelineRepository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return PIPELINES_PATTERN.matcher(path).matches() || PIPELINE_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return PIPELINES_PATTERN.matcher(path).matches() || PIPELINE_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (PIPELINES_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST) ? handleSubmit(req) : handleList();
            }

            Matcher cancelMatcher = PIPELINE_CANCEL_PATTERN.matcher(path);
            if (cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            Matcher byIdMatcher = PIPELINE_BY_ID_PATTERN.matcher(path);
            if (byIdMatcher.matches()) {
                return handleGet(byIdMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown pipeline endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Pipeline controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/pipelines
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        PipelineDefinition definition = parse(body);

        PipelineRun run = jobScheduler.submit(definition);

        Map<String, Object> response = Map.of(
                "success", true,
                "pipelineId", run.id(),
                "status", run.status().value(),
                "generationJobs", run.generation().total());

        return ControllerResponse.created(RouterHandler.mapper().writeValueAsString(response));
    }

    private PipelineDefinition parse(String body) {
        try {
            return RouterHandler.mapper().readValue(body, PipelineDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid pipeline definition: " + e.getOriginalMessage(), e);
        }
    }

    private ControllerResponse handleList() throws Exception {
        List<PipelineResponse> runs = pipelineRepository.findRecent(RECENT_LIMIT).stream()
                .map(PipelineResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("pipelines", runs)));
    }

    private ControllerResponse handleGet(String pipelineId) throws Exception {
        Optional<PipelineRun> run = jobScheduler.find(pipelineId);
        if (run.isEmpty()) {
            return ControllerResponse.notFound("pipeline not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(PipelineResponse.from(run.get())));
    }

    private ControllerResponse handleCancel(String pipelineId) throws Exception {
        Optional<PipelineRun> run = jobScheduler.cancel(pipelineId);
        if (run.isEmpty()) {
            return ControllerResponse.notFound("pipeline not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(PipelineResponse.from(run.get())));
    }
}

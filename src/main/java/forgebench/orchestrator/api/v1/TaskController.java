package forgebench.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import forgebench.orchestrator.api.Controller;
import forgebench.orchestrator.api.v1.dto.CreateTaskRequest;
import forgebench.orchestrator.api.v1.dto.TaskResponse;
import forgebench.orchestrator.model.AnalysisStatus;
import forgebench.orchestrator.model.AnalysisTask;
import forgebench.orchestrator.server.RouterHandler;
import forgebench.orchestrator.service.TaskOrchestrator;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for ad-hoc analysis tasks. Execution happens on a background
 * executor so the event loop is never blocked on worker round trips.
 *
 * POST /api/v1/tasks - Create and start a task
 * GET /api/v1/tasks/{taskId} - Task with subtasks
 * POST /api/v1/tasks/{taskId}/retry - Retry failed subtasks
 * POST /api/v1/tasks/{taskId}/cancel - Cancel a task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern TASK_ACTION_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/(retry|cancel)$");

    private final TaskOrchestrator orchestrator;
    private final Executor executor;

    public TaskController(TaskOrchestrator orchestrator, Executor executor) {
        this.orchestrator = orchestrator;
        this.executor = executor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_ACTION_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.GET) && TASK_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleCreate(req);
            }

            Matcher actionMatcher = TASK_ACTION_PATTERN.matcher(path);
            if (actionMatcher.matches()) {
                String taskId = actionMatcher.group(1);
                return "retry".equals(actionMatcher.group(2)) ? handleRetry(taskId) : handleCancel(taskId);
            }

            Matcher byIdMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (byIdMatcher.matches()) {
                return handleGet(byIdMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateTaskRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, CreateTaskRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid task request: " + e.getOriginalMessage(), e);
        }
        request.validate();

        AnalysisTask task = orchestrator.createTask(request.targetModel(), request.targetAppNumber(),
                request.tools());
        executor.execute(() -> runSafely(task.id(), false));

        Map<String, Object> response = Map.of(
                "success", true,
                "taskId", task.id(),
                "status", task.status().value());
        return ControllerResponse.accepted(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleGet(String taskId) throws Exception {
        Optional<AnalysisTask> task = orchestrator.findById(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        TaskResponse response = TaskResponse.from(task.get(), orchestrator.subtasks(taskId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleRetry(String taskId) throws Exception {
        Optional<AnalysisTask> task = orchestrator.findById(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        AnalysisStatus status = task.get().status();
        if (status != AnalysisStatus.FAILED && status != AnalysisStatus.PARTIAL_SUCCESS) {
            return ControllerResponse.conflict("task " + taskId + " is " + status.value() + " and cannot be retried");
        }
        executor.execute(() -> runSafely(taskId, true));
        return ControllerResponse.accepted(RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "taskId", taskId)));
    }

    private ControllerResponse handleCancel(String taskId) throws Exception {
        if (orchestrator.findById(taskId).isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        AnalysisTask cancelled = orchestrator.cancel(taskId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(cancelled)));
    }

    private void runSafely(String taskId, boolean retry) {
        try {
            AnalysisTask finished = retry ? orchestrator.retry(taskId) : orchestrator.execute(taskId);
            log.info("Analysis task {} finished: {}", taskId, finished.status().value());
        } catch (Exception e) {
            log.error("Analysis task {} execution failed", taskId, e);
        }
    }
}

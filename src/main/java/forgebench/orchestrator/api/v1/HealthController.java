package forgebench.orchestrator.api.v1;

import forgebench.orchestrator.api.Controller;
import forgebench.orchestrator.api.v1.dto.HealthResponse;
import forgebench.orchestrator.model.AnalysisStatus;
import forgebench.orchestrator.pool.EndpointPool;
import forgebench.orchestrator.pool.PoolStats;
import forgebench.orchestrator.repository.AnalysisTaskRepository;
import forgebench.orchestrator.scheduler.JobScheduler;
import forgebench.orchestrator.server.RouterHandler;
import forgebench.orchestrator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final EndpointPool pool;
    private final JobScheduler jobScheduler;
    private final AnalysisTaskRepository taskRepository;

    public HealthController(Database database, EndpointPool pool, JobScheduler jobScheduler,
            AnalysisTaskRepository taskRepository) {
        this.database = database;
        this.pool = pool;
        this.jobScheduler = jobScheduler;
        this.taskRepository = taskRepository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            PoolStats stats = pool.stats();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    stats.totalEndpoints(),
                    stats.healthyEndpoints(),
                    jobScheduler.activeRuns(),
                    taskRepository.countByStatus(AnalysisStatus.PENDING),
                    taskRepository.countByStatus(AnalysisStatus.RUNNING));

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    "{\"status\":\"unhealthy\",\"database\":\"error\"}");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}

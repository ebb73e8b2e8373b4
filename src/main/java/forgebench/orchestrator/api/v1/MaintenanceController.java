package forgebench.orchestrator.api.v1;

import forgebench.orchestrator.api.Controller;
import forgebench.orchestrator.scheduler.MaintenanceSweep;
import forgebench.orchestrator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /api/v1/maintenance - sweep statistics
 */
public class MaintenanceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceController.class);

    private final MaintenanceSweep sweep;

    public MaintenanceController(MaintenanceSweep sweep) {
        this.sweep = sweep;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/maintenance".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(sweep.status()));
        } catch (Exception e) {
            log.error("Maintenance status failed", e);
            return ControllerResponse.error("internal error");
        }
    }
}

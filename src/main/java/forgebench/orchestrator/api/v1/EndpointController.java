package forgebench.orchestrator.api.v1;

import forgebench.orchestrator.api.Controller;
import forgebench.orchestrator.pool.EndpointPool;
import forgebench.orchestrator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /api/v1/endpoints
 */
public class EndpointController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(EndpointController.class);

    private final EndpointPool pool;

    public EndpointController(EndpointPool pool) {
        this.pool = pool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/endpoints".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(pool.stats()));
        } catch (Exception e) {
            log.error("Endpoint stats failed", e);
            return ControllerResponse.error("internal error");
        }
    }
}

package scrapeflow.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import scrapeflow.engine.api.Controller;
import scrapeflow.engine.api.v1.dto.StatusResponse;
import scrapeflow.engine.model.EngineSnapshot;
import scrapeflow.engine.server.RouterHandler;

import java.util.function.Supplier;

/**
 * Live view of the worker pool.
 * GET /api/v1/status
 */
public class StatusController implements Controller {

    private final Supplier<EngineSnapshot> snapshots;

    public StatusController(Supplier<EngineSnapshot> snapshots) {
        this.snapshots = snapshots;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/status".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        StatusResponse response = StatusResponse.from(snapshots.get());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}

package scrapeflow.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import scrapeflow.engine.api.Controller;
import scrapeflow.engine.api.v1.dto.RunSummaryResponse;
import scrapeflow.engine.repository.ResultRepository;
import scrapeflow.engine.server.RouterHandler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Stored runs, newest first.
 * GET /api/v1/runs?limit=N
 */
public class RunController implements Controller {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 500;

    private final ResultRepository repository;

    public RunController(ResultRepository repository) {
        this.repository = repository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/runs".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        int limit = parseLimit(new QueryStringDecoder(req.uri()).parameters().get("limit"));
        List<RunSummaryResponse> runs = repository.findRecentRuns(limit).stream()
                .map(RunSummaryResponse::from)
                .collect(Collectors.toList());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(runs));
    }

    private static int parseLimit(List<String> values) {
        if (values == null || values.isEmpty()) {
            return DEFAULT_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(values.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer: " + values.get(0));
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}

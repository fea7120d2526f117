package hintvote.coordinator.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import hintvote.coordinator.api.Controller;
import hintvote.coordinator.api.Controller.ControllerResponse;
import hintvote.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.FORBIDDEN;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* endpoints are served; everything else returns 404.
 * When a client key is configured, every POST must carry it in the
 * {@value #CLIENT_KEY_HEADER} header.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final String CLIENT_KEY_HEADER = "X-Hintvote-Key";

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;

    public RouterHandler(CoordinatorConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, FORBIDDEN, "application/json", "{\"error\":\"forbidden\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            writeSafe(ctx, BAD_REQUEST, "application/json",
                    "{\"error\":\"" + escapeJson(e.getMessage()) + "\"}");
        } catch (Exception e) {
            log.error("Handler error: {} {} - Body: [{}]", method, path,
                    req.content().toString(StandardCharsets.UTF_8), e);
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"" + escapeJson(e.toString()) + "\"}");
        }
    }

    /**
     * Mutating requests need the client key when one is configured.
     */
    private boolean checkAuth(FullHttpRequest req) {
        if (!config.hasClientKey()) {
            return true;
        }
        if (!req.method().equals(HttpMethod.POST)) {
            return true;
        }
        String providedKey = req.headers().get(CLIENT_KEY_HEADER);
        return config.clientKey().equals(providedKey);
    }

    /**
     * Write a response, falling back to a bare 500 and finally closing the
     * channel if the response itself cannot be written.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            ctx.writeAndFlush(buildResponse(status, contentType, body == null ? "" : body));
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            try {
                ctx.writeAndFlush(buildResponse(INTERNAL_SERVER_ERROR, "application/json",
                        "{\"error\":\"failed to write response\"}"));
            } catch (RuntimeException e2) {
                log.error("Complete failure writing error response", e2);
                ctx.close();
            }
        }
    }

    private static FullHttpResponse buildResponse(HttpResponseStatus status, String contentType, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        return response;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"channel error: " + escapeJson(cause.getMessage()) + "\"}");
        } finally {
            ctx.close();
        }
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}

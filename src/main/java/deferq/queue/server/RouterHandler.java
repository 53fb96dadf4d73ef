package deferq.queue.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import deferq.queue.api.Controller;
import deferq.queue.api.Controller.ControllerResponse;
import deferq.queue.api.v1.dto.OperationResponse;
import deferq.queue.model.JobConfigurationException;
import deferq.queue.model.UnknownJobException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches admin API requests to the first matching controller and writes
 * its body as JSON.
 *
 * Errors raised by controllers become JSON error bodies:
 * invalid input is a 400, an unknown job name a 404, a job whose frequency
 * cannot be applied a 409, anything else a 500.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Controllers are tried in registration order.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).path();
        ControllerResponse response = dispatch(req, path);
        write(ctx, req, response);
    }

    ControllerResponse dispatch(FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        Controller controller = controllers.stream()
                .filter(c -> c.matches(method, path))
                .findFirst()
                .orElse(null);
        if (controller == null) {
            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.of(NOT_FOUND, OperationResponse.error("no route for " + method + " " + path));
        }

        try {
            return controller.handle(req, path);
        } catch (JsonProcessingException e) {
            log.warn("Malformed body on {} {}: {}", method, path, e.getOriginalMessage());
            return ControllerResponse.of(BAD_REQUEST, OperationResponse.error("malformed JSON: " + e.getOriginalMessage()));
        } catch (JobConfigurationException e) {
            log.warn("{} {}: {}", method, path, e.getMessage());
            return ControllerResponse.of(CONFLICT, OperationResponse.error(e.getMessage()));
        } catch (UnknownJobException e) {
            return ControllerResponse.of(NOT_FOUND, OperationResponse.error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.of(BAD_REQUEST, OperationResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.of(INTERNAL_SERVER_ERROR, OperationResponse.error("internal error"));
        }
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest req, ControllerResponse response) {
        byte[] bytes;
        HttpResponseStatus status = response.status();
        try {
            bytes = MAPPER.writeValueAsBytes(response.body());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} response", status, e);
            status = INTERNAL_SERVER_ERROR;
            bytes = "{\"ok\":false,\"error\":\"internal error\"}".getBytes(StandardCharsets.UTF_8);
        }

        FullHttpResponse res = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        res.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
        HttpUtil.setContentLength(res, bytes.length);

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        HttpUtil.setKeepAlive(res, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(res);
        } else {
            ctx.writeAndFlush(res).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Shared ObjectMapper for request bodies.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}

package deferq.queue.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import deferq.queue.api.Controller;
import deferq.queue.model.JobConfigurationException;
import deferq.queue.model.UnknownJobException;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EmbeddedChannel channel;

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.finishAndReleaseAll();
        }
    }

    private static Controller failingWith(Exception error) {
        return new Controller() {
            @Override
            public boolean matches(HttpMethod method, String path) {
                return "/boom".equals(path);
            }

            @Override
            public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
                throw error;
            }
        };
    }

    private FullHttpResponse send(Controller controller, HttpMethod method, String uri) {
        channel = new EmbeddedChannel(new RouterHandler().registerController(controller));
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri));
        return channel.readOutbound();
    }

    private static JsonNode body(FullHttpResponse response) throws Exception {
        try {
            return MAPPER.readTree(response.content().toString(StandardCharsets.UTF_8));
        } finally {
            response.release();
        }
    }

    @Test
    void bodyIsWrittenAsJson() throws Exception {
        Controller ok = new Controller() {
            @Override
            public boolean matches(HttpMethod method, String path) {
                return method.equals(HttpMethod.GET) && "/api/v1/ping".equals(path);
            }

            @Override
            public ControllerResponse handle(FullHttpRequest req, String path) {
                return ControllerResponse.ok(Map.of("pong", true));
            }
        };

        FullHttpResponse response = send(ok, HttpMethod.GET, "/api/v1/ping?verbose=1");

        assertEquals(HttpResponseStatus.OK, response.status());
        assertEquals("application/json; charset=utf-8", response.headers().get(HttpHeaderNames.CONTENT_TYPE));
        assertTrue(body(response).get("pong").asBoolean());
    }

    @Test
    void unknownRoute() throws Exception {
        FullHttpResponse response = send(failingWith(new IllegalStateException()), HttpMethod.GET, "/elsewhere");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("no route for GET /elsewhere", body(response).get("error").asText());
    }

    @Test
    void invalidInputIsABadRequest() throws Exception {
        FullHttpResponse response = send(failingWith(new IllegalArgumentException("name is required")),
                HttpMethod.POST, "/boom");

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        assertEquals("name is required", body(response).get("error").asText());
    }

    @Test
    void configurationErrorIsAConflict() throws Exception {
        FullHttpResponse response = send(failingWith(
                new JobConfigurationException("app.Report has a frequency going backward")), HttpMethod.POST, "/boom");

        assertEquals(HttpResponseStatus.CONFLICT, response.status());
        assertEquals("app.Report has a frequency going backward", body(response).get("error").asText());
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        FullHttpResponse response = send(failingWith(new UnknownJobException("app.Gone")), HttpMethod.POST, "/boom");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("app.Gone is not a registered job", body(response).get("error").asText());
    }

    @Test
    void anythingElseIsAnInternalError() throws Exception {
        FullHttpResponse response = send(failingWith(new IllegalStateException("pool exhausted")),
                HttpMethod.POST, "/boom");

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        JsonNode json = body(response);
        assertFalse(json.get("ok").asBoolean());
        assertEquals("internal error", json.get("error").asText());
    }
}

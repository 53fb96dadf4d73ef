package deferq.queue.api;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * An admin API endpoint group. Controllers return plain objects; the router
 * turns them into JSON and turns the exceptions they throw into error
 * statuses.
 */
public interface Controller {

    /**
     * @param path request path, without the query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * @throws IllegalArgumentException   on an invalid request (400)
     * @throws deferq.queue.model.JobConfigurationException when a job cannot
     *                                    be rescheduled (409)
     */
    ControllerResponse handle(FullHttpRequest req, String path) throws Exception;

    /**
     * Status and body to serialize.
     */
    record ControllerResponse(HttpResponseStatus status, Object body) {

        public static ControllerResponse ok(Object body) {
            return new ControllerResponse(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse created(Object body) {
            return new ControllerResponse(HttpResponseStatus.CREATED, body);
        }

        public static ControllerResponse of(HttpResponseStatus status, Object body) {
            return new ControllerResponse(status, body);
        }
    }
}

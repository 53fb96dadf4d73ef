package deferq.queue.api.v1;

import deferq.queue.api.Controller;
import deferq.queue.api.v1.dto.HealthResponse;
import deferq.queue.service.JobService;
import deferq.queue.store.Database;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JobService jobService;

    public HealthController(Database database, JobService jobService) {
        this.database = database;
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            return ControllerResponse.of(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy("connection failed"));
        }
        return ControllerResponse.ok(HealthResponse.healthy(formatUptime(), VERSION,
                jobService.count(), jobService.countFailed()));
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}

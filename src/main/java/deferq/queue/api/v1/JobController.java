package deferq.queue.api.v1;

import deferq.queue.api.Controller;
import deferq.queue.api.v1.dto.CreateJobRequest;
import deferq.queue.api.v1.dto.JobResponse;
import deferq.queue.api.v1.dto.OperationResponse;
import deferq.queue.model.Job;
import deferq.queue.model.JobRunReport;
import deferq.queue.model.UnfailResult;
import deferq.queue.model.UnlockResult;
import deferq.queue.server.RouterHandler;
import deferq.queue.service.JobFormatter;
import deferq.queue.service.JobService;
import deferq.queue.worker.JobRunner;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job administration.
 *
 * GET /api/v1/jobs - List jobs with their status annotations
 * POST /api/v1/jobs - Enqueue a job
 * GET /api/v1/jobs/{id} - Show a job
 * POST /api/v1/jobs/{id}/unlock - Release the lock of a job
 * POST /api/v1/jobs/{id}/unfail - Discard the error of a job
 * POST /api/v1/jobs/{id}/run - Run a job now
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/(\\d+)$");
    private static final Pattern JOB_ACTION_PATTERN = Pattern.compile("^/api/v1/jobs/(\\d+)/(unlock|unfail|run)$");

    private final JobService jobService;
    private final JobRunner jobRunner;
    private final JobFormatter formatter;

    public JobController(JobService jobService, JobRunner jobRunner, JobFormatter formatter) {
        this.jobService = jobService;
        this.jobRunner = jobRunner;
        this.formatter = formatter;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (method.equals(HttpMethod.GET)) {
            return JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.POST)) {
            return JOB_ACTION_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return req.method().equals(HttpMethod.POST) ? handleCreateJob(req) : handleListJobs();
        }

        Matcher actionMatcher = JOB_ACTION_PATTERN.matcher(path);
        if (req.method().equals(HttpMethod.POST) && actionMatcher.matches()) {
            long jobId = parseId(actionMatcher.group(1));
            return switch (actionMatcher.group(2)) {
                case "unlock" -> handleUnlock(jobId);
                case "unfail" -> handleUnfail(jobId);
                default -> handleRun(jobId);
            };
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (req.method().equals(HttpMethod.GET) && jobMatcher.matches()) {
            return handleGetJob(parseId(jobMatcher.group(1)));
        }

        throw new IllegalArgumentException("unknown job endpoint: " + path);
    }

    /**
     * GET /api/v1/jobs
     */
    private ControllerResponse handleListJobs() {
        List<JobResponse> jobs = jobService.list().stream()
                .map(job -> JobResponse.from(job, formatter.statuses(job)).compact())
                .toList();

        Map<String, Object> response = Map.of(
                "total", jobs.size(),
                "jobs", jobs);

        return ControllerResponse.ok(response);
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleCreateJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateJobRequest request = RouterHandler.mapper().readValue(body, CreateJobRequest.class);

        request.validate();

        Job job = request.performAt() != null
                ? jobService.performLater(request.performAt(), request.name(), request.queue(),
                        request.frequency(), request.argsOrEmpty())
                : jobService.performAsap(request.name(), request.queue(), request.frequency(),
                        request.argsOrEmpty());

        log.debug("Job #{} enqueued over HTTP", job.id());
        return ControllerResponse.created(JobResponse.from(job, formatter.statuses(job)));
    }

    /**
     * GET /api/v1/jobs/{id}
     */
    private ControllerResponse handleGetJob(long jobId) {
        Optional<Job> jobOpt = jobService.show(jobId);

        if (jobOpt.isEmpty()) {
            return ControllerResponse.of(HttpResponseStatus.NOT_FOUND, OperationResponse.jobNotFound(jobId));
        }

        Job job = jobOpt.get();
        return ControllerResponse.ok(JobResponse.from(job, formatter.statuses(job)));
    }

    /**
     * POST /api/v1/jobs/{id}/unlock
     */
    private ControllerResponse handleUnlock(long jobId) {
        UnlockResult result = jobService.unlock(jobId);
        return switch (result) {
            case NOT_FOUND -> ControllerResponse.of(HttpResponseStatus.NOT_FOUND, OperationResponse.jobNotFound(jobId));
            case NOT_LOCKED -> ControllerResponse.ok(OperationResponse.success("Job " + jobId + " was not locked."));
            case UNLOCKED -> ControllerResponse.ok(OperationResponse.success("Job " + jobId + " lock has been released."));
        };
    }

    /**
     * POST /api/v1/jobs/{id}/unfail
     */
    private ControllerResponse handleUnfail(long jobId) {
        UnfailResult result = jobService.unfail(jobId);
        return switch (result.outcome()) {
            case NOT_FOUND -> ControllerResponse.of(HttpResponseStatus.NOT_FOUND, OperationResponse.jobNotFound(jobId));
            case NOT_FAILED -> ControllerResponse.ok(OperationResponse.success("Job " + jobId + " has not failed."));
            case UNFAILED -> ControllerResponse.ok(OperationResponse.success("Job " + jobId + " is no longer failing, was:\n"
                            + result.previousError()));
        };
    }

    /**
     * POST /api/v1/jobs/{id}/run
     */
    private ControllerResponse handleRun(long jobId) {
        JobRunReport report = jobRunner.run(jobId);
        OperationResponse response = report.isSuccess()
                ? OperationResponse.success(report.statusLine())
                : OperationResponse.error(report.statusLine());
        return ControllerResponse.of(HttpResponseStatus.valueOf(report.code()), response);
    }

    private static long parseId(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid job id: " + digits, e);
        }
    }
}

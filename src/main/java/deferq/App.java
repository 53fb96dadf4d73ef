package deferq;

import deferq.queue.config.Dependencies;
import deferq.queue.config.QueueConfig;
import deferq.queue.model.Job;
import deferq.queue.model.JobRunReport;
import deferq.queue.model.UnfailResult;
import deferq.queue.model.UnlockResult;
import deferq.queue.worker.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <pre>
 * watch [queue] [--stop-after N]   run a worker in the foreground
 * run &lt;id&gt;                         run one job now
 * list                             list all jobs
 * show &lt;id&gt;                        show one job
 * unlock &lt;id&gt;                      release the lock of a job
 * unfail &lt;id&gt;                      discard the error of a job
 * serve                            HTTP admin API plus a worker pool
 * </pre>
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final String USAGE = String.join("\n",
            "Usage: deferq <command> [arguments]",
            "  watch [queue] [--stop-after N]",
            "  run <id>",
            "  list",
            "  show <id>",
            "  unlock <id>",
            "  unfail <id>",
            "  serve");

    private final Dependencies deps;
    private final PrintStream out;

    public App(Dependencies deps, PrintStream out) {
        this.deps = deps;
        this.out = out;
    }

    public static void main(String[] args) {
        int code;
        try (Dependencies deps = Dependencies.create(QueueConfig.fromEnv())) {
            code = new App(deps, System.out).execute(args);
        } catch (Exception e) {
            log.error("deferq failed", e);
            code = 1;
        }
        System.exit(code);
    }

    /**
     * @return the process exit code
     */
    public int execute(String[] args) {
        if (args.length == 0) {
            out.println(USAGE);
            return 1;
        }

        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            return switch (args[0]) {
                case "watch" -> watch(rest);
                case "run" -> run(parseId(rest));
                case "list" -> list();
                case "show" -> show(parseId(rest));
                case "unlock" -> unlock(parseId(rest));
                case "unfail" -> unfail(parseId(rest));
                case "serve" -> serve();
                default -> {
                    out.println("Unknown command: " + args[0]);
                    out.println(USAGE);
                    yield 1;
                }
            };
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return 1;
        }
    }

    private int watch(List<String> args) {
        String queue = null;
        Integer stopAfter = null;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("--stop-after".equals(arg)) {
                if (i + 1 >= args.size()) {
                    throw new IllegalArgumentException("--stop-after requires a number");
                }
                stopAfter = parseInt(args.get(++i), "--stop-after");
            } else if (arg.startsWith("--stop-after=")) {
                stopAfter = parseInt(arg.substring("--stop-after=".length()), "--stop-after");
            } else if (queue == null) {
                queue = arg;
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }

        JobWorker worker = deps.worker(queue, stopAfter, out::println);
        Thread hook = shutdownHook(worker, deps.config().shutdownTimeout());
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            worker.watch();
        } finally {
            removeHook(hook);
        }
        return 0;
    }

    private int run(long jobId) {
        JobRunReport report = deps.jobRunner().run(jobId);
        out.println(report.statusLine());
        return report.isSuccess() ? 0 : 1;
    }

    private int list() {
        List<Job> jobs = deps.jobService().list();
        out.println(jobs.isEmpty() ? "No job to list." : deps.formatter().formatList(jobs));
        return 0;
    }

    private int show(long jobId) {
        Optional<Job> job = deps.jobService().show(jobId);
        if (job.isEmpty()) {
            out.println("Job " + jobId + " does not exist.");
            return 1;
        }
        out.println(deps.formatter().formatDetail(job.get()));
        return 0;
    }

    private int unlock(long jobId) {
        UnlockResult result = deps.jobService().unlock(jobId);
        switch (result) {
            case NOT_FOUND -> {
                out.println("Job " + jobId + " does not exist.");
                return 1;
            }
            case NOT_LOCKED -> out.println("Job " + jobId + " was not locked.");
            case UNLOCKED -> out.println("Job " + jobId + " lock has been released.");
        }
        return 0;
    }

    private int unfail(long jobId) {
        UnfailResult result = deps.jobService().unfail(jobId);
        switch (result.outcome()) {
            case NOT_FOUND -> {
                out.println("Job " + jobId + " does not exist.");
                return 1;
            }
            case NOT_FAILED -> out.println("Job " + jobId + " has not failed.");
            case UNFAILED -> out.println("Job " + jobId + " is no longer failing, was:\n" + result.previousError());
        }
        return 0;
    }

    private int serve() {
        CountDownLatch stopped = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            deps.workerPool(out::println).stop();
            deps.httpServer().stop();
            stopped.countDown();
        }, "deferq-shutdown");

        if (!deps.httpServer().start()) {
            return 1;
        }
        deps.workerPool(out::println).start();
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    private static long parseId(List<String> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("A job id is required");
        }
        try {
            return Long.parseLong(args.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid job id: " + args.get(0), e);
        }
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + value, e);
        }
    }

    /**
     * Hook that stops the worker and holds the JVM until its current job is done.
     */
    static Thread shutdownHook(JobWorker worker, Duration timeout) {
        return new Thread(() -> {
            if (!worker.stopAndAwait(timeout)) {
                log.warn("Job worker ({}) still busy after {}, exiting", worker.queue(), timeout);
            }
        }, "deferq-shutdown");
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down
            log.debug("Shutdown in progress, hook kept");
        }
    }
}

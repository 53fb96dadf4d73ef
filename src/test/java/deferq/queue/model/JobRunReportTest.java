package deferq.queue.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobRunReportTest {

    @Test
    void doneLine() {
        JobRunReport report = new JobRunReport(12, "app.SendEmail", JobRunStatus.DONE, 0.0123);
        assertEquals("job#12 (app.SendEmail): done (in 0.012 seconds)", report.statusLine());
        assertEquals(200, report.code());
        assertTrue(report.isSuccess());
    }

    @Test
    void failedLine() {
        JobRunReport report = new JobRunReport(3, "app.Sync", JobRunStatus.FAILED, 1.5);
        assertEquals("job#3 (app.Sync): failed (in 1.500 seconds)", report.statusLine());
        assertEquals(500, report.code());
        assertFalse(report.isSuccess());
    }

    @Test
    void notFoundLine() {
        JobRunReport report = JobRunReport.notFound(42);
        assertEquals("Job 42 does not exist.", report.statusLine());
        assertEquals(404, report.code());
    }

    @Test
    void lockedLine() {
        Job job = Job.builder().id(5L).name("app.Sync").performAt(Instant.EPOCH).build();
        JobRunReport report = JobRunReport.locked(job);
        assertEquals("Job 5 is locked by another worker.", report.statusLine());
        assertEquals(500, report.code());
        assertEquals(JobRunStatus.LOCKED, report.status());
    }
}

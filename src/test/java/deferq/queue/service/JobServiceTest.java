package deferq.queue.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import deferq.queue.MutableClock;
import deferq.queue.config.QueueConfig;
import deferq.queue.model.Job;
import deferq.queue.model.UnfailResult;
import deferq.queue.model.UnlockResult;
import deferq.queue.store.Database;
import deferq.queue.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private static Database db;
    private static JdbcJobRepository repo;
    private static QueueConfig config;

    private MutableClock clock;
    private JobLockManager lockManager;
    private JobService service;

    @BeforeAll
    static void setup() {
        config = QueueConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcJobRepository(db, new ObjectMapper());
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
        clock = MutableClock.at("2023-04-20T12:00:00Z");
        lockManager = new JobLockManager(repo, clock, config.lockTimeout());
        service = new JobService(repo, lockManager, config, clock);
    }

    @Test
    void performAsapUsesNowAndTheDefaultQueue() {
        Job job = service.performAsap("app.SendEmail", null, null, List.of("alix@example.com"));

        assertNotNull(job.id());
        assertEquals(clock.instant(), job.performAt());
        assertEquals(Job.DEFAULT_QUEUE, job.queue());
        assertEquals("", job.frequency());
        assertEquals(List.of("alix@example.com"), job.args());
        assertEquals(clock.instant(), job.createdAt());
    }

    @Test
    void performLater() {
        Instant later = clock.instant().plus(Duration.ofDays(1));

        Job job = service.performLater(later, "app.Report", "reports", "+1 day", List.of());

        Job stored = service.show(job.id()).orElseThrow();
        assertEquals(later, stored.performAt());
        assertEquals("reports", stored.queue());
        assertEquals("+1 day", stored.frequency());
        assertTrue(service.findNextJobId("reports").isEmpty());
    }

    @Test
    void enqueueValidation() {
        assertThrows(IllegalArgumentException.class, () -> service.performAsap(" ", null, null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> service.performAsap("x", "all", null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> service.performAsap("x", "", null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> service.performAsap("x", null, "sometimes", List.of()));
        assertTrue(service.list().isEmpty());
    }

    @Test
    void findNextJobIdHonoursQueueAndTime() {
        Job mail = service.performAsap("mail", "mailers", null, List.of());
        service.performLater(clock.instant().plusSeconds(60), "later", "mailers", null, List.of());

        assertEquals(Optional.of(mail.id()), service.findNextJobId("mailers"));
        assertEquals(Optional.of(mail.id()), service.findNextJobId("all"));
        assertTrue(service.findNextJobId("fetchers").isEmpty());
    }

    @Test
    void findNextJobIdSkipsJobsBeyondMaxAttempts() {
        Job job = service.performAsap("flaky", null, null, List.of());
        repo.update(job.toBuilder().numberAttempts(config.maxAttempts() + 1).build());

        assertTrue(service.findNextJobId("all").isEmpty());
    }

    @Test
    void enqueueRejectsHugeFrequencies() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> service.performAsap("app.Report", null, "+999999999 years", List.of()));
        assertEquals("frequency is too large: +999999999 years", e.getMessage());
        assertTrue(service.list().isEmpty());
    }

    @Test
    void listIsOrderedById() {
        Job first = service.performLater(clock.instant().plusSeconds(10), "first", null, null, List.of());
        Job second = service.performAsap("second", null, null, List.of());

        assertEquals(List.of(first.id(), second.id()), service.list().stream().map(Job::id).toList());
    }

    @Test
    void unlockOutcomes() {
        Job job = service.performAsap("x", null, null, List.of());

        assertEquals(UnlockResult.NOT_FOUND, service.unlock(424242));
        assertEquals(UnlockResult.NOT_LOCKED, service.unlock(job.id()));

        lockManager.lock(job);
        assertTrue(service.isLocked(service.show(job.id()).orElseThrow()));
        assertEquals(UnlockResult.UNLOCKED, service.unlock(job.id()));
        assertNull(service.show(job.id()).orElseThrow().lockedAt());
    }

    @Test
    void staleLockIsReportedAsNotLocked() {
        Job job = service.performAsap("x", null, null, List.of());
        lockManager.lock(job);

        clock.advance(Duration.ofHours(2));

        assertEquals(UnlockResult.NOT_LOCKED, service.unlock(job.id()));
    }

    @Test
    void unfailOutcomes() {
        Job job = service.performAsap("x", null, null, List.of());
        assertEquals(UnfailResult.Outcome.NOT_FOUND, service.unfail(424242).outcome());
        assertEquals(UnfailResult.Outcome.NOT_FAILED, service.unfail(job.id()).outcome());

        Instant retry = clock.instant().plusSeconds(6);
        repo.update(job.toBuilder()
                .numberAttempts(1)
                .performAt(retry)
                .failedAt(clock.instant())
                .lastError("java.lang.RuntimeException: boom")
                .build());

        UnfailResult result = service.unfail(job.id());

        assertEquals(UnfailResult.Outcome.UNFAILED, result.outcome());
        assertEquals("java.lang.RuntimeException: boom", result.previousError());

        Job stored = service.show(job.id()).orElseThrow();
        assertFalse(stored.hasFailed());
        assertEquals("", stored.lastError());
        assertEquals(retry, stored.performAt());
        assertEquals(1, stored.numberAttempts());
    }
}

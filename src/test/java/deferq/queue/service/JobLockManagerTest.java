package deferq.queue.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import deferq.queue.MutableClock;
import deferq.queue.config.QueueConfig;
import deferq.queue.model.Job;
import deferq.queue.store.Database;
import deferq.queue.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobLockManagerTest {

    private static Database db;
    private static JdbcJobRepository repo;

    private MutableClock clock;
    private JobLockManager lockManager;

    @BeforeAll
    static void setup() {
        QueueConfig config = QueueConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-locks;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
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
        lockManager = new JobLockManager(repo, clock, Duration.ofHours(1));
    }

    private Job stored() {
        return repo.create(Job.builder().name("app.Job").performAt(clock.instant()).build());
    }

    @Test
    void lockSetsLockedAtToNow() {
        Job job = stored();

        Optional<Job> locked = lockManager.lock(job);

        assertTrue(locked.isPresent());
        assertEquals(clock.instant(), locked.get().lockedAt());
        assertEquals(clock.instant(), repo.findById(job.id()).orElseThrow().lockedAt());
        assertTrue(lockManager.isLocked(locked.get()));
    }

    @Test
    void secondCallerLoses() {
        Job job = stored();

        assertTrue(lockManager.lock(job).isPresent());
        assertTrue(lockManager.lock(job).isEmpty());
    }

    @Test
    void lockCanBeTakenOverOnceStale() {
        Job job = stored();
        lockManager.lock(job);

        clock.advance(Duration.ofMinutes(59));
        assertTrue(lockManager.lock(job).isEmpty());

        clock.advance(Duration.ofMinutes(1));
        Optional<Job> relocked = lockManager.lock(job);
        assertTrue(relocked.isPresent());
        assertEquals(clock.instant(), relocked.get().lockedAt());
    }

    @Test
    void customTimeout() {
        Job job = stored();
        lockManager.lock(job);

        clock.advance(Duration.ofMinutes(5));

        assertTrue(lockManager.lock(job, Duration.ofMinutes(10)).isEmpty());
        assertTrue(lockManager.lock(job, Duration.ofMinutes(5)).isPresent());
    }

    @Test
    void unlockIsUnconditional() {
        Job job = stored();
        Job locked = lockManager.lock(job).orElseThrow();

        assertTrue(lockManager.unlock(locked));
        assertNull(repo.findById(job.id()).orElseThrow().lockedAt());
        assertTrue(lockManager.lock(job).isPresent());
    }

    @Test
    void unlockOfDeletedJobChangesNothing() {
        Job job = stored();
        repo.delete(job.id());

        assertFalse(lockManager.unlock(job));
    }

    @Test
    void isLockedFollowsTheTimeout() {
        Job job = Job.builder().id(1L).name("x").performAt(clock.instant())
                .lockedAt(clock.instant().minus(Duration.ofMinutes(30)))
                .build();

        assertTrue(lockManager.isLocked(job));
        assertFalse(lockManager.isLocked(job, Duration.ofMinutes(30)));
    }

    @Test
    void unsavedJobCannotBeLocked() {
        Job unsaved = Job.builder().name("x").performAt(Instant.EPOCH).build();
        assertThrows(IllegalArgumentException.class, () -> lockManager.lock(unsaved));
    }
}

package deferq.queue.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    private static final Instant NOW = Instant.parse("2023-04-20T12:00:00Z");

    @Test
    void builderDefaults() {
        Job job = Job.builder()
                .name("app.CleanupJob")
                .performAt(NOW)
                .build();

        assertNull(job.id());
        assertEquals(Job.DEFAULT_QUEUE, job.queue());
        assertEquals(0, job.numberAttempts());
        assertEquals("", job.frequency());
        assertEquals("", job.lastError());
        assertTrue(job.args().isEmpty());
        assertFalse(job.isRecurring());
        assertFalse(job.hasFailed());
    }

    @Test
    void nameAndPerformAtAreRequired() {
        assertThrows(NullPointerException.class, () -> Job.builder().performAt(NOW).build());
        assertThrows(NullPointerException.class, () -> Job.builder().name("x").build());
    }

    @Test
    void negativeAttemptsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Job.builder().name("x").performAt(NOW).numberAttempts(-1).build());
    }

    @Test
    void argsAreCopiedAndUnmodifiable() {
        List<Object> args = new ArrayList<>(List.of("a", 1));
        Job job = Job.builder().name("x").performAt(NOW).args(args).build();

        args.add("b");

        assertEquals(List.of("a", 1), job.args());
        assertThrows(UnsupportedOperationException.class, () -> job.args().add("c"));
    }

    @Test
    void frequencyMakesAJobRecurring() {
        Job job = Job.builder().name("x").performAt(NOW).frequency(" +1 hour ").build();
        assertTrue(job.isRecurring());
        assertEquals("+1 hour", job.frequency());
    }

    @Test
    void lockExpiresAfterTimeout() {
        Duration hour = Duration.ofHours(1);
        Job job = Job.builder().name("x").performAt(NOW).lockedAt(NOW.minus(Duration.ofMinutes(59))).build();
        assertTrue(job.isLocked(NOW, hour));

        Job stale = job.toBuilder().lockedAt(NOW.minus(hour)).build();
        assertFalse(stale.isLocked(NOW, hour));

        Job unlocked = job.toBuilder().lockedAt(null).build();
        assertFalse(unlocked.isLocked(NOW, hour));
    }

    @Test
    void toBuilderKeepsEverything() {
        Job job = Job.builder()
                .id(7L)
                .name("x")
                .queue("mailers")
                .performAt(NOW)
                .numberAttempts(3)
                .frequency("+1 day")
                .failedAt(NOW)
                .lastError("boom")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();

        Job copy = job.toBuilder().build();

        assertEquals(job, copy);
        assertEquals("mailers", copy.queue());
        assertEquals(3, copy.numberAttempts());
        assertEquals("boom", copy.lastError());
        assertTrue(copy.hasFailed());
    }

    @Test
    void equalityIsById() {
        Job a = Job.builder().id(1L).name("a").performAt(NOW).build();
        Job b = Job.builder().id(1L).name("b").performAt(NOW.plusSeconds(5)).build();
        Job unsaved = Job.builder().name("a").performAt(NOW).build();

        assertEquals(a, b);
        assertNotEquals(a, unsaved);
        assertNotEquals(unsaved, Job.builder().name("a").performAt(NOW).build());
    }
}

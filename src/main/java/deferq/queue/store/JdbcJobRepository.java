package deferq.queue.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import deferq.queue.model.Job;
import deferq.queue.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobRepository.
 * Locking is a single conditional UPDATE so the database arbitrates races
 * between workers.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);
    private static final TypeReference<List<Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final Database db;
    private final ObjectMapper mapper;

    public JdbcJobRepository(Database db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
    }

    @Override
    public Job create(Job job) {
        Instant createdAt = job.createdAt() != null ? job.createdAt() : Instant.now();
        Instant updatedAt = job.updatedAt() != null ? job.updatedAt() : createdAt;
        String sql = """
                    INSERT INTO jobs (name, args, queue, perform_at, number_attempts, frequency,
                                      locked_at, failed_at, last_error, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, job.name());
            ps.setString(2, writeArgs(job.args()));
            ps.setString(3, job.queue());
            setTimestamp(ps, 4, job.performAt());
            ps.setInt(5, job.numberAttempts());
            ps.setString(6, job.frequency());
            setTimestamp(ps, 7, job.lockedAt());
            setTimestamp(ps, 8, job.failedAt());
            ps.setString(9, job.lastError());
            setTimestamp(ps, 10, createdAt);
            setTimestamp(ps, 11, updatedAt);

            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for job " + job.name());
                }
                id = keys.getLong(1);
            }
            conn.commit();

            log.debug("Job {} stored as #{} in queue {}", job.name(), id, job.queue());
            return job.toBuilder().id(id).createdAt(createdAt).updatedAt(updatedAt).build();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create job: " + job.name(), e);
        }
    }

    @Override
    public Optional<Job> findById(long jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findAll() {
        String sql = "SELECT * FROM jobs ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list jobs", e);
        }
    }

    @Override
    public long count() {
        return count("SELECT COUNT(*) FROM jobs");
    }

    @Override
    public long countFailed() {
        return count("SELECT COUNT(*) FROM jobs WHERE failed_at IS NOT NULL");
    }

    private long count(String sql) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
    }

    @Override
    public Optional<Long> findNextJobId(String queue, Instant now, Instant lockedBefore, int maxAttempts) {
        boolean allQueues = Job.ALL_QUEUES.equals(queue);
        String sql = """
                    SELECT id FROM jobs
                    WHERE (locked_at IS NULL OR locked_at <= ?)
                    AND perform_at <= ?
                    AND (number_attempts <= ? OR frequency <> '')
                """
                + (allQueues ? "" : "AND queue = ?\n")
                + "ORDER BY perform_at ASC, id ASC LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, lockedBefore);
            setTimestamp(ps, 2, now);
            ps.setInt(3, maxAttempts);
            if (!allQueues) {
                ps.setString(4, queue);
            }

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getLong(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find next job in queue: " + queue, e);
        }
    }

    @Override
    public boolean lock(long jobId, Instant lockedAt, Instant lockedBefore) {
        String sql = """
                    UPDATE jobs
                    SET locked_at = ?
                    WHERE id = ?
                    AND (locked_at IS NULL OR locked_at <= ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, lockedAt);
            ps.setLong(2, jobId);
            setTimestamp(ps, 3, lockedBefore);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 1) {
                log.debug("Job {} locked at {}", jobId, lockedAt);
            }

            return updated == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to lock job: " + jobId, e);
        }
    }

    @Override
    public boolean unlock(long jobId) {
        String sql = "UPDATE jobs SET locked_at = NULL WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            int updated = ps.executeUpdate();
            conn.commit();

            return updated == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to unlock job: " + jobId, e);
        }
    }

    @Override
    public boolean update(Job job) {
        if (job.id() == null) {
            throw new IllegalArgumentException("Cannot update a job without id");
        }

        String sql = """
                    UPDATE jobs
                    SET perform_at = ?, number_attempts = ?, failed_at = ?, last_error = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, job.performAt());
            ps.setInt(2, job.numberAttempts());
            setTimestamp(ps, 3, job.failedAt());
            ps.setString(4, job.lastError());
            setTimestamp(ps, 5, job.updatedAt() != null ? job.updatedAt() : Instant.now());
            ps.setLong(6, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + job.id(), e);
        }
    }

    @Override
    public boolean delete(long jobId) {
        String sql = "DELETE FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.debug("Job {} deleted", jobId);
            }

            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete job: " + jobId, e);
        }
    }

    // Helper methods

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .args(readArgs(rs.getLong("id"), rs.getString("args")))
                .queue(rs.getString("queue"))
                .performAt(getInstant(rs, "perform_at"))
                .numberAttempts(rs.getInt("number_attempts"))
                .frequency(rs.getString("frequency"))
                .lockedAt(getInstant(rs, "locked_at"))
                .failedAt(getInstant(rs, "failed_at"))
                .lastError(rs.getString("last_error"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }

    private String writeArgs(List<Object> args) {
        try {
            return mapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job arguments cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private List<Object> readArgs(long jobId, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, ARGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupted arguments for job: " + jobId, e);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, instant.atOffset(ZoneOffset.UTC));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }
}

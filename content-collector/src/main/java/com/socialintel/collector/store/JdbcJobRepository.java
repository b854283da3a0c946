package com.socialintel.collector.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialintel.collector.model.Job;
import com.socialintel.collector.model.JobError;
import com.socialintel.collector.model.JobParameters;
import com.socialintel.collector.model.JobResult;
import com.socialintel.collector.model.JobStatus;
import com.socialintel.collector.model.JobType;
import com.socialintel.collector.model.Metrics;
import com.socialintel.collector.model.Phase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Job records in a relational table. Status, type and priority are typed columns; parameters,
 * metrics, result and the error log are JSON documents.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcJobRepository implements JobRepository {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void ensureSchema() {
        log.info("Ensuring job schema exists...");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collection_jobs
            (
                id              VARCHAR(36)   PRIMARY KEY,
                job_type        VARCHAR(32)   NOT NULL,
                status          VARCHAR(16)   NOT NULL,
                priority        INT           NOT NULL,
                owner           VARCHAR(128),
                current_phase   VARCHAR(16),
                parameters      CLOB          NOT NULL,
                metrics         CLOB          NOT NULL,
                result          CLOB,
                errors          CLOB,
                error_count     BIGINT        DEFAULT 0 NOT NULL,
                last_error      VARCHAR(2000),
                created_at      TIMESTAMP     NOT NULL,
                started_at      TIMESTAMP,
                finished_at     TIMESTAMP
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_collection_jobs_status ON collection_jobs (status, priority)");
        log.info("Job schema ready.");
    }

    @Override
    public void save(Job job) {
        Object[] values = {
                job.getType().name(),
                job.getStatus().name(),
                job.getPriority(),
                job.getOwner(),
                job.getCurrentPhase().name(),
                toJson(job.getParameters()),
                toJson(job.metrics()),
                job.getResult() == null ? null : toJson(job.getResult()),
                toJson(job.getErrors()),
                job.getErrorCount(),
                truncate(job.getLastError()),
                timestamp(job.getCreatedAt()),
                timestamp(job.getStartedAt()),
                timestamp(job.getFinishedAt()),
                job.getId()
        };
        int updated = jdbcTemplate.update("""
            UPDATE collection_jobs SET
                job_type = ?, status = ?, priority = ?, owner = ?, current_phase = ?,
                parameters = ?, metrics = ?, result = ?, errors = ?, error_count = ?, last_error = ?,
                created_at = ?, started_at = ?, finished_at = ?
            WHERE id = ?
            """, values);
        if (updated == 0) {
            jdbcTemplate.update("""
                INSERT INTO collection_jobs
                (job_type, status, priority, owner, current_phase,
                 parameters, metrics, result, errors, error_count, last_error,
                 created_at, started_at, finished_at, id)
                VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                """, values);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        List<Job> jobs = jdbcTemplate.query("SELECT * FROM collection_jobs WHERE id = ?", jobMapper(), jobId);
        return jobs.stream().findFirst();
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        return jdbcTemplate.query(
                "SELECT * FROM collection_jobs WHERE status = ? ORDER BY priority DESC, created_at",
                jobMapper(), status.name());
    }

    @Override
    public boolean compareAndSetStatus(String jobId, JobStatus expected, JobStatus next, Instant at) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Transition " + expected + " -> " + next + " is not allowed");
        }
        String timeColumn = next == JobStatus.PROCESSING ? "started_at" : "finished_at";
        int updated = jdbcTemplate.update(
                "UPDATE collection_jobs SET status = ?, " + timeColumn + " = ? WHERE id = ? AND status = ?",
                next.name(), timestamp(at), jobId, expected.name());
        return updated == 1;
    }

    @Override
    public void updateProgress(String jobId, Metrics metrics, Phase phase) {
        // a terminal row keeps the counters it finished with
        int updated = jdbcTemplate.update(
                "UPDATE collection_jobs SET metrics = ?, current_phase = ? WHERE id = ? AND status = ?",
                toJson(metrics), phase.name(), jobId, JobStatus.PROCESSING.name());
        if (updated == 0) {
            log.debug("Progress for job {} ignored: not processing", jobId);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RowMapper<Job> jobMapper() {
        return (rs, rowNum) -> {
            JobType type = JobType.valueOf(rs.getString("job_type"));
            String resultJson = rs.getString("result");
            String errorsJson = rs.getString("errors");
            return Job.restore(
                    rs.getString("id"),
                    fromJson(rs.getString("parameters"), type.parametersType()),
                    rs.getInt("priority"),
                    rs.getString("owner"),
                    instant(rs, "created_at"),
                    JobStatus.valueOf(rs.getString("status")),
                    rs.getString("current_phase") == null ? null : Phase.valueOf(rs.getString("current_phase")),
                    fromJson(rs.getString("metrics"), Metrics.class),
                    errorsJson == null ? List.of() : fromJson(errorsJson, new TypeReference<List<JobError>>() {}),
                    rs.getLong("error_count"),
                    rs.getString("last_error"),
                    resultJson == null ? null : fromJson(resultJson, JobResult.class),
                    instant(rs, "started_at"),
                    instant(rs, "finished_at"));
        };
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored " + type.getSimpleName() + " is not readable", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored " + type.getType() + " is not readable", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}

package com.propertyintel.listings.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.model.ApiRequestRecord;
import com.propertyintel.listings.model.ScanRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Observability tables: one row per scan job, one row per outbound API call.
 *
 * Writes here are best-effort. A failure is logged and dropped so that
 * bookkeeping can never fail a scan.
 */
@Component
@Slf4j
public class ScanLedgerWriter {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final DatabaseDialect dialect;

    public ScanLedgerWriter(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.dialect = DatabaseDialect.detect(jdbcTemplate);
    }

    public void ensureSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scan_runs
            (
                job_id              VARCHAR(100) PRIMARY KEY,
                job_type            VARCHAR(50) NOT NULL,
                started_at          TIMESTAMP NOT NULL,
                completed_at        TIMESTAMP,
                status              VARCHAR(20) NOT NULL,
                total_pages         INTEGER NOT NULL,
                total_properties    INTEGER NOT NULL,
                deactivated_count   INTEGER,
                error_message       VARCHAR
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS api_requests
            (
                id                  UUID PRIMARY KEY,
                request_type        VARCHAR(50) NOT NULL,
                endpoint            VARCHAR(255) NOT NULL,
                status_code         INTEGER,
                duration_ms         INTEGER,
                request_params      %s,
                error_message       VARCHAR,
                job_id              VARCHAR(100),
                created_at          TIMESTAMP NOT NULL
            )
        """.formatted(dialect.jsonType()));

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_api_requests_created_at ON api_requests(created_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_api_requests_job_id ON api_requests(job_id)");
    }

    public void writeScanRun(ScanRun run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO scan_runs
                (job_id, job_type, started_at, completed_at, status,
                 total_pages, total_properties, deactivated_count, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    run.getJobId(),
                    run.getJobType(),
                    timestamp(run.getStartedAt()),
                    timestamp(run.getCompletedAt()),
                    run.getStatus(),
                    run.getTotalPages(),
                    run.getTotalProperties(),
                    run.getDeactivatedCount(),
                    run.getErrorMessage());
        } catch (Exception e) {
            log.warn("Failed to write scan run {}: {}", run.getJobId(), e.getMessage());
        }
    }

    public void writeApiRequest(ApiRequestRecord request) {
        try {
            String params = request.getRequestParams() == null
                    ? null
                    : objectMapper.writeValueAsString(request.getRequestParams());
            jdbcTemplate.update("""
                INSERT INTO api_requests
                (id, request_type, endpoint, status_code, duration_ms, request_params,
                 error_message, job_id, created_at)
                VALUES (?, ?, ?, ?, ?, %s, ?, ?, ?)
                """.formatted(dialect.jsonParam()),
                    UUID.randomUUID(),
                    request.getRequestType(),
                    request.getEndpoint(),
                    request.getStatusCode(),
                    request.getDurationMs(),
                    params,
                    request.getErrorMessage(),
                    request.getJobId(),
                    timestamp(clock.instant()));
            log.debug("Tracked {} request to {} (status={}, {}ms)",
                    request.getRequestType(), request.getEndpoint(),
                    request.getStatusCode(), request.getDurationMs());
        } catch (Exception e) {
            log.warn("Failed to track API request: {}", e.getMessage());
        }
    }

    private static LocalDateTime timestamp(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
